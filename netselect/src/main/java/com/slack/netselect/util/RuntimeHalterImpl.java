package com.slack.netselect.util;

import org.apache.logging.log4j.LogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stops the JVM without running shutdown hooks, after flushing the logs. */
public class RuntimeHalterImpl {
  private static final Logger LOG = LoggerFactory.getLogger(RuntimeHalterImpl.class);

  public void handleFatal(Throwable t) {
    LOG.error("Runtime halter is called, probably due to a fatal error. Shutting down.", t);
    LogManager.shutdown();
    Runtime.getRuntime().halt(1);
  }
}
