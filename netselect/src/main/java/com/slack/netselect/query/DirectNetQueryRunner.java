package com.slack.netselect.query;

import com.google.common.util.concurrent.ListenableFuture;
import com.slack.netselect.codec.TenantId;
import com.slack.netselect.logstore.DataBlockWriter;
import com.slack.netselect.util.StopSignalContext;
import io.grpc.Context;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends the query to the storage nodes unchanged, in a single fan-out. */
public class DirectNetQueryRunner implements NetQueryRunner {
  private static final Logger LOG = LoggerFactory.getLogger(DirectNetQueryRunner.class);

  @Override
  public void run(
      Context ctx,
      List<TenantId> tenantIds,
      Query query,
      int concurrency,
      Search search,
      DataBlockWriter writeBlock)
      throws IOException {
    LOG.debug(
        "Running query={} for tenants={} with concurrency={}", query, tenantIds, concurrency);
    ListenableFuture<Void> stopSignal = StopSignalContext.stopSignalOf(ctx);
    try {
      search.search(stopSignal, query, writeBlock);
    } finally {
      // Detaches the signal from ctx, which may outlive this run.
      stopSignal.cancel(false);
    }
  }
}
