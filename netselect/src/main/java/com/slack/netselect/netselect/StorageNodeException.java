package com.slack.netselect.netselect;

import java.io.IOException;

/** A request to a single storage node failed. The message names the request URL. */
public class StorageNodeException extends IOException {

  public StorageNodeException(String message) {
    super(message);
  }

  public StorageNodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
