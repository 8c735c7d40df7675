package com.slack.netselect.query;

import com.google.common.util.concurrent.ListenableFuture;
import com.slack.netselect.codec.TenantId;
import com.slack.netselect.logstore.DataBlockWriter;
import io.grpc.Context;
import java.io.IOException;
import java.util.List;

/**
 * Wraps one streaming fan-out with query rewriting. A runner may split the query into remote and
 * local parts, decide how many sub-queries to send and at what concurrency, and post-process the
 * returned blocks before they reach the caller's writer.
 */
public interface NetQueryRunner {

  /** A single fan-out of a (sub-)query to every storage node. */
  @FunctionalInterface
  interface Search {
    void search(ListenableFuture<?> stopSignal, Query query, DataBlockWriter writeBlock)
        throws IOException;
  }

  void run(
      Context ctx,
      List<TenantId> tenantIds,
      Query query,
      int concurrency,
      Search search,
      DataBlockWriter writeBlock)
      throws IOException;
}
