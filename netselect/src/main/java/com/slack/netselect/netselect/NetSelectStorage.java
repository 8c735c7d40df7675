package com.slack.netselect.netselect;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.linecorp.armeria.client.ClientFactory;
import com.slack.netselect.codec.TenantId;
import com.slack.netselect.codec.ValueWithHits;
import com.slack.netselect.logstore.DataBlockWriter;
import com.slack.netselect.logstore.QueryEngine;
import com.slack.netselect.logstore.ValuesWithHitsMerger;
import com.slack.netselect.proto.config.NetSelectConfigs;
import com.slack.netselect.query.DirectNetQueryRunner;
import com.slack.netselect.query.NetQueryRunner;
import com.slack.netselect.query.Query;
import com.slack.netselect.util.StopSignalContext;
import io.grpc.Context;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query engine backed by a set of remote storage nodes. Every call is sent to all nodes at once
 * and the per-node results are combined: query results are streamed to the caller tagged with the
 * index of the node that produced them, value lists are merged.
 *
 * <p>The first failing node cancels the requests still in flight to its siblings. The error
 * reported to the caller is the failure of the lowest-indexed node that did not fail merely
 * because of that cancellation.
 */
public class NetSelectStorage implements QueryEngine {
  private static final Logger LOG = LoggerFactory.getLogger(NetSelectStorage.class);

  public static final String NODE_REQUESTS_FAILED = "netselect_node_requests_failed_total";

  private final boolean disableCompression;
  private final NetQueryRunner netQueryRunner;
  private final MeterRegistry meterRegistry;

  private volatile List<StorageNode> nodes;

  public NetSelectStorage(
      List<NetSelectConfigs.StorageNodeConfig> nodeConfigs,
      boolean disableCompression,
      AuthHeaderProvider authHeaderProvider,
      NetQueryRunner netQueryRunner,
      ClientFactory clientFactory,
      MeterRegistry meterRegistry) {
    checkArgument(!nodeConfigs.isEmpty(), "at least one storage node must be configured");
    this.disableCompression = disableCompression;
    this.netQueryRunner = netQueryRunner;
    this.meterRegistry = meterRegistry;

    List<StorageNode> sns = new ArrayList<>(nodeConfigs.size());
    for (NetSelectConfigs.StorageNodeConfig nodeConfig : nodeConfigs) {
      checkArgument(!nodeConfig.getAddr().isEmpty(), "storage node addr can't be empty");
      sns.add(
          new StorageNode(
              this, nodeConfig.getAddr(), nodeConfig.getTls(), authHeaderProvider, clientFactory));
      // Register the failure counters up front so every node shows up in the scrape.
      failedRequestsCounter(nodeConfig.getAddr());
    }
    this.nodes = List.copyOf(sns);
    LOG.info("Created netselect storage with {} storage nodes: {}", sns.size(), sns);
  }

  public static NetSelectStorage fromConfig(
      NetSelectConfigs.SelectConfig selectConfig, MeterRegistry meterRegistry) {
    return new NetSelectStorage(
        selectConfig.getStorageNodesList(),
        selectConfig.getDisableCompression(),
        AuthHeaderProvider.NONE,
        new DirectNetQueryRunner(),
        ClientFactory.ofDefault(),
        meterRegistry);
  }

  /** Makes the storage unusable. Calls already past their node lookup run to completion. */
  public void stop() {
    nodes = null;
    LOG.info("Stopped netselect storage");
  }

  public boolean isCompressionDisabled() {
    return disableCompression;
  }

  @VisibleForTesting
  List<StorageNode> getNodes() {
    List<StorageNode> sns = nodes;
    if (sns == null) {
      throw new IllegalStateException("netselect storage is stopped");
    }
    return sns;
  }

  @Override
  public void runQuery(
      Context ctx, List<TenantId> tenantIds, Query query, DataBlockWriter writeBlock)
      throws IOException {
    netQueryRunner.run(
        ctx,
        tenantIds,
        query,
        query.getConcurrency(),
        (stopSignal, q, w) -> runQuery(stopSignal, tenantIds, q, w),
        writeBlock);
  }

  /**
   * Streams the query from every node until all of them finish or stopSignal fires. Blocks are
   * passed to writeBlock with the node index as the worker id.
   */
  @VisibleForTesting
  void runQuery(
      ListenableFuture<?> stopSignal,
      List<TenantId> tenantIds,
      Query query,
      DataBlockWriter writeBlock)
      throws IOException {
    List<StorageNode> sns = getNodes();
    Context.CancellableContext ctx = StopSignalContext.newStopSignalContext(stopSignal);
    try {
      List<ListenableFuture<Void>> futures = new ArrayList<>(sns.size());
      for (int i = 0; i < sns.size(); i++) {
        int nodeIdx = i;
        ListenableFuture<Void> future =
            sns.get(i).runQuery(ctx, tenantIds, query, block -> writeBlock.write(nodeIdx, block));
        cancelOnFailure(future, ctx);
        futures.add(future);
      }
      awaitAll(futures, ctx);
      throwFirstNonCancelError(futures, sns);
    } finally {
      ctx.cancel(null);
    }
  }

  @Override
  public List<ValueWithHits> getFieldNames(Context ctx, List<TenantId> tenantIds, Query query)
      throws IOException {
    return getValuesWithHits(
        ctx, 0, false, (nodeCtx, sn) -> sn.getFieldNames(nodeCtx, tenantIds, query));
  }

  @Override
  public List<ValueWithHits> getFieldValues(
      Context ctx, List<TenantId> tenantIds, Query query, String fieldName, long limit)
      throws IOException {
    return getValuesWithHits(
        ctx,
        limit,
        true,
        (nodeCtx, sn) -> sn.getFieldValues(nodeCtx, tenantIds, query, fieldName, limit));
  }

  @Override
  public List<ValueWithHits> getStreamFieldNames(
      Context ctx, List<TenantId> tenantIds, Query query) throws IOException {
    return getValuesWithHits(
        ctx, 0, false, (nodeCtx, sn) -> sn.getStreamFieldNames(nodeCtx, tenantIds, query));
  }

  @Override
  public List<ValueWithHits> getStreamFieldValues(
      Context ctx, List<TenantId> tenantIds, Query query, String fieldName, long limit)
      throws IOException {
    return getValuesWithHits(
        ctx,
        limit,
        true,
        (nodeCtx, sn) -> sn.getStreamFieldValues(nodeCtx, tenantIds, query, fieldName, limit));
  }

  @Override
  public List<ValueWithHits> getStreams(
      Context ctx, List<TenantId> tenantIds, Query query, long limit) throws IOException {
    return getValuesWithHits(
        ctx, limit, true, (nodeCtx, sn) -> sn.getStreams(nodeCtx, tenantIds, query, limit));
  }

  @Override
  public List<ValueWithHits> getStreamIds(
      Context ctx, List<TenantId> tenantIds, Query query, long limit) throws IOException {
    return getValuesWithHits(
        ctx, limit, true, (nodeCtx, sn) -> sn.getStreamIds(nodeCtx, tenantIds, query, limit));
  }

  @FunctionalInterface
  private interface NodeCall {
    ListenableFuture<List<ValueWithHits>> call(Context ctx, StorageNode sn);
  }

  private List<ValueWithHits> getValuesWithHits(
      Context parent, long limit, boolean resetHitsOnLimitExceeded, NodeCall nodeCall)
      throws IOException {
    List<StorageNode> sns = getNodes();
    Context.CancellableContext ctx = parent.withCancellation();
    try {
      List<ListenableFuture<List<ValueWithHits>>> futures = new ArrayList<>(sns.size());
      for (StorageNode sn : sns) {
        ListenableFuture<List<ValueWithHits>> future = nodeCall.call(ctx, sn);
        cancelOnFailure(future, ctx);
        futures.add(future);
      }
      awaitAll(futures, ctx);
      throwFirstNonCancelError(futures, sns);

      List<List<ValueWithHits>> results = new ArrayList<>(futures.size());
      for (ListenableFuture<List<ValueWithHits>> future : futures) {
        results.add(getDoneUnchecked(future));
      }
      return ValuesWithHitsMerger.merge(results, limit, resetHitsOnLimitExceeded);
    } finally {
      ctx.cancel(null);
    }
  }

  private static void cancelOnFailure(ListenableFuture<?> future, Context.CancellableContext ctx) {
    future.addListener(
        () -> {
          if (failureOf(future) != null) {
            ctx.cancel(null);
          }
        },
        directExecutor());
  }

  private static void awaitAll(
      List<? extends ListenableFuture<?>> futures, Context.CancellableContext ctx)
      throws IOException {
    try {
      Futures.successfulAsList(futures).get();
    } catch (InterruptedException e) {
      ctx.cancel(e);
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted =
          new InterruptedIOException("interrupted while waiting for storage nodes");
      interrupted.initCause(e);
      throw interrupted;
    } catch (ExecutionException e) {
      // successfulAsList never fails, per-node failures are read from the futures below.
      throw new IOException("unexpected failure while waiting for storage nodes", e.getCause());
    }
  }

  /** Throws the failure of the lowest-indexed node that did not fail because of cancellation. */
  @VisibleForTesting
  void throwFirstNonCancelError(
      List<? extends ListenableFuture<?>> futures, List<StorageNode> sns) throws IOException {
    Throwable firstError = null;
    for (int i = 0; i < futures.size(); i++) {
      Throwable t = failureOf(futures.get(i));
      if (t == null || StopSignalContext.isCancellation(t)) {
        continue;
      }
      String addr = sns.get(i).getAddr();
      failedRequestsCounter(addr).increment();
      LOG.debug("Request to storage node {} failed", addr, t);
      if (firstError == null) {
        firstError = t;
      }
    }
    if (firstError == null) {
      return;
    }
    if (firstError instanceof IOException e) {
      throw e;
    }
    throw new StorageNodeException(firstError.getMessage(), firstError);
  }

  private static Throwable failureOf(ListenableFuture<?> future) {
    if (!future.isDone()) {
      return null;
    }
    try {
      Futures.getDone(future);
      return null;
    } catch (ExecutionException e) {
      return e.getCause();
    } catch (RuntimeException e) {
      // CancellationException for cancelled futures.
      return e;
    }
  }

  /** Only called once no node has a real failure, so anything left is a cancellation. */
  private static <T> T getDoneUnchecked(ListenableFuture<T> future) {
    try {
      return Futures.getDone(future);
    } catch (ExecutionException e) {
      CancellationException cancelled = new CancellationException("request was cancelled");
      cancelled.initCause(e.getCause());
      throw cancelled;
    }
  }

  private Counter failedRequestsCounter(String addr) {
    return meterRegistry.counter(NODE_REQUESTS_FAILED, "addr", addr);
  }
}
