package com.slack.netselect.netselect;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.linecorp.armeria.client.ClientFactory;
import com.linecorp.armeria.client.WebClient;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.QueryParams;
import com.linecorp.armeria.common.QueryParamsBuilder;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.SplitHttpResponse;
import com.linecorp.armeria.common.util.Exceptions;
import com.slack.netselect.codec.DataBlock;
import com.slack.netselect.codec.Frames;
import com.slack.netselect.codec.TenantId;
import com.slack.netselect.codec.ValueWithHits;
import com.slack.netselect.query.Query;
import io.grpc.Context;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Client for a single storage node. Each call issues one GET request against the node's internal
 * select API and completes the returned future once the response has been fully processed.
 *
 * <p>A failed future carries either a {@link StorageNodeException} naming the request URL, or a
 * {@link CancellationException} when ctx was cancelled while the request was in flight.
 */
public class StorageNode {
  private final NetSelectStorage storage;
  private final String addr;
  private final String scheme;
  private final AuthHeaderProvider authHeaderProvider;
  private final WebClient client;

  StorageNode(
      NetSelectStorage storage,
      String addr,
      boolean tls,
      AuthHeaderProvider authHeaderProvider,
      ClientFactory clientFactory) {
    this.storage = storage;
    this.addr = addr;
    this.scheme = tls ? "https" : "http";
    this.authHeaderProvider = authHeaderProvider;
    // Query responses are streamed for as long as the node keeps producing blocks.
    this.client =
        WebClient.builder(scheme + "://" + addr)
            .factory(clientFactory)
            .responseTimeout(Duration.ZERO)
            .maxResponseLength(0)
            .build();
  }

  public String getAddr() {
    return addr;
  }

  /**
   * Streams the query results from the node. processBlock is called for every received block on
   * the response's event loop; it must not retain the block after returning.
   */
  public ListenableFuture<Void> runQuery(
      Context ctx, List<TenantId> tenantIds, Query query, Consumer<DataBlock> processBlock) {
    QueryParams args =
        getCommonArgs(InternalSelectProtocol.QUERY_PROTOCOL_VERSION, tenantIds, query).build();
    String requestUrl = getRequestUrl(InternalSelectProtocol.QUERY_PATH, args);
    SettableFuture<Void> result = SettableFuture.create();
    if (ctx.isCancelled()) {
      result.setException(cancelledBeforeStart(requestUrl));
      return result;
    }

    HttpResponse response =
        client.execute(newRequestHeaders(InternalSelectProtocol.QUERY_PATH, args));
    abortOnCancel(ctx, response, result);
    response.subscribe(
        new BlockStreamSubscriber(
            requestUrl, !storage.isCompressionDisabled(), processBlock, ctx, result));
    return result;
  }

  public ListenableFuture<List<ValueWithHits>> getFieldNames(
      Context ctx, List<TenantId> tenantIds, Query query) {
    QueryParams args =
        getCommonArgs(InternalSelectProtocol.FIELD_NAMES_PROTOCOL_VERSION, tenantIds, query)
            .build();
    return getValuesWithHits(ctx, InternalSelectProtocol.FIELD_NAMES_PATH, args);
  }

  public ListenableFuture<List<ValueWithHits>> getFieldValues(
      Context ctx, List<TenantId> tenantIds, Query query, String fieldName, long limit) {
    QueryParams args =
        getCommonArgs(InternalSelectProtocol.FIELD_VALUES_PROTOCOL_VERSION, tenantIds, query)
            .add(InternalSelectProtocol.FIELD_PARAM, fieldName)
            .add(InternalSelectProtocol.LIMIT_PARAM, Long.toUnsignedString(limit))
            .build();
    return getValuesWithHits(ctx, InternalSelectProtocol.FIELD_VALUES_PATH, args);
  }

  public ListenableFuture<List<ValueWithHits>> getStreamFieldNames(
      Context ctx, List<TenantId> tenantIds, Query query) {
    QueryParams args =
        getCommonArgs(
                InternalSelectProtocol.STREAM_FIELD_NAMES_PROTOCOL_VERSION, tenantIds, query)
            .build();
    return getValuesWithHits(ctx, InternalSelectProtocol.STREAM_FIELD_NAMES_PATH, args);
  }

  public ListenableFuture<List<ValueWithHits>> getStreamFieldValues(
      Context ctx, List<TenantId> tenantIds, Query query, String fieldName, long limit) {
    QueryParams args =
        getCommonArgs(
                InternalSelectProtocol.STREAM_FIELD_VALUES_PROTOCOL_VERSION, tenantIds, query)
            .add(InternalSelectProtocol.FIELD_PARAM, fieldName)
            .add(InternalSelectProtocol.LIMIT_PARAM, Long.toUnsignedString(limit))
            .build();
    return getValuesWithHits(ctx, InternalSelectProtocol.STREAM_FIELD_VALUES_PATH, args);
  }

  public ListenableFuture<List<ValueWithHits>> getStreams(
      Context ctx, List<TenantId> tenantIds, Query query, long limit) {
    QueryParams args =
        getCommonArgs(InternalSelectProtocol.STREAMS_PROTOCOL_VERSION, tenantIds, query)
            .add(InternalSelectProtocol.LIMIT_PARAM, Long.toUnsignedString(limit))
            .build();
    return getValuesWithHits(ctx, InternalSelectProtocol.STREAMS_PATH, args);
  }

  public ListenableFuture<List<ValueWithHits>> getStreamIds(
      Context ctx, List<TenantId> tenantIds, Query query, long limit) {
    QueryParams args =
        getCommonArgs(InternalSelectProtocol.STREAM_IDS_PROTOCOL_VERSION, tenantIds, query)
            .add(InternalSelectProtocol.LIMIT_PARAM, Long.toUnsignedString(limit))
            .build();
    return getValuesWithHits(ctx, InternalSelectProtocol.STREAM_IDS_PATH, args);
  }

  private ListenableFuture<List<ValueWithHits>> getValuesWithHits(
      Context ctx, String path, QueryParams args) {
    String requestUrl = getRequestUrl(path, args);
    SettableFuture<List<ValueWithHits>> result = SettableFuture.create();
    if (ctx.isCancelled()) {
      result.setException(cancelledBeforeStart(requestUrl));
      return result;
    }

    HttpResponse response = client.execute(newRequestHeaders(path, args));
    abortOnCancel(ctx, response, result);
    // Headers are read separately so an error status is reported even if the body is cut short.
    SplitHttpResponse split = response.split();
    split
        .headers()
        .whenComplete(
            (headers, t) -> {
              if (t != null) {
                split.body().abort();
                fail(
                    ctx,
                    result,
                    requestUrl,
                    new StorageNodeException(
                        String.format("cannot execute request to %s", requestUrl),
                        Exceptions.peel(t)));
                return;
              }
              split
                  .body()
                  .collect()
                  .whenComplete(
                      (chunks, bodyFailure) ->
                          onBlobResponse(
                              ctx, result, requestUrl, headers.status(), chunks, bodyFailure));
            });
    return result;
  }

  private void onBlobResponse(
      Context ctx,
      SettableFuture<List<ValueWithHits>> result,
      String requestUrl,
      HttpStatus status,
      List<HttpData> chunks,
      Throwable bodyFailure) {
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    if (chunks != null) {
      chunks.forEach(data -> body.writeBytes(data.array()));
    }
    if (!HttpStatus.OK.equals(status)) {
      String message =
          String.format(
              "unexpected status code for the request to %s: %d; want %d; response: \"%s\"",
              requestUrl, status.code(), HttpStatus.OK.code(), body.toString(UTF_8));
      if (bodyFailure != null) {
        // Only the message: the cause chain may hold the cancellation that cut the body short.
        message +=
            "; cannot read the rest of the response: " + Throwables.getRootCause(bodyFailure);
      }
      result.setException(new StorageNodeException(message));
      return;
    }
    if (bodyFailure != null) {
      fail(
          ctx,
          result,
          requestUrl,
          new StorageNodeException(
              String.format("cannot read response from %s", requestUrl),
              Exceptions.peel(bodyFailure)));
      return;
    }
    try {
      result.set(readValuesWithHits(requestUrl, body.toByteArray()));
    } catch (IOException e) {
      fail(ctx, result, requestUrl, e);
    }
  }

  private List<ValueWithHits> readValuesWithHits(String requestUrl, byte[] content)
      throws IOException {
    byte[] data;
    try {
      data = Frames.decodePayload(content, !storage.isCompressionDisabled());
    } catch (IOException e) {
      throw new StorageNodeException(
          String.format("cannot decompress response from %s", requestUrl), e);
    }
    try {
      return ValueWithHits.unmarshalAll(data);
    } catch (IOException e) {
      throw new StorageNodeException(
          String.format("cannot unmarshal response from %s", requestUrl), e);
    }
  }

  private static <T> void fail(
      Context ctx, SettableFuture<T> result, String requestUrl, Throwable t) {
    if (ctx.isCancelled()) {
      CancellationException cancelled =
          new CancellationException(String.format("request to %s was cancelled", requestUrl));
      cancelled.initCause(t);
      result.setException(cancelled);
    } else {
      result.setException(t);
    }
  }

  private static void abortOnCancel(
      Context ctx, HttpResponse response, ListenableFuture<?> result) {
    Context.CancellationListener listener =
        cancelled -> response.abort(new CancellationException("request context was cancelled"));
    ctx.addListener(listener, directExecutor());
    result.addListener(() -> ctx.removeListener(listener), directExecutor());
  }

  private static CancellationException cancelledBeforeStart(String requestUrl) {
    return new CancellationException(
        String.format("request to %s was cancelled before it started", requestUrl));
  }

  private QueryParamsBuilder getCommonArgs(
      String version, List<TenantId> tenantIds, Query query) {
    return QueryParams.builder()
        .add(InternalSelectProtocol.VERSION_PARAM, version)
        .add(InternalSelectProtocol.TENANT_IDS_PARAM, TenantId.toParam(tenantIds))
        .add(InternalSelectProtocol.QUERY_PARAM, query.protocolString())
        .add(InternalSelectProtocol.TIMESTAMP_PARAM, Long.toString(query.getTimestamp()))
        .add(
            InternalSelectProtocol.DISABLE_COMPRESSION_PARAM,
            Boolean.toString(storage.isCompressionDisabled()));
  }

  private RequestHeaders newRequestHeaders(String path, QueryParams args) {
    return RequestHeaders.builder(HttpMethod.GET, path + "?" + args.toQueryString())
        .add(authHeaderProvider.getHeaders(addr))
        .build();
  }

  @VisibleForTesting
  String getRequestUrl(String path, QueryParams args) {
    return scheme + "://" + addr + path + "?" + args.toQueryString();
  }

  @Override
  public String toString() {
    return "StorageNode{addr='" + addr + "', scheme='" + scheme + "'}";
  }
}
