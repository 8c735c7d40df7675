package com.slack.netselect.server;

import static com.slack.netselect.netselect.InternalSelectProtocol.DISABLE_COMPRESSION_PARAM;
import static com.slack.netselect.netselect.InternalSelectProtocol.FIELD_PARAM;
import static com.slack.netselect.netselect.InternalSelectProtocol.LIMIT_PARAM;
import static com.slack.netselect.netselect.InternalSelectProtocol.QUERY_PARAM;
import static com.slack.netselect.netselect.InternalSelectProtocol.TENANT_IDS_PARAM;
import static com.slack.netselect.netselect.InternalSelectProtocol.TIMESTAMP_PARAM;
import static com.slack.netselect.netselect.InternalSelectProtocol.VERSION_PARAM;

import com.google.common.annotations.VisibleForTesting;
import com.linecorp.armeria.common.ClosedSessionException;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.HttpResponseWriter;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.stream.AbortedStreamException;
import com.linecorp.armeria.common.stream.CancelledSubscriptionException;
import com.linecorp.armeria.common.stream.ClosedStreamException;
import com.linecorp.armeria.server.ServiceRequestContext;
import com.linecorp.armeria.server.annotation.Get;
import com.linecorp.armeria.server.annotation.Param;
import com.linecorp.armeria.server.annotation.Path;
import com.slack.netselect.codec.Frames;
import com.slack.netselect.codec.TenantId;
import com.slack.netselect.codec.ValueWithHits;
import com.slack.netselect.logstore.QueryEngine;
import com.slack.netselect.netselect.InternalSelectProtocol;
import com.slack.netselect.query.Query;
import com.slack.netselect.query.QueryParser;
import com.slack.netselect.util.StopSignalContext;
import io.grpc.Context;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the internal select API on top of a {@link QueryEngine}. Storage nodes back it with their
 * local engine, select nodes with the fan-out to their own storage nodes.
 *
 * <p>Every request must carry the exact protocol version of its endpoint. Requests, non-trivial
 * errors and durations are recorded per path; the duration also covers failed requests.
 */
public class InternalSelectService {
  private static final Logger LOG = LoggerFactory.getLogger(InternalSelectService.class);

  public static final String REQUESTS_TOTAL = "internal_select_requests_total";
  public static final String REQUEST_ERRORS_TOTAL = "internal_select_request_errors_total";
  public static final String REQUEST_DURATION = "internal_select_request_duration_seconds";

  private final QueryEngine queryEngine;
  private final QueryParser queryParser;
  private final long blockFlushThresholdBytes;
  private final Map<String, PathMetrics> pathMetrics = new HashMap<>();

  private record PathMetrics(Counter requests, Counter errors, Timer duration) {}

  /** Request parameters shared by all endpoints. */
  @VisibleForTesting
  record CommonArgs(List<TenantId> tenantIds, Query query, boolean disableCompression) {}

  @FunctionalInterface
  private interface ValuesCall {
    List<ValueWithHits> call(Context ctx, CommonArgs args) throws IOException;
  }

  public InternalSelectService(
      QueryEngine queryEngine,
      QueryParser queryParser,
      long blockFlushThresholdBytes,
      MeterRegistry meterRegistry) {
    this.queryEngine = queryEngine;
    this.queryParser = queryParser;
    this.blockFlushThresholdBytes = blockFlushThresholdBytes;
    for (String path : InternalSelectProtocol.ALL_PATHS) {
      pathMetrics.put(
          path,
          new PathMetrics(
              meterRegistry.counter(REQUESTS_TOTAL, "path", path),
              meterRegistry.counter(REQUEST_ERRORS_TOTAL, "path", path),
              Timer.builder(REQUEST_DURATION).tag("path", path).register(meterRegistry)));
    }
  }

  /** Streams the query results as length-prefixed frames of data blocks. */
  @Get
  @Path(InternalSelectProtocol.QUERY_PATH)
  public HttpResponse query(
      ServiceRequestContext requestContext,
      @Param(VERSION_PARAM) Optional<String> version,
      @Param(TENANT_IDS_PARAM) Optional<String> tenantIds,
      @Param(QUERY_PARAM) Optional<String> query,
      @Param(TIMESTAMP_PARAM) Optional<String> timestamp,
      @Param(DISABLE_COMPRESSION_PARAM) Optional<String> disableCompression) {
    String path = InternalSelectProtocol.QUERY_PATH;
    PathMetrics metrics = pathMetrics.get(path);
    metrics.requests().increment();
    long startNanos = System.nanoTime();

    CommonArgs args;
    try {
      args =
          parseCommonArgs(
              InternalSelectProtocol.QUERY_PROTOCOL_VERSION,
              version,
              tenantIds,
              query,
              timestamp,
              disableCompression);
    } catch (IllegalArgumentException e) {
      recordDuration(metrics, startNanos);
      return badRequest(path, metrics, e);
    }

    HttpResponseWriter response = HttpResponse.streaming();
    BlockFrameWriter writer =
        new BlockFrameWriter(response, !args.disableCompression(), blockFlushThresholdBytes);
    Context.CancellableContext ctx = Context.ROOT.withCancellation();
    cancelOnAbort(response, ctx);

    requestContext
        .blockingTaskExecutor()
        .execute(
            () -> {
              try {
                queryEngine.runQuery(ctx, args.tenantIds(), args.query(), writer);
                writer.finish();
                LOG.debug(
                    "Finished query={} for tenants={}, wrote {} frames",
                    args.query(),
                    args.tenantIds(),
                    writer.getFramesWritten());
              } catch (Exception e) {
                handleError(path, metrics, e);
                writer.fail(HttpStatus.INTERNAL_SERVER_ERROR, e);
              } finally {
                ctx.cancel(null);
                recordDuration(metrics, startNanos);
              }
            });
    return response;
  }

  @Get
  @Path(InternalSelectProtocol.FIELD_NAMES_PATH)
  public HttpResponse fieldNames(
      ServiceRequestContext requestContext,
      @Param(VERSION_PARAM) Optional<String> version,
      @Param(TENANT_IDS_PARAM) Optional<String> tenantIds,
      @Param(QUERY_PARAM) Optional<String> query,
      @Param(TIMESTAMP_PARAM) Optional<String> timestamp,
      @Param(DISABLE_COMPRESSION_PARAM) Optional<String> disableCompression) {
    return processValuesWithHits(
        requestContext,
        InternalSelectProtocol.FIELD_NAMES_PATH,
        InternalSelectProtocol.FIELD_NAMES_PROTOCOL_VERSION,
        version,
        tenantIds,
        query,
        timestamp,
        disableCompression,
        (ctx, args) -> queryEngine.getFieldNames(ctx, args.tenantIds(), args.query()));
  }

  @Get
  @Path(InternalSelectProtocol.FIELD_VALUES_PATH)
  public HttpResponse fieldValues(
      ServiceRequestContext requestContext,
      @Param(VERSION_PARAM) Optional<String> version,
      @Param(TENANT_IDS_PARAM) Optional<String> tenantIds,
      @Param(QUERY_PARAM) Optional<String> query,
      @Param(TIMESTAMP_PARAM) Optional<String> timestamp,
      @Param(DISABLE_COMPRESSION_PARAM) Optional<String> disableCompression,
      @Param(FIELD_PARAM) Optional<String> field,
      @Param(LIMIT_PARAM) Optional<String> limit) {
    return processValuesWithHits(
        requestContext,
        InternalSelectProtocol.FIELD_VALUES_PATH,
        InternalSelectProtocol.FIELD_VALUES_PROTOCOL_VERSION,
        version,
        tenantIds,
        query,
        timestamp,
        disableCompression,
        (ctx, args) ->
            queryEngine.getFieldValues(
                ctx, args.tenantIds(), args.query(), field.orElse(""), parseLimit(limit)));
  }

  @Get
  @Path(InternalSelectProtocol.STREAM_FIELD_NAMES_PATH)
  public HttpResponse streamFieldNames(
      ServiceRequestContext requestContext,
      @Param(VERSION_PARAM) Optional<String> version,
      @Param(TENANT_IDS_PARAM) Optional<String> tenantIds,
      @Param(QUERY_PARAM) Optional<String> query,
      @Param(TIMESTAMP_PARAM) Optional<String> timestamp,
      @Param(DISABLE_COMPRESSION_PARAM) Optional<String> disableCompression) {
    return processValuesWithHits(
        requestContext,
        InternalSelectProtocol.STREAM_FIELD_NAMES_PATH,
        InternalSelectProtocol.STREAM_FIELD_NAMES_PROTOCOL_VERSION,
        version,
        tenantIds,
        query,
        timestamp,
        disableCompression,
        (ctx, args) -> queryEngine.getStreamFieldNames(ctx, args.tenantIds(), args.query()));
  }

  @Get
  @Path(InternalSelectProtocol.STREAM_FIELD_VALUES_PATH)
  public HttpResponse streamFieldValues(
      ServiceRequestContext requestContext,
      @Param(VERSION_PARAM) Optional<String> version,
      @Param(TENANT_IDS_PARAM) Optional<String> tenantIds,
      @Param(QUERY_PARAM) Optional<String> query,
      @Param(TIMESTAMP_PARAM) Optional<String> timestamp,
      @Param(DISABLE_COMPRESSION_PARAM) Optional<String> disableCompression,
      @Param(FIELD_PARAM) Optional<String> field,
      @Param(LIMIT_PARAM) Optional<String> limit) {
    return processValuesWithHits(
        requestContext,
        InternalSelectProtocol.STREAM_FIELD_VALUES_PATH,
        InternalSelectProtocol.STREAM_FIELD_VALUES_PROTOCOL_VERSION,
        version,
        tenantIds,
        query,
        timestamp,
        disableCompression,
        (ctx, args) ->
            queryEngine.getStreamFieldValues(
                ctx, args.tenantIds(), args.query(), field.orElse(""), parseLimit(limit)));
  }

  @Get
  @Path(InternalSelectProtocol.STREAMS_PATH)
  public HttpResponse streams(
      ServiceRequestContext requestContext,
      @Param(VERSION_PARAM) Optional<String> version,
      @Param(TENANT_IDS_PARAM) Optional<String> tenantIds,
      @Param(QUERY_PARAM) Optional<String> query,
      @Param(TIMESTAMP_PARAM) Optional<String> timestamp,
      @Param(DISABLE_COMPRESSION_PARAM) Optional<String> disableCompression,
      @Param(LIMIT_PARAM) Optional<String> limit) {
    return processValuesWithHits(
        requestContext,
        InternalSelectProtocol.STREAMS_PATH,
        InternalSelectProtocol.STREAMS_PROTOCOL_VERSION,
        version,
        tenantIds,
        query,
        timestamp,
        disableCompression,
        (ctx, args) ->
            queryEngine.getStreams(ctx, args.tenantIds(), args.query(), parseLimit(limit)));
  }

  @Get
  @Path(InternalSelectProtocol.STREAM_IDS_PATH)
  public HttpResponse streamIds(
      ServiceRequestContext requestContext,
      @Param(VERSION_PARAM) Optional<String> version,
      @Param(TENANT_IDS_PARAM) Optional<String> tenantIds,
      @Param(QUERY_PARAM) Optional<String> query,
      @Param(TIMESTAMP_PARAM) Optional<String> timestamp,
      @Param(DISABLE_COMPRESSION_PARAM) Optional<String> disableCompression,
      @Param(LIMIT_PARAM) Optional<String> limit) {
    return processValuesWithHits(
        requestContext,
        InternalSelectProtocol.STREAM_IDS_PATH,
        InternalSelectProtocol.STREAM_IDS_PROTOCOL_VERSION,
        version,
        tenantIds,
        query,
        timestamp,
        disableCompression,
        (ctx, args) ->
            queryEngine.getStreamIds(ctx, args.tenantIds(), args.query(), parseLimit(limit)));
  }

  private HttpResponse processValuesWithHits(
      ServiceRequestContext requestContext,
      String path,
      String expectedVersion,
      Optional<String> version,
      Optional<String> tenantIds,
      Optional<String> query,
      Optional<String> timestamp,
      Optional<String> disableCompression,
      ValuesCall valuesCall) {
    PathMetrics metrics = pathMetrics.get(path);
    metrics.requests().increment();
    long startNanos = System.nanoTime();

    CommonArgs args;
    try {
      args =
          parseCommonArgs(
              expectedVersion, version, tenantIds, query, timestamp, disableCompression);
    } catch (IllegalArgumentException e) {
      recordDuration(metrics, startNanos);
      return badRequest(path, metrics, e);
    }

    CompletableFuture<HttpResponse> responseFuture = new CompletableFuture<>();
    HttpResponse response = HttpResponse.of(responseFuture);
    Context.CancellableContext ctx = Context.ROOT.withCancellation();
    cancelOnAbort(response, ctx);

    requestContext
        .blockingTaskExecutor()
        .execute(
            () -> {
              try {
                List<ValueWithHits> values = valuesCall.call(ctx, args);
                byte[] body =
                    Frames.encodeBlob(
                        ValueWithHits.marshalAll(values), !args.disableCompression());
                LOG.debug(
                    "Returning {} values for {} query={}", values.size(), path, args.query());
                responseFuture.complete(
                    HttpResponse.of(HttpStatus.OK, MediaType.OCTET_STREAM, body));
              } catch (IllegalArgumentException e) {
                responseFuture.complete(badRequest(path, metrics, e));
              } catch (Exception e) {
                handleError(path, metrics, e);
                responseFuture.complete(
                    HttpResponse.of(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        MediaType.PLAIN_TEXT_UTF_8,
                        String.valueOf(e.getMessage())));
              } finally {
                ctx.cancel(null);
                recordDuration(metrics, startNanos);
              }
            });
    return response;
  }

  /** Cancels the engine call once the client has gone away. */
  private static void cancelOnAbort(HttpResponse response, Context.CancellableContext ctx) {
    response
        .whenComplete()
        .whenComplete(
            (unused, t) -> {
              if (t != null) {
                ctx.cancel(t);
              }
            });
  }

  @VisibleForTesting
  CommonArgs parseCommonArgs(
      String expectedVersion,
      Optional<String> version,
      Optional<String> tenantIds,
      Optional<String> query,
      Optional<String> timestamp,
      Optional<String> disableCompression) {
    String gotVersion = version.orElse("");
    if (!expectedVersion.equals(gotVersion)) {
      throw new IllegalArgumentException(
          String.format(
              "unexpected protocol version=%s; want %s; make sure all the select and storage"
                  + " nodes run the same release",
              gotVersion, expectedVersion));
    }

    List<TenantId> parsedTenantIds;
    try {
      parsedTenantIds = TenantId.fromParam(tenantIds.orElse(""));
    } catch (IOException e) {
      throw new IllegalArgumentException("cannot unmarshal tenant_ids: " + e.getMessage(), e);
    }

    long parsedTimestamp;
    try {
      parsedTimestamp = Long.parseLong(timestamp.orElse(""));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("cannot parse timestamp=\"%s\"", timestamp.orElse("")), e);
    }

    Query parsedQuery = queryParser.parse(query.orElse(""), parsedTimestamp);
    return new CommonArgs(
        parsedTenantIds, parsedQuery, parseBool(DISABLE_COMPRESSION_PARAM, disableCompression));
  }

  @VisibleForTesting
  static long parseLimit(Optional<String> limit) {
    if (limit.isEmpty() || limit.get().isEmpty()) {
      return 0;
    }
    long parsed;
    try {
      parsed = Long.parseLong(limit.get());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("cannot parse %s=\"%s\"", LIMIT_PARAM, limit.get()), e);
    }
    if (parsed < 0) {
      throw new IllegalArgumentException(
          String.format("%s cannot be negative; got %d", LIMIT_PARAM, parsed));
    }
    return parsed;
  }

  @VisibleForTesting
  static boolean parseBool(String name, Optional<String> value) {
    if (value.isEmpty()) {
      return false;
    }
    switch (value.get()) {
      case "", "0", "f", "F", "false", "FALSE", "False":
        return false;
      case "1", "t", "T", "true", "TRUE", "True":
        return true;
      default:
        throw new IllegalArgumentException(
            String.format("cannot parse %s=\"%s\" as bool", name, value.get()));
    }
  }

  private static void recordDuration(PathMetrics metrics, long startNanos) {
    metrics.duration().record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
  }

  private static HttpResponse badRequest(
      String path, PathMetrics metrics, IllegalArgumentException e) {
    metrics.errors().increment();
    LOG.warn("Rejected request to {}: {}", path, e.getMessage());
    return HttpResponse.of(HttpStatus.BAD_REQUEST, MediaType.PLAIN_TEXT_UTF_8, e.getMessage());
  }

  private static void handleError(String path, PathMetrics metrics, Throwable t) {
    if (isTrivialNetworkError(t)) {
      LOG.debug("Client went away while serving {}", path, t);
      return;
    }
    metrics.errors().increment();
    LOG.error("Error serving {}", path, t);
  }

  /** Errors caused by the client closing the connection or cancelling the request. */
  @VisibleForTesting
  static boolean isTrivialNetworkError(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof ClosedStreamException
          || cur instanceof AbortedStreamException
          || cur instanceof ClosedSessionException
          || cur instanceof CancelledSubscriptionException) {
        return true;
      }
      if (cur.getCause() == cur) {
        break;
      }
    }
    return StopSignalContext.isCancellation(t);
  }
}
