package com.slack.netselect.server;

import static com.slack.netselect.server.NetSelectConfig.DEFAULT_START_STOP_DURATION;

import com.google.common.util.concurrent.AbstractIdleService;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.logging.LogLevel;
import com.linecorp.armeria.common.metric.MeterIdPrefixFunction;
import com.linecorp.armeria.server.Server;
import com.linecorp.armeria.server.ServerBuilder;
import com.linecorp.armeria.server.healthcheck.HealthCheckService;
import com.linecorp.armeria.server.logging.LoggingService;
import com.linecorp.armeria.server.metric.MetricCollectingService;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server hosting the internal select API of one node role, plus the health and metrics
 * endpoints. Responses are not compressed by the server since the select payloads carry their own
 * compression.
 */
public class ArmeriaService extends AbstractIdleService {
  private static final Logger LOG = LoggerFactory.getLogger(ArmeriaService.class);

  private final String serviceName;
  private final Server server;

  private ArmeriaService(Server server, String serviceName) {
    this.server = server;
    this.serviceName = serviceName;
  }

  public static class Builder {
    private final String serviceName;
    private final ServerBuilder serverBuilder;

    public Builder(int port, String serviceName, PrometheusMeterRegistry prometheusMeterRegistry) {
      this.serviceName = serviceName;
      this.serverBuilder = Server.builder().http(port).meterRegistry(prometheusMeterRegistry);

      initializeLogging();
      initializeMetrics();
      initializeManagementEndpoints(prometheusMeterRegistry);
    }

    private void initializeLogging() {
      serverBuilder.decorator(
          LoggingService.builder()
              // /metrics is scraped every few seconds, keep successful requests out of INFO
              .successfulResponseLogLevel(LogLevel.DEBUG)
              .failureResponseLogLevel(LogLevel.ERROR)
              // Response bodies are binary select payloads
              .responseContentSanitizer((ctx, content) -> "truncated")
              // Auth headers must never reach the logs
              .requestHeadersSanitizer((ctx, headers) -> DefaultHttpHeaders.EMPTY_HEADERS)
              .newDecorator());
    }

    private void initializeMetrics() {
      serverBuilder.decorator(
          MetricCollectingService.newDecorator(
              MeterIdPrefixFunction.ofDefault("netselect.http.service")));
    }

    private void initializeManagementEndpoints(PrometheusMeterRegistry prometheusMeterRegistry) {
      serverBuilder
          .service("/health", HealthCheckService.builder().build())
          .service("/metrics", (ctx, req) -> HttpResponse.of(prometheusMeterRegistry.scrape()));
    }

    public Builder withRequestTimeout(Duration requestTimeout) {
      serverBuilder.requestTimeout(requestTimeout);
      return this;
    }

    public Builder withAnnotatedService(Object service) {
      serverBuilder.annotatedService(service);
      return this;
    }

    public ArmeriaService build() {
      return new ArmeriaService(serverBuilder.build(), serviceName);
    }
  }

  @Override
  protected void startUp() throws Exception {
    LOG.info("Starting {} on ports {}", serviceName, server.config().ports());
    CompletableFuture<Void> serverFuture = server.start();
    serverFuture.get(DEFAULT_START_STOP_DURATION.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  protected void shutDown() throws Exception {
    LOG.info("Shutting down {}", serviceName);
    // Streaming query responses are not drained; in-flight requests are aborted on close.
    server.close();
  }

  @Override
  protected String serviceName() {
    if (this.serviceName != null) {
      return this.serviceName;
    }
    return super.serviceName();
  }

  @Override
  public String toString() {
    return "ArmeriaService{" + "serviceName='" + serviceName() + '\'' + '}';
  }
}
