package com.slack.netselect.server;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.slack.netselect.logstore.QueryEngine;
import com.slack.netselect.netselect.NetSelectStorage;
import com.slack.netselect.proto.config.NetSelectConfigs;
import com.slack.netselect.query.RawQueryParser;
import com.slack.netselect.util.RuntimeHalterImpl;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main class of a netselect node. Depending on its roles a node serves the internal select API
 * from the local query engine (storage), from a fan-out over other storage nodes (select), or
 * both on separate ports.
 */
public class NetSelect {
  private static final Logger LOG = LoggerFactory.getLogger(NetSelect.class);

  private final PrometheusMeterRegistry prometheusMeterRegistry;
  private final NetSelectConfigs.NetSelectConfig netSelectConfig;
  protected ServiceManager serviceManager;
  private NetSelectStorage netSelectStorage;

  NetSelect(
      NetSelectConfigs.NetSelectConfig netSelectConfig,
      PrometheusMeterRegistry prometheusMeterRegistry) {
    this.prometheusMeterRegistry = prometheusMeterRegistry;
    this.netSelectConfig = netSelectConfig;
    Metrics.addRegistry(prometheusMeterRegistry);
    LOG.info("Started NetSelect process with config: {}", netSelectConfig);
  }

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      LOG.error("Config file is needed as the first argument");
      System.exit(1);
    }
    Path configFilePath = Path.of(args[0]);

    NetSelectConfig.initFromFile(configFilePath);
    NetSelectConfigs.NetSelectConfig config = NetSelectConfig.get();
    NetSelect netSelect = new NetSelect(config, initPrometheusMeterRegistry(config));
    netSelect.start();
  }

  static PrometheusMeterRegistry initPrometheusMeterRegistry(
      NetSelectConfigs.NetSelectConfig config) {
    PrometheusMeterRegistry prometheusMeterRegistry =
        new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    prometheusMeterRegistry
        .config()
        .commonTags(
            "netselect_cluster_name",
            config.getClusterConfig().getClusterName(),
            "netselect_env",
            config.getClusterConfig().getEnv(),
            "netselect_component",
            getComponentTag(config));
    return prometheusMeterRegistry;
  }

  private static String getComponentTag(NetSelectConfigs.NetSelectConfig config) {
    String component;
    if (config.getNodeRolesList().size() == 1) {
      component = config.getNodeRolesList().get(0).toString();
    } else {
      component = Strings.join(config.getNodeRolesList(), '-');
    }
    return Strings.toRootLowerCase(component);
  }

  public void start() throws Exception {
    setupSystemMetrics(prometheusMeterRegistry);
    addShutdownHook();
    startServices();
  }

  @VisibleForTesting
  void startServices() {
    Set<Service> services = getServices(netSelectConfig, prometheusMeterRegistry);
    serviceManager = new ServiceManager(services);
    serviceManager.addListener(getServiceManagerListener(), MoreExecutors.directExecutor());

    serviceManager.startAsync();
  }

  @VisibleForTesting
  void awaitHealthy(Duration timeout) throws Exception {
    serviceManager.awaitHealthy(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private Set<Service> getServices(
      NetSelectConfigs.NetSelectConfig config, PrometheusMeterRegistry meterRegistry) {
    Set<Service> services = new HashSet<>();

    HashSet<NetSelectConfigs.NodeRole> roles = new HashSet<>(config.getNodeRolesList());

    if (roles.contains(NetSelectConfigs.NodeRole.STORAGE)) {
      NetSelectConfigs.StorageConfig storageConfig = config.getStorageConfig();
      QueryEngine localEngine = loadLocalQueryEngine();
      InternalSelectService internalSelectService =
          new InternalSelectService(
              localEngine,
              new RawQueryParser(
                  NetSelectConfig.getConcurrency(storageConfig.getDefaultConcurrency())),
              NetSelectConfig.getBlockFlushThresholdBytes(storageConfig),
              meterRegistry);
      services.add(
          newArmeriaService(
              "netselect-storage", storageConfig.getServerConfig(), internalSelectService));
    }

    if (roles.contains(NetSelectConfigs.NodeRole.SELECT)) {
      NetSelectConfigs.SelectConfig selectConfig = config.getSelectConfig();
      netSelectStorage = NetSelectStorage.fromConfig(selectConfig, meterRegistry);
      // Select nodes answer the internal API too, so they can act as storage for another tier.
      InternalSelectService internalSelectService =
          new InternalSelectService(
              netSelectStorage,
              new RawQueryParser(
                  NetSelectConfig.getConcurrency(selectConfig.getDefaultConcurrency())),
              NetSelectConfig.DEFAULT_BLOCK_FLUSH_THRESHOLD_BYTES,
              meterRegistry);
      services.add(
          newArmeriaService(
              "netselect-select", selectConfig.getServerConfig(), internalSelectService));
    }

    return services;
  }

  private ArmeriaService newArmeriaService(
      String serviceName,
      NetSelectConfigs.ServerConfig serverConfig,
      InternalSelectService internalSelectService) {
    return new ArmeriaService.Builder(
            serverConfig.getServerPort(), serviceName, prometheusMeterRegistry)
        .withRequestTimeout(Duration.ofMillis(serverConfig.getRequestTimeoutMs()))
        .withAnnotatedService(internalSelectService)
        .build();
  }

  /** The local query engine is provided by whatever storage implementation is on the classpath. */
  private static QueryEngine loadLocalQueryEngine() {
    return ServiceLoader.load(QueryEngine.class)
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "The STORAGE role needs a "
                        + QueryEngine.class.getName()
                        + " implementation registered in META-INF/services"));
  }

  private static ServiceManager.Listener getServiceManagerListener() {
    return new ServiceManager.Listener() {
      @Override
      public void failure(Service service) {
        LOG.error(
            String.format("Service %s failed with cause ", service.getClass().toString()),
            service.failureCause());
        // shutdown if any services enters failure state
        new RuntimeHalterImpl()
            .handleFatal(new Throwable("Shutting down NetSelect due to failed service"));
      }
    };
  }

  void shutdown() {
    LOG.info("Running shutdown hook.");
    stopServices();
    LOG.info("Shutting down LogManager");
    LogManager.shutdown();
  }

  @VisibleForTesting
  void stopServices() {
    try {
      serviceManager.stopAsync().awaitStopped(30, TimeUnit.SECONDS);
    } catch (Exception e) {
      // stopping timed out
      LOG.error("ServiceManager shutdown timed out", e);
    }
    if (netSelectStorage != null) {
      netSelectStorage.stop();
    }
  }

  private void addShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
  }

  private static void setupSystemMetrics(MeterRegistry prometheusMeterRegistry) {
    // Expose JVM metrics.
    new ClassLoaderMetrics().bindTo(prometheusMeterRegistry);
    new JvmMemoryMetrics().bindTo(prometheusMeterRegistry);
    new JvmGcMetrics().bindTo(prometheusMeterRegistry);
    new ProcessorMetrics().bindTo(prometheusMeterRegistry);
    new JvmThreadMetrics().bindTo(prometheusMeterRegistry);

    LOG.info("Done registering standard JVM metrics for netselect");
  }
}
