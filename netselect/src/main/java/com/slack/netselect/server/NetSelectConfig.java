package com.slack.netselect.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.slack.netselect.proto.config.NetSelectConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/**
 * Loads the process config from a .yaml or .json file. YAML may reference environment variables
 * as ${NAME} or ${NAME:-default}.
 */
public class NetSelectConfig {

  public static final Duration DEFAULT_START_STOP_DURATION = Duration.ofSeconds(15);

  public static final long DEFAULT_BLOCK_FLUSH_THRESHOLD_BYTES = 1024 * 1024;

  public static final int DEFAULT_CONCURRENCY = Runtime.getRuntime().availableProcessors();

  private static NetSelectConfig _instance = null;

  // Parse a json string as a NetSelectConfig proto struct.
  @VisibleForTesting
  static NetSelectConfigs.NetSelectConfig fromJsonConfig(String jsonStr)
      throws InvalidProtocolBufferException {
    NetSelectConfigs.NetSelectConfig.Builder configBuilder =
        NetSelectConfigs.NetSelectConfig.newBuilder();
    JsonFormat.parser().ignoringUnknownFields().merge(jsonStr, configBuilder);
    NetSelectConfigs.NetSelectConfig config = configBuilder.build();
    ValidateNetSelectConfig.validateConfig(config);
    return config;
  }

  // Parse a yaml string as a NetSelectConfig proto struct
  @VisibleForTesting
  public static NetSelectConfigs.NetSelectConfig fromYamlConfig(String yamlStr)
      throws InvalidProtocolBufferException, JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  public static NetSelectConfigs.NetSelectConfig fromYamlConfig(
      String yamlStr, StringLookup variableResolver)
      throws InvalidProtocolBufferException, JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  @VisibleForTesting
  static void reset() {
    _instance = null;
  }

  public static void initFromFile(Path cfgFilePath) throws IOException {
    if (_instance == null) {
      if (Files.notExists(cfgFilePath)) {
        throw new IllegalArgumentException(
            "Missing config file at: " + cfgFilePath.toAbsolutePath());
      }

      String filename = cfgFilePath.getFileName().toString();
      if (filename.endsWith(".yaml")) {
        _instance = new NetSelectConfig(fromYamlConfig(Files.readString(cfgFilePath)));
      } else if (filename.endsWith(".json")) {
        _instance = new NetSelectConfig(fromJsonConfig(Files.readString(cfgFilePath)));
      } else {
        throw new IllegalArgumentException(
            "Invalid config file format provided - must be either .json or .yaml");
      }
    }
  }

  public static NetSelectConfigs.NetSelectConfig get() {
    return _instance.config;
  }

  /** The configured flush threshold, or the 1 MiB default when unset. */
  public static long getBlockFlushThresholdBytes(NetSelectConfigs.StorageConfig storageConfig) {
    return storageConfig.getBlockFlushThresholdBytes() > 0
        ? storageConfig.getBlockFlushThresholdBytes()
        : DEFAULT_BLOCK_FLUSH_THRESHOLD_BYTES;
  }

  public static int getConcurrency(int configuredConcurrency) {
    return configuredConcurrency > 0 ? configuredConcurrency : DEFAULT_CONCURRENCY;
  }

  private final NetSelectConfigs.NetSelectConfig config;

  private NetSelectConfig(NetSelectConfigs.NetSelectConfig config) {
    this.config = config;
  }
}
