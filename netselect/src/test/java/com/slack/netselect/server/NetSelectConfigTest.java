package com.slack.netselect.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.AssertionsForClassTypes.assertThatExceptionOfType;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.InvalidProtocolBufferException;
import com.slack.netselect.proto.config.NetSelectConfigs;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class NetSelectConfigTest {

  @BeforeEach
  public void setUp() {
    NetSelectConfig.reset();
  }

  @AfterEach
  public void tearDown() {
    NetSelectConfig.reset();
  }

  private File resource(String name) {
    return new File(getClass().getClassLoader().getResource(name).getFile());
  }

  private static ObjectNode selectOnlyConfig(ObjectMapper mapper) {
    ObjectNode serverConfig = mapper.createObjectNode().put("serverPort", 9471);
    ObjectNode selectConfig = mapper.createObjectNode();
    selectConfig.set("serverConfig", serverConfig);
    selectConfig.set(
        "storageNodes",
        mapper.createArrayNode().add(mapper.createObjectNode().put("addr", "storage-1:9481")));
    ObjectNode node = mapper.createObjectNode();
    node.set("nodeRoles", mapper.createArrayNode().add("SELECT"));
    node.set("selectConfig", selectConfig);
    return node;
  }

  @Test
  public void testInitWithMissingConfigFile() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> NetSelectConfig.initFromFile(Path.of("missing_config_file.yaml")));
  }

  @Test
  public void testInitWithUnsupportedExtension() throws IOException {
    Path cfgFile = Files.createTempFile("netselect", ".properties");
    try {
      assertThatIllegalArgumentException()
          .isThrownBy(() -> NetSelectConfig.initFromFile(cfgFile))
          .withMessageContaining("must be either .json or .yaml");
    } finally {
      Files.delete(cfgFile);
    }
  }

  @Test
  public void testEmptyJsonCfgFile() {
    assertThatExceptionOfType(InvalidProtocolBufferException.class)
        .isThrownBy(() -> NetSelectConfig.fromJsonConfig(""));
  }

  @Test
  public void testParseNetSelectJsonConfigFile() throws IOException {
    NetSelectConfig.initFromFile(resource("test_config.json").toPath());
    final NetSelectConfigs.NetSelectConfig config = NetSelectConfig.get();

    assertThat(config.getNodeRolesList()).containsExactly(NetSelectConfigs.NodeRole.SELECT);
    assertThat(config.getClusterConfig().getClusterName()).isEqualTo("netselect_json");
    assertThat(config.getClusterConfig().getEnv()).isEqualTo("test");

    final NetSelectConfigs.SelectConfig selectConfig = config.getSelectConfig();
    assertThat(selectConfig.getServerConfig().getServerPort()).isEqualTo(9471);
    assertThat(selectConfig.getServerConfig().getRequestTimeoutMs()).isEqualTo(30000);
    assertThat(selectConfig.getDisableCompression()).isTrue();
    assertThat(selectConfig.getStorageNodesCount()).isEqualTo(2);
    assertThat(selectConfig.getStorageNodes(0).getAddr()).isEqualTo("storage-1:9481");
    assertThat(selectConfig.getStorageNodes(0).getTls()).isFalse();
    assertThat(selectConfig.getStorageNodes(1).getTls()).isTrue();
    assertThat(NetSelectConfig.getConcurrency(selectConfig.getDefaultConcurrency()))
        .isEqualTo(NetSelectConfig.DEFAULT_CONCURRENCY);

    assertThat(config.hasStorageConfig()).isFalse();
  }

  @Test
  public void testParseNetSelectYamlConfigFile() throws IOException {
    final File cfgFile = resource("test_config.yaml");
    final NetSelectConfigs.NetSelectConfig config =
        NetSelectConfig.fromYamlConfig(Files.readString(cfgFile.toPath()), name -> null);

    assertThat(config.getNodeRolesList())
        .containsExactly(NetSelectConfigs.NodeRole.STORAGE, NetSelectConfigs.NodeRole.SELECT);
    assertThat(config.getClusterConfig().getClusterName()).isEqualTo("netselect_local");

    final NetSelectConfigs.StorageConfig storageConfig = config.getStorageConfig();
    assertThat(storageConfig.getServerConfig().getServerPort()).isEqualTo(9481);
    assertThat(storageConfig.getServerConfig().getServerAddress()).isEqualTo("localhost");
    assertThat(NetSelectConfig.getBlockFlushThresholdBytes(storageConfig)).isEqualTo(65536);
    assertThat(NetSelectConfig.getConcurrency(storageConfig.getDefaultConcurrency()))
        .isEqualTo(4);

    final NetSelectConfigs.SelectConfig selectConfig = config.getSelectConfig();
    assertThat(selectConfig.getServerConfig().getServerPort()).isEqualTo(9471);
    assertThat(selectConfig.getStorageNodesList())
        .extracting(NetSelectConfigs.StorageNodeConfig::getAddr)
        .containsExactly("localhost:9481", "storage-2.example.com:9481");
    assertThat(selectConfig.getDisableCompression()).isFalse();
    assertThat(selectConfig.getDefaultConcurrency()).isEqualTo(8);
  }

  @Test
  public void testYamlEnvironmentSubstitution() throws IOException {
    final File cfgFile = resource("test_config.yaml");
    Map<String, String> env =
        Map.of(
            "NETSELECT_CLUSTER_NAME", "prod_logs",
            "NETSELECT_STORAGE_PORT", "10481",
            "NETSELECT_SELECT_PORT", "10471");

    final NetSelectConfigs.NetSelectConfig config =
        NetSelectConfig.fromYamlConfig(Files.readString(cfgFile.toPath()), env::get);

    assertThat(config.getClusterConfig().getClusterName()).isEqualTo("prod_logs");
    assertThat(config.getClusterConfig().getEnv()).isEqualTo("local");
    assertThat(config.getStorageConfig().getServerConfig().getServerPort()).isEqualTo(10481);
    assertThat(config.getSelectConfig().getServerConfig().getServerPort()).isEqualTo(10471);
  }

  @Test
  public void testDefaultsForUnsetValues() throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode storageConfig = mapper.createObjectNode();
    storageConfig.set("serverConfig", mapper.createObjectNode().put("serverPort", 9481));
    ObjectNode node = mapper.createObjectNode();
    node.set("nodeRoles", mapper.createArrayNode().add("STORAGE"));
    node.set("storageConfig", storageConfig);

    final NetSelectConfigs.NetSelectConfig config =
        NetSelectConfig.fromJsonConfig(mapper.writeValueAsString(node));

    assertThat(NetSelectConfig.getBlockFlushThresholdBytes(config.getStorageConfig()))
        .isEqualTo(NetSelectConfig.DEFAULT_BLOCK_FLUSH_THRESHOLD_BYTES);
    assertThat(NetSelectConfig.getConcurrency(0)).isEqualTo(NetSelectConfig.DEFAULT_CONCURRENCY);
    assertThat(config.getStorageConfig().getServerConfig().getRequestTimeoutMs()).isZero();
  }

  @Test
  public void testRejectsMissingRoles() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NetSelectConfig.fromJsonConfig("{}"))
        .withMessageContaining("at least 1 node role");
  }

  @Test
  public void testRejectsSelectWithoutStorageNodes() throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode node = selectOnlyConfig(mapper);
    ((ObjectNode) node.get("selectConfig")).set("storageNodes", mapper.createArrayNode());

    String json = mapper.writeValueAsString(node);
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NetSelectConfig.fromJsonConfig(json))
        .withMessageContaining("at least one storage node");
  }

  @Test
  public void testRejectsBadStorageNodeAddrs() throws IOException {
    ObjectMapper mapper = new ObjectMapper();

    ObjectNode withScheme = selectOnlyConfig(mapper);
    ((ObjectNode) withScheme.get("selectConfig"))
        .set(
            "storageNodes",
            mapper
                .createArrayNode()
                .add(mapper.createObjectNode().put("addr", "https://storage-1:9481")));
    String withSchemeJson = mapper.writeValueAsString(withScheme);
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NetSelectConfig.fromJsonConfig(withSchemeJson))
        .withMessageContaining("must not contain a scheme");

    ObjectNode duplicated = selectOnlyConfig(mapper);
    ((ObjectNode) duplicated.get("selectConfig"))
        .set(
            "storageNodes",
            mapper
                .createArrayNode()
                .add(mapper.createObjectNode().put("addr", "storage-1:9481"))
                .add(mapper.createObjectNode().put("addr", "storage-1:9481").put("tls", true)));
    String duplicatedJson = mapper.writeValueAsString(duplicated);
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NetSelectConfig.fromJsonConfig(duplicatedJson))
        .withMessageContaining("listed more than once");
  }

  @Test
  public void testRejectsBadServerConfig() throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode node = selectOnlyConfig(mapper);
    ((ObjectNode) node.get("selectConfig"))
        .set("serverConfig", mapper.createObjectNode().put("serverPort", 70000));

    String json = mapper.writeValueAsString(node);
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NetSelectConfig.fromJsonConfig(json))
        .withMessageContaining("serverPort must be between 1 and 65535");
  }

  @Test
  public void testRejectsSharedPortForBothRoles() throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode node = selectOnlyConfig(mapper);
    node.set("nodeRoles", mapper.createArrayNode().add("STORAGE").add("SELECT"));
    ObjectNode storageConfig = mapper.createObjectNode();
    storageConfig.set("serverConfig", mapper.createObjectNode().put("serverPort", 9471));
    node.set("storageConfig", storageConfig);

    String json = mapper.writeValueAsString(node);
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NetSelectConfig.fromJsonConfig(json))
        .withMessageContaining("different server ports");
  }
}
