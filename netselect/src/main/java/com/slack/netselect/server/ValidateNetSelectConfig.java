package com.slack.netselect.server;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.netselect.proto.config.NetSelectConfigs;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class ValidateNetSelectConfig {

  /**
   * Ensures the config values needed by the configured roles are present and consistent. Classes
   * using a config are still expected to validate the values they depend on.
   */
  public static void validateConfig(NetSelectConfigs.NetSelectConfig config) {
    validateNodeRoles(config.getNodeRolesList());
    if (config.getNodeRolesList().contains(NetSelectConfigs.NodeRole.STORAGE)) {
      validateStorageConfig(config.getStorageConfig());
    }
    if (config.getNodeRolesList().contains(NetSelectConfigs.NodeRole.SELECT)) {
      validateSelectConfig(config.getSelectConfig());
    }
    if (config.getNodeRolesList().contains(NetSelectConfigs.NodeRole.STORAGE)
        && config.getNodeRolesList().contains(NetSelectConfigs.NodeRole.SELECT)) {
      checkArgument(
          config.getStorageConfig().getServerConfig().getServerPort()
              != config.getSelectConfig().getServerConfig().getServerPort(),
          "StorageConfig and SelectConfig must use different server ports");
    }
  }

  private static void validateStorageConfig(NetSelectConfigs.StorageConfig storageConfig) {
    validateServerConfig("StorageConfig", storageConfig.getServerConfig());
    checkArgument(
        storageConfig.getBlockFlushThresholdBytes() >= 0,
        "StorageConfig blockFlushThresholdBytes cannot be negative");
    checkArgument(
        storageConfig.getDefaultConcurrency() >= 0,
        "StorageConfig defaultConcurrency cannot be negative");
  }

  private static void validateSelectConfig(NetSelectConfigs.SelectConfig selectConfig) {
    validateServerConfig("SelectConfig", selectConfig.getServerConfig());
    checkArgument(
        selectConfig.getStorageNodesCount() > 0,
        "SelectConfig must list at least one storage node");
    Set<String> addrs = new HashSet<>();
    for (NetSelectConfigs.StorageNodeConfig node : selectConfig.getStorageNodesList()) {
      checkArgument(!node.getAddr().isBlank(), "SelectConfig storage node addr cannot be empty");
      checkArgument(
          !node.getAddr().contains("://"),
          "SelectConfig storage node addr %s must not contain a scheme, use the tls flag instead",
          node.getAddr());
      checkArgument(
          addrs.add(node.getAddr()),
          "SelectConfig storage node addr %s is listed more than once",
          node.getAddr());
    }
    checkArgument(
        selectConfig.getDefaultConcurrency() >= 0,
        "SelectConfig defaultConcurrency cannot be negative");
  }

  private static void validateServerConfig(
      String section, NetSelectConfigs.ServerConfig serverConfig) {
    checkArgument(
        serverConfig.getServerPort() > 0 && serverConfig.getServerPort() <= 65535,
        "%s serverPort must be between 1 and 65535",
        section);
    checkArgument(
        serverConfig.getRequestTimeoutMs() >= 0,
        "%s requestTimeoutMs cannot be negative",
        section);
  }

  public static void validateNodeRoles(List<NetSelectConfigs.NodeRole> nodeRoleList) {
    // JSON parsing already throws away roles that are not part of the enum
    checkArgument(
        !nodeRoleList.isEmpty(),
        "NetSelect must start with at least 1 node role. Accepted roles are "
            + Arrays.toString(NetSelectConfigs.NodeRole.values()));
  }
}
