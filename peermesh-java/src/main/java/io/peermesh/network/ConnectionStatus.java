package io.peermesh.network;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of one connection record, as shown on the agent status page.
 */
public record ConnectionStatus(
    @JsonProperty("cluster_id") String clusterId,
    @JsonProperty("state") ConnectionState state,
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("connection_id") String connectionId,
    @JsonProperty("last_activity_ms") long lastActivityMs,
    @JsonProperty("close_reason") String closeReason
) {}
