package io.peermesh.agent;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.peermesh.ClusterInfo;
import io.peermesh.NodeAddr;
import io.peermesh.ServiceInfo;
import io.peermesh.discovery.DiscoveryManager;
import io.peermesh.network.ConnectionStatus;
import io.peermesh.proxy.CircuitBreaker;

import java.util.List;
import java.util.Map;

/**
 * Snapshot served by the agent's status endpoint.
 */
public record ClusterStatus(
    @JsonProperty("cluster_id") String clusterId,
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("node_addr") NodeAddr nodeAddr,
    @JsonProperty("services") List<ServiceInfo> services,
    @JsonProperty("peer_clusters") List<ClusterInfo> peerClusters,
    @JsonProperty("connections") List<ConnectionStatus> connections,
    @JsonProperty("cache") List<DiscoveryManager.CacheEntryStatus> cache,
    @JsonProperty("circuit_breakers") Map<String, CircuitBreaker.Status> circuitBreakers
) {}
