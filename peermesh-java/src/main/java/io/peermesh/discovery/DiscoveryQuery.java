package io.peermesh.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DiscoveryQuery(
    @JsonProperty("service") String service,
    @JsonProperty("namespace") String namespace
) {}
