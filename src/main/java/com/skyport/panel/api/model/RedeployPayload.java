package com.skyport.panel.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /instances/redeploy/{containerId}} on the node agent.
 */
public record RedeployPayload(
        @JsonProperty("Name") String name,
        @JsonProperty("Id") String id,
        @JsonProperty("Image") String image,
        @JsonProperty("Env") List<String> env,
        @JsonProperty("Scripts") List<JsonNode> scripts,
        @JsonProperty("Memory") int memory,
        @JsonProperty("Cpu") int cpu,
        @JsonProperty("ExposedPorts") Map<String, Map<String, Object>> exposedPorts,
        @JsonProperty("PortBindings") Map<String, List<PortBinding>> portBindings,
        @JsonProperty("AltImages") List<String> altImages,
        @JsonProperty("Labels") Map<String, String> labels
) {
}
