package com.skyport.panel.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.List;

/**
 * Authoritative instance record, stored under {@code {id}_instance} and mirrored into the
 * {@code instances} and {@code {userId}_instances} lists. Field names follow the stored layout.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstanceRecord(
        @JsonProperty("Name") String name,
        @JsonProperty("Id") String id,
        @JsonProperty("Node") NodeRecord node,
        @JsonProperty("User") String user,
        @JsonProperty("ContainerId") String containerId,
        @JsonProperty("VolumeId") String volumeId,
        @JsonProperty("Memory") Integer memory,
        @JsonProperty("Cpu") Integer cpu,
        @JsonProperty("Ports") String ports,
        @JsonProperty("Primary") String primary,
        @JsonProperty("Env") List<String> env,
        @JsonProperty("Image") String image,
        @JsonProperty("AltImages") List<String> altImages,
        @JsonProperty("imageData") JsonNode imageData,
        @JsonProperty("LastUpdated") Instant lastUpdated
) {
    public InstanceRecord {
        env = env == null ? List.of() : List.copyOf(env);
        altImages = altImages == null ? List.of() : List.copyOf(altImages);
        if (imageData == null || imageData.isNull()) {
            imageData = JsonNodeFactory.instance.objectNode();
        }
    }

    public String nodeId() {
        return node == null ? null : node.id();
    }
}
