package com.skyport.panel.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageRecord(
        @JsonProperty("Image") String image,
        @JsonProperty("Scripts") List<JsonNode> scripts,
        @JsonProperty("AltImages") List<String> altImages
) {
    public ImageRecord {
        scripts = scripts == null ? List.of() : List.copyOf(scripts);
        altImages = altImages == null ? List.of() : List.copyOf(altImages);
    }
}
