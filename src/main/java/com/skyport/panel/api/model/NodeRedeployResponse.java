package com.skyport.panel.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeRedeployResponse(
        String containerId,
        String volumeId
) {
}
