package com.skyport.panel.api.model;

public record RedeployResult(
        String containerId,
        String volumeId,
        String instanceId
) {
}
