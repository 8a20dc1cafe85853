package com.skyport.panel.api.model;

public record HealthResponse(
        String status,
        String service
) {
}
