package com.skyport.panel.api.model;

/**
 * Raw query parameters of {@code GET /instances/redeploy/{id}}, before validation.
 */
public record RedeployQuery(
        String image,
        String memory,
        String cpu,
        String ports,
        String name,
        String user,
        String primary
) {
}
