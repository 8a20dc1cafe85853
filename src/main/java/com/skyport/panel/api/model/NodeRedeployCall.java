package com.skyport.panel.api.model;

/**
 * A fully prepared redeploy call against one node agent. {@code requestId} travels as the
 * {@code X-Request-ID} header.
 */
public record NodeRedeployCall(
        NodeRecord node,
        String containerId,
        String requestId,
        RedeployPayload payload
) {
}
