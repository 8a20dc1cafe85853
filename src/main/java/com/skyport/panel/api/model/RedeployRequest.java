package com.skyport.panel.api.model;

/**
 * Redeploy parameters after boundary validation. {@code memory} and {@code cpu} are already parsed;
 * {@code ports} has passed the {@code host:container[,host:container]} syntax check.
 */
public record RedeployRequest(
        String instanceId,
        String image,
        int memory,
        int cpu,
        String ports,
        String name,
        String userId,
        String primary
) {
}
