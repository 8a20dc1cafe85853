package com.skyport.panel.api.model;

public record RedeployResponse(
        boolean success,
        String message,
        RedeployResult data
) {
    public static RedeployResponse redeployed(RedeployResult data) {
        return new RedeployResponse(true, "Container redeployed successfully", data);
    }
}
