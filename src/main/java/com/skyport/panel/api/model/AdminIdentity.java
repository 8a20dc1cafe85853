package com.skyport.panel.api.model;

public record AdminIdentity(
        String userId,
        String username,
        boolean admin
) {
    public static AdminIdentity anonymous() {
        return new AdminIdentity("unknown", "unknown", false);
    }
}
