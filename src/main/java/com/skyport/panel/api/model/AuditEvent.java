package com.skyport.panel.api.model;

import java.time.Instant;
import java.util.Map;

public record AuditEvent(
        String userId,
        String username,
        AuditAction action,
        String ipAddress,
        Map<String, Object> metadata,
        Instant occurredAt
) {
    public AuditEvent {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static AuditEvent of(AdminIdentity actor, AuditAction action, String ipAddress, Map<String, Object> metadata) {
        return new AuditEvent(actor.userId(), actor.username(), action, ipAddress, metadata, Instant.now());
    }
}
