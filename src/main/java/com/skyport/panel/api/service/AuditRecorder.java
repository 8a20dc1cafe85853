package com.skyport.panel.api.service;

import com.skyport.panel.api.model.AuditEvent;

/**
 * Fire-and-forget audit sink. Implementations must not throw back into the caller.
 */
public interface AuditRecorder {

    void record(AuditEvent event);
}
