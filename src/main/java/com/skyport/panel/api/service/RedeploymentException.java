package com.skyport.panel.api.service;

import org.springframework.web.server.ResponseStatusException;

import java.util.List;

public class RedeploymentException extends ResponseStatusException {

    private final RedeployFailureKind kind;
    private final Object details;
    private final List<String> missing;

    public RedeploymentException(RedeployFailureKind kind, String reason) {
        this(kind, reason, null, null, null);
    }

    public RedeploymentException(RedeployFailureKind kind, String reason, Object details) {
        this(kind, reason, details, null, null);
    }

    public RedeploymentException(RedeployFailureKind kind, String reason, Object details, Throwable cause) {
        this(kind, reason, details, null, cause);
    }

    private RedeploymentException(RedeployFailureKind kind, String reason, Object details, List<String> missing, Throwable cause) {
        super(kind.status(), reason, cause);
        this.kind = kind;
        this.details = details;
        this.missing = missing;
    }

    public static RedeploymentException missingParameters(List<String> missing) {
        return new RedeploymentException(
                RedeployFailureKind.INVALID_INPUT,
                "Missing required parameters",
                null,
                List.copyOf(missing),
                null
        );
    }

    public RedeployFailureKind getKind() {
        return kind;
    }

    public Object getDetails() {
        return details;
    }

    public List<String> getMissing() {
        return missing;
    }
}
