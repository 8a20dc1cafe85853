package com.skyport.panel.api.service;

import org.springframework.http.HttpStatus;

public enum RedeployFailureKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.BAD_REQUEST),
    PRECONDITION_FAILED(HttpStatus.BAD_REQUEST),
    IMAGE_NOT_FOUND(HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_PORT_MAPPING(HttpStatus.INTERNAL_SERVER_ERROR),
    UPSTREAM_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    VERIFICATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    REDEPLOYMENT_FAILED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    RedeployFailureKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    /**
     * Kinds reported to the caller through the generic "redeployment failed" envelope.
     */
    public boolean isGenericFailure() {
        return status.is5xxServerError();
    }
}
