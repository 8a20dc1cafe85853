package com.skyport.panel.api.controller;

import com.skyport.panel.api.model.ApiError;
import com.skyport.panel.api.service.RedeploymentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String REDEPLOY_FAILED = "Instance redeployment failed";
    static final String SUGGESTION = "Check logs for more details and try again";

    @ExceptionHandler(RedeploymentException.class)
    public ResponseEntity<ApiError> handleRedeployment(RedeploymentException ex) {
        if (ex.getKind().isGenericFailure()) {
            log.error("Redeployment process error ({}): {}", ex.getKind(), ex.getReason(), ex);
            Object details = ex.getDetails() instanceof Map<?, ?> ? ex.getDetails() : Map.of("message", String.valueOf(ex.getReason()));
            return ResponseEntity.status(ex.getStatusCode())
                    .body(new ApiError(REDEPLOY_FAILED, details, null, SUGGESTION));
        }
        return ResponseEntity.status(ex.getStatusCode())
                .body(new ApiError(ex.getReason(), ex.getDetails(), ex.getMissing(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(ApiError.of(errorResponse.getBody().getTitle(), errorResponse.getBody().getDetail()));
        }
        log.error("Redeployment process error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError(REDEPLOY_FAILED, Map.of("message", String.valueOf(ex.getMessage())), null, SUGGESTION));
    }
}
