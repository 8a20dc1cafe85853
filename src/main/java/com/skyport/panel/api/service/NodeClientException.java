package com.skyport.panel.api.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A failed call to a node agent. {@code status} and {@code responseBody} are set when the agent
 * answered with a non-2xx response; both are null for network errors and timeouts.
 */
public class NodeClientException extends RuntimeException {

    private final Integer status;
    private final String responseBody;

    public NodeClientException(String message, Integer status, String responseBody, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.responseBody = responseBody;
    }

    public NodeClientException(String message) {
        this(message, null, null, null);
    }

    public Integer getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (status != null) {
            details.put("status", status);
            details.put("data", responseBody);
        } else {
            details.put("message", getMessage());
        }
        return details;
    }
}
