package com.skyport.panel.api.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Settings shared by every call to a node agent. The same timeouts apply to the container check,
 * the redeploy call and the compensating delete.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "app.node")
public class NodeClientProperties {

    @NotBlank
    private String username = "Skyport";
    @NotBlank
    private String scheme = "http";
    @Positive
    private int connectTimeoutSeconds = 10;
    @Positive
    private int requestTimeoutSeconds = 30;

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getScheme() {
        return scheme;
    }

    public void setScheme(String scheme) {
        this.scheme = scheme;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
}
