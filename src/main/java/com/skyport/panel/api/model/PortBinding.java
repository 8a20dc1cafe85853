package com.skyport.panel.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PortBinding(@JsonProperty("HostPort") String hostPort) {
}
