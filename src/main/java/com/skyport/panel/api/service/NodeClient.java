package com.skyport.panel.api.service;

import com.skyport.panel.api.config.NodeClientProperties;
import com.skyport.panel.api.model.NodeRecord;
import com.skyport.panel.api.model.NodeRedeployCall;
import com.skyport.panel.api.model.NodeRedeployResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Calls the node agent API on behalf of the control plane, authenticating with the node's API key.
 */
@Component
public class NodeClient {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String INSTANCE_URI = "{scheme}://{address}:{port}/instances/{containerId}";
    private static final String REDEPLOY_URI = "{scheme}://{address}:{port}/instances/redeploy/{containerId}";
    private static final Set<String> EMPTY_BODIES = Set.of("null", "false", "0", "\"\"");

    private final RestClient restClient;
    private final NodeClientProperties properties;

    public NodeClient(RestClient nodeRestClient, NodeClientProperties properties) {
        this.restClient = nodeRestClient;
        this.properties = properties;
    }

    /**
     * Confirms the node still knows {@code containerId}. An empty answer counts as a failure.
     */
    public void verifyContainer(NodeRecord node, String containerId) {
        String body = call("container check", () -> restClient.get()
                .uri(INSTANCE_URI, properties.getScheme(), node.address(), node.port(), containerId)
                .headers(headers -> authenticate(headers, node))
                .retrieve()
                .body(String.class));
        if (!StringUtils.hasText(body) || EMPTY_BODIES.contains(body.trim())) {
            throw new NodeClientException("Container not found");
        }
    }

    public NodeRedeployResponse redeploy(NodeRedeployCall call) {
        NodeRecord node = call.node();
        NodeRedeployResponse response = call("redeploy", () -> restClient.post()
                .uri(REDEPLOY_URI, properties.getScheme(), node.address(), node.port(), call.containerId())
                .headers(headers -> {
                    authenticate(headers, node);
                    headers.set(REQUEST_ID_HEADER, call.requestId());
                })
                .contentType(MediaType.APPLICATION_JSON)
                .body(call.payload())
                .retrieve()
                .body(NodeRedeployResponse.class));
        if (response == null || !StringUtils.hasText(response.containerId())) {
            throw new NodeClientException("node returned no container id");
        }
        return response;
    }

    public void deleteContainer(NodeRecord node, String containerId) {
        call("delete", () -> restClient.delete()
                .uri(INSTANCE_URI, properties.getScheme(), node.address(), node.port(), containerId)
                .headers(headers -> authenticate(headers, node))
                .retrieve()
                .toBodilessEntity());
    }

    private void authenticate(HttpHeaders headers, NodeRecord node) {
        headers.setBasicAuth(properties.getUsername(), Objects.requireNonNullElse(node.apiKey(), ""));
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException ex) {
            String details = ex.getResponseBodyAsString();
            throw new NodeClientException(
                    "node " + operation + " failed: HTTP " + ex.getStatusCode().value() + (StringUtils.hasText(details) ? " " + details : ""),
                    ex.getStatusCode().value(),
                    details,
                    ex
            );
        } catch (RestClientException ex) {
            throw new NodeClientException("node " + operation + " failed: " + ex.getMessage(), null, null, ex);
        }
    }
}
