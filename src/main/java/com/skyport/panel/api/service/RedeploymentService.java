package com.skyport.panel.api.service;

import com.skyport.panel.api.model.AdminIdentity;
import com.skyport.panel.api.model.AuditAction;
import com.skyport.panel.api.model.AuditEvent;
import com.skyport.panel.api.model.InstanceRecord;
import com.skyport.panel.api.model.NodeRecord;
import com.skyport.panel.api.model.NodeRedeployCall;
import com.skyport.panel.api.model.NodeRedeployResponse;
import com.skyport.panel.api.model.RedeployRequest;
import com.skyport.panel.api.model.RedeployResult;
import com.skyport.panel.api.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replaces the container behind an instance on its node and brings the stored instance views in
 * line with the new container.
 *
 * <p>Steps run in order and stop at the first failure: load the instance and its node, confirm the
 * current container still exists, build and send the redeploy call, then persist. Only the
 * persistence step has a compensating action: the freshly created container is deleted.
 */
@Service
public class RedeploymentService {

    private static final Logger log = LoggerFactory.getLogger(RedeploymentService.class);

    private final InstanceRepository instanceRepository;
    private final NodeClient nodeClient;
    private final RedeployPayloadBuilder payloadBuilder;
    private final InstanceStateUpdater stateUpdater;
    private final AuditRecorder auditRecorder;

    public RedeploymentService(InstanceRepository instanceRepository,
                               NodeClient nodeClient,
                               RedeployPayloadBuilder payloadBuilder,
                               InstanceStateUpdater stateUpdater,
                               AuditRecorder auditRecorder) {
        this.instanceRepository = instanceRepository;
        this.nodeClient = nodeClient;
        this.payloadBuilder = payloadBuilder;
        this.stateUpdater = stateUpdater;
        this.auditRecorder = auditRecorder;
    }

    public RedeployResult redeploy(AdminIdentity actor, String clientIp, RedeployRequest request) {
        String instanceId = request.instanceId();
        log.info("Redeploying instance {} requested by {}", instanceId, actor.username());

        InstanceRecord instance = instanceRepository.findInstance(instanceId).orElse(null);
        if (instance == null) {
            audit(actor, AuditAction.REDEPLOY_FAIL_NOT_FOUND, clientIp, metadata("instanceId", instanceId));
            throw new RedeploymentException(RedeployFailureKind.NOT_FOUND, "Instance not found");
        }

        String nodeId = instance.nodeId();
        if (!StringUtils.hasText(nodeId)) {
            throw new RedeploymentException(RedeployFailureKind.INVALID_STATE, "Instance has no associated node");
        }

        String image = RedeployRequestValidator.extractImageName(request.image())
                .orElseThrow(() -> new RedeploymentException(
                        RedeployFailureKind.INVALID_INPUT,
                        "Invalid image format",
                        "Image must contain the actual image name in parentheses"
                ));

        NodeRecord node = instanceRepository.findNode(nodeId).orElse(null);
        if (node == null) {
            audit(actor, AuditAction.REDEPLOY_FAIL_INVALID_NODE, clientIp, metadata("nodeId", nodeId));
            throw new RedeploymentException(
                    RedeployFailureKind.INVALID_STATE,
                    "Invalid node",
                    "The node associated with this instance no longer exists"
            );
        }

        try {
            nodeClient.verifyContainer(node, instance.containerId());
        } catch (NodeClientException ex) {
            log.warn("Container check for instance {} on node {} failed: {}", instanceId, nodeId, ex.getMessage());
            Map<String, Object> metadata = metadata("instanceId", instanceId);
            metadata.put("error", ex.getMessage());
            audit(actor, AuditAction.REDEPLOY_FAIL_CONTAINER_CHECK, clientIp, metadata);
            throw new RedeploymentException(
                    RedeployFailureKind.PRECONDITION_FAILED,
                    "Container check failed",
                    "The existing container could not be verified",
                    ex
            );
        }

        NodeRedeployCall call = payloadBuilder.build(request, image, node, instance.containerId(), instance.env());

        NodeRedeployResponse response;
        try {
            response = nodeClient.redeploy(call);
        } catch (NodeClientException ex) {
            log.warn("Redeploy call for instance {} (request {}) failed: {}", instanceId, call.requestId(), ex.getMessage());
            Map<String, Object> metadata = metadata("instanceId", instanceId);
            metadata.put("error", ex.details());
            audit(actor, AuditAction.REDEPLOY_FAIL_API_ERROR, clientIp, metadata);
            throw new RedeploymentException(RedeployFailureKind.UPSTREAM_ERROR, ex.getMessage(), ex.details(), ex);
        }

        try {
            stateUpdater.applyRedeploy(request, image, node, response, instance.env(), instance.imageData());
        } catch (RuntimeException ex) {
            String error = describe(ex);
            log.warn("Persisting redeployed instance {} failed: {}", instanceId, error);
            Map<String, Object> metadata = metadata("instanceId", instanceId);
            metadata.put("error", error);
            audit(actor, AuditAction.REDEPLOY_FAIL_DB_UPDATE, clientIp, metadata);
            removeOrphanedContainer(node, response.containerId());
            throw new RedeploymentException(
                    RedeployFailureKind.PERSISTENCE_ERROR,
                    error,
                    Map.of("message", error),
                    ex
            );
        }

        Map<String, Object> metadata = metadata("instanceId", instanceId);
        metadata.put("newContainerId", response.containerId());
        audit(actor, AuditAction.REDEPLOY, clientIp, metadata);
        log.info("Instance {} redeployed on node {} as container {}", instanceId, nodeId, response.containerId());

        return new RedeployResult(response.containerId(), response.volumeId(), instanceId);
    }

    private void removeOrphanedContainer(NodeRecord node, String containerId) {
        try {
            nodeClient.deleteContainer(node, containerId);
            log.info("Removed container {} from node {} after failed persistence", containerId, node.id());
        } catch (NodeClientException ex) {
            log.error("Rollback of container {} on node {} failed: {}", containerId, node.id(), ex.getMessage());
        }
    }

    private void audit(AdminIdentity actor, AuditAction action, String clientIp, Map<String, Object> metadata) {
        auditRecorder.record(AuditEvent.of(actor, action, clientIp, metadata));
    }

    private static String describe(RuntimeException ex) {
        if (ex instanceof ResponseStatusException statusException && statusException.getReason() != null) {
            return statusException.getReason();
        }
        return String.valueOf(ex.getMessage());
    }

    private static Map<String, Object> metadata(String key, Object value) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(key, value);
        return metadata;
    }
}
