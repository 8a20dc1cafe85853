package com.skyport.panel.api.service;

import com.skyport.panel.api.model.ImageRecord;
import com.skyport.panel.api.model.NodeRecord;
import com.skyport.panel.api.model.NodeRedeployCall;
import com.skyport.panel.api.model.PortBinding;
import com.skyport.panel.api.model.RedeployPayload;
import com.skyport.panel.api.model.RedeployRequest;
import com.skyport.panel.api.repository.InstanceRepository;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class RedeployPayloadBuilder {

    static final String LABEL_INSTANCE = "com.skyport.instance";
    static final String LABEL_INSTANCE_ID = "com.skyport.instance.id";
    static final String LABEL_MANAGED = "com.skyport.managed";

    private final InstanceRepository instanceRepository;

    public RedeployPayloadBuilder(InstanceRepository instanceRepository) {
        this.instanceRepository = instanceRepository;
    }

    public NodeRedeployCall build(RedeployRequest request,
                                  String image,
                                  NodeRecord node,
                                  String containerId,
                                  List<String> env) {
        ImageRecord imageRecord = instanceRepository.findImage(image)
                .orElseThrow(() -> new RedeploymentException(
                        RedeployFailureKind.IMAGE_NOT_FOUND,
                        "Image " + image + " not found in database"
                ));

        Map<String, Map<String, Object>> exposedPorts = new LinkedHashMap<>();
        Map<String, List<PortBinding>> portBindings = new LinkedHashMap<>();
        for (String mapping : request.ports().split(",", -1)) {
            String[] sides = mapping.split(":", -1);
            String hostPort = sides[0];
            String containerPort = sides.length > 1 ? sides[1] : "";
            if (!StringUtils.hasLength(hostPort) || !StringUtils.hasLength(containerPort)) {
                throw new RedeploymentException(RedeployFailureKind.INVALID_PORT_MAPPING, "Invalid port mapping: " + mapping);
            }
            if (RedeployRequestValidator.parseLeadingInt(hostPort).isEmpty()) {
                throw new RedeploymentException(RedeployFailureKind.INVALID_PORT_MAPPING, "Invalid host port: " + hostPort);
            }
            if (RedeployRequestValidator.parseLeadingInt(containerPort).isEmpty()) {
                throw new RedeploymentException(RedeployFailureKind.INVALID_PORT_MAPPING, "Invalid container port: " + containerPort);
            }
            String key = containerPort + "/tcp";
            exposedPorts.put(key, Map.of());
            portBindings.put(key, List.of(new PortBinding(hostPort)));
        }

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_INSTANCE, "true");
        labels.put(LABEL_INSTANCE_ID, request.instanceId());
        labels.put(LABEL_MANAGED, "true");

        RedeployPayload payload = new RedeployPayload(
                request.name(),
                request.instanceId(),
                image,
                env == null ? List.of() : env,
                imageRecord.scripts(),
                request.memory(),
                request.cpu(),
                exposedPorts,
                portBindings,
                imageRecord.altImages(),
                labels
        );
        return new NodeRedeployCall(node, containerId, UUID.randomUUID().toString(), payload);
    }
}
