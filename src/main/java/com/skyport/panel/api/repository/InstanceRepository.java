package com.skyport.panel.api.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.skyport.panel.api.model.ImageRecord;
import com.skyport.panel.api.model.InstanceRecord;
import com.skyport.panel.api.model.NodeRecord;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * View over the control-plane keys: {@code {id}_instance}, {@code {nodeId}_node},
 * {@code images}, {@code {userId}_instances} and {@code instances}.
 * <p>
 * The two instance lists are shared with other writers, so their entries are handled as raw JSON
 * and rewritten without passing through {@link InstanceRecord}.
 */
@Repository
public class InstanceRepository {

    public static final String GLOBAL_INSTANCES_KEY = "instances";
    public static final String IMAGES_KEY = "images";

    private static final TypeReference<List<ImageRecord>> IMAGE_LIST = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public InstanceRepository(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public static String instanceKey(String instanceId) {
        return instanceId + "_instance";
    }

    public static String nodeKey(String nodeId) {
        return nodeId + "_node";
    }

    public static String userInstancesKey(String userId) {
        return userId + "_instances";
    }

    public Optional<InstanceRecord> findInstance(String instanceId) {
        return read(instanceKey(instanceId), objectMapper.constructType(InstanceRecord.class));
    }

    public Optional<NodeRecord> findNode(String nodeId) {
        return read(nodeKey(nodeId), objectMapper.constructType(NodeRecord.class));
    }

    public Optional<ImageRecord> findImage(String image) {
        List<ImageRecord> images = this.<List<ImageRecord>>read(IMAGES_KEY, objectMapper.constructType(IMAGE_LIST))
                .orElse(List.of());
        return images.stream()
                .filter(Objects::nonNull)
                .filter(candidate -> image.equals(candidate.image()))
                .findFirst();
    }

    public ArrayNode findUserInstances(String userId) {
        return readList(userInstancesKey(userId));
    }

    public ArrayNode findAllInstances() {
        return readList(GLOBAL_INSTANCES_KEY);
    }

    public void saveUserInstances(String userId, ArrayNode instances) {
        write(userInstancesKey(userId), instances);
    }

    public void saveAllInstances(ArrayNode instances) {
        write(GLOBAL_INSTANCES_KEY, instances);
    }

    /**
     * List entry for an instance, in the same layout as its {@code {id}_instance} record.
     */
    public JsonNode toListEntry(InstanceRecord instance) {
        return objectMapper.valueToTree(instance);
    }

    public void saveInstance(InstanceRecord instance) {
        write(instanceKey(instance.id()), instance);
    }

    private <T> Optional<T> read(String key, JavaType type) {
        Optional<String> json = store.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("stored value under key " + key + " is not readable", ex);
        }
    }

    private ArrayNode readList(String key) {
        Optional<JsonNode> value = read(key, objectMapper.constructType(JsonNode.class));
        if (value.isEmpty() || value.get().isNull()) {
            return objectMapper.createArrayNode();
        }
        if (!(value.get() instanceof ArrayNode list)) {
            throw new IllegalStateException("stored value under key " + key + " is not a list");
        }
        return list;
    }

    private void write(String key, Object value) {
        try {
            store.set(key, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("value for key " + key + " could not be serialized", ex);
        }
    }
}
