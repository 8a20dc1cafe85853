package com.skyport.panel.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Stored node document. Only the connection fields are read; every other attribute is carried
 * along untouched when the node is embedded in an instance record.
 */
public record NodeRecord(ObjectNode document) {

    public NodeRecord {
        document = document == null ? JsonNodeFactory.instance.objectNode() : document.deepCopy();
    }

    public NodeRecord(String id, String name, String address, Integer port, String apiKey) {
        this(connectionDocument(id, name, address, port, apiKey));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NodeRecord fromDocument(JsonNode document) {
        if (!(document instanceof ObjectNode object)) {
            throw new IllegalArgumentException("node must be a JSON object");
        }
        return new NodeRecord(object);
    }

    public String id() {
        return text("id");
    }

    public String name() {
        return text("name");
    }

    public String address() {
        return text("address");
    }

    public Integer port() {
        JsonNode port = document.get("port");
        return port == null || port.isNull() ? null : port.asInt();
    }

    public String apiKey() {
        return text("apiKey");
    }

    @JsonValue
    @Override
    public ObjectNode document() {
        return document.deepCopy();
    }

    private String text(String field) {
        JsonNode value = document.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static ObjectNode connectionDocument(String id, String name, String address, Integer port, String apiKey) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put("id", id);
        document.put("name", name);
        document.put("address", address);
        document.put("port", port);
        document.put("apiKey", apiKey);
        return document;
    }
}
