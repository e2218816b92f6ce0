package com.zzf.bashnorm.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes normalized trees as nested {@code {kind, value, type?, children}} objects.
 */
public class TreeJsonWriter {
    private final ObjectMapper objectMapper;

    public TreeJsonWriter() {
        this(new ObjectMapper());
    }

    public TreeJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJsonNode(NormalizedNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("kind", node.kind().tag());
        json.put("value", node.value());
        if (node instanceof ArgumentNode argument) {
            json.put("type", argument.type().templateName());
        }
        ArrayNode children = json.putArray("children");
        for (NormalizedNode child : node.children()) {
            children.add(toJsonNode(child));
        }
        return json;
    }

    public String write(NormalizedNode node, boolean pretty) {
        try {
            ObjectNode json = toJsonNode(node);
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json)
                    : objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tree: " + e.getMessage(), e);
        }
    }
}
