package com.hdlsim.proxy.io;

import com.hdlsim.proxy.handle.HierarchyObject;
import com.hdlsim.proxy.handle.NonHierarchyIndexableObject;
import com.hdlsim.proxy.handle.NonHierarchyObject;
import com.hdlsim.proxy.handle.RegionObject;
import com.hdlsim.proxy.handle.SimHandleBase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes a discovered proxy tree into a JSON snapshot.
 *
 * Each object becomes a node with its path, native type, proxy kind and, for
 * value-bearing objects, the current value as text. Scopes and arrays list
 * their children in iteration order. A value that cannot be read is written as
 * {@code null} with an {@code error} field.
 */
@Log4j2
public final class HierarchyJsonWriter {
    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toJson(SimHandleBase obj) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", obj.name());
        node.put("path", obj.path());
        node.put("type", obj.typeName());
        node.put("kind", obj.getClass().getSimpleName());
        if (obj.definitionName() != null)
            node.put("definitionName", obj.definitionName());
        if (obj.definitionFile() != null)
            node.put("definitionFile", obj.definitionFile());

        if (obj instanceof NonHierarchyIndexableObject array) {
            if (array.range() != null)
                node.put("range", array.range().toString());
            ArrayNode elements = node.putArray("elements");
            for (SimHandleBase element : array)
                elements.add(toJson(element));
        } else if (obj instanceof NonHierarchyObject value) {
            putValue(node, value);
        } else if (obj instanceof RegionObject<?> region) {
            ArrayNode children = node.putArray("children");
            for (SimHandleBase child : region)
                children.add(toJson(child));
        }
        return node;
    }

    /** Pretty-printed snapshot of everything below {@code root}. */
    public String write(HierarchyObject root) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize hierarchy of " + root.path(), e);
        }
    }

    public void write(HierarchyObject root, Path file) throws IOException {
        Files.writeString(file, write(root));
        log.info("Hierarchy snapshot of {} saved to {}", root.path(), file);
    }

    private void putValue(ObjectNode node, NonHierarchyObject obj) {
        try {
            Object value = obj.getValue();
            if (value instanceof List<?> list) {
                ArrayNode values = node.putArray("value");
                list.forEach(v -> values.add(String.valueOf(v)));
            } else {
                node.put("value", String.valueOf(value));
            }
        } catch (RuntimeException e) {
            log.warn("Unable to read {}: {}", obj.path(), e.getMessage());
            node.putNull("value");
            node.put("error", e.getMessage());
        }
    }
}
