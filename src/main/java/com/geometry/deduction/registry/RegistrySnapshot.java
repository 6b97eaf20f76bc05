package com.geometry.deduction.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.geometry.deduction.core.model.ObjectKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of the live registry contents: kind label, then key, then a
 * rendering of the object. Kinds without objects are left out.
 */
public final class RegistrySnapshot {
    private static final Logger log = LoggerFactory.getLogger(RegistrySnapshot.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Map<String, String>> objects;
    private final int mergeCount;

    private RegistrySnapshot(Map<String, Map<String, String>> objects, int mergeCount) {
        this.objects = objects;
        this.mergeCount = mergeCount;
    }

    public static RegistrySnapshot of(EntityRegistry registry) {
        Map<String, Map<String, String>> objects = new LinkedHashMap<>();
        for (ObjectKind kind : ObjectKind.values()) {
            Map<String, String> byKey = new LinkedHashMap<>();
            for (RegisteredObject object : registry.elements(kind.getType())) {
                byKey.put(object.getKey(), object.toString());
            }
            if (!byKey.isEmpty()) {
                objects.put(kind.getLabel(), Collections.unmodifiableMap(byKey));
            }
        }
        return new RegistrySnapshot(Collections.unmodifiableMap(objects), registry.getMergeLedger().size());
    }

    public Map<String, Map<String, String>> getObjects() {
        return objects;
    }

    public int getMergeCount() {
        return mergeCount;
    }

    public int size(ObjectKind kind) {
        return objects.getOrDefault(kind.getLabel(), Map.of()).size();
    }

    /**
     * Renders the snapshot as indented JSON, or {@code "{}"} if serialization fails.
     */
    public String toJson() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("objects", objects);
        document.put("mergeCount", mergeCount);
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            log.warn("snapshot.serializationFailed error={}", e.getMessage());
            return "{}";
        }
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{" + "objects=" + objects + ", mergeCount=" + mergeCount + '}';
    }
}
