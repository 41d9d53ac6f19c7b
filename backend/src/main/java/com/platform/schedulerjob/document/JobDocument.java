package com.platform.schedulerjob.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.schedulerjob.error.ValidationException.FieldViolation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Presence-aware read view over one object of a configuration document.
 *
 * <p>Type mismatches are recorded as violations on the path of the offending key and
 * the accessor returns {@link ConfigValue#unset()}. Nested views share the violation list
 * of their root, so one pass over a document collects every problem.
 */
public final class JobDocument {
    
    private static final Set<String> SECRET_KEYS = Set.of("password", "secret", "pfx");
    
    private final ObjectNode node;
    private final String path;
    private final List<FieldViolation> violations;
    
    private JobDocument(ObjectNode node, String path, List<FieldViolation> violations) {
        this.node = node;
        this.path = path;
        this.violations = violations;
    }
    
    public static JobDocument root(ObjectNode node) {
        return new JobDocument(node, "", new ArrayList<>());
    }
    
    public String path(String key) {
        return path.isEmpty() ? key : path + "." + key;
    }
    
    public List<FieldViolation> violations() {
        return Collections.unmodifiableList(violations);
    }
    
    public void reject(String key, Object rejectedValue, String message) {
        violations.add(new FieldViolation(path(key), isSecret(key) ? null : rejectedValue, message));
    }
    
    /**
     * Keys whose values are never echoed back in violations.
     */
    public static boolean isSecret(String key) {
        return SECRET_KEYS.contains(key);
    }
    
    public void reject(String key, String message) {
        violations.add(FieldViolation.of(path(key), message));
    }
    
    /**
     * Record a violation for every key of this object outside {@code allowed}.
     */
    public void rejectUnknownKeys(Set<String> allowed) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                reject(name, "is not a recognised key");
            }
        }
    }
    
    public ConfigValue<String> string(String key) {
        JsonNode value = node.get(key);
        if (value == null) {
            return ConfigValue.unset();
        }
        if (value.isNull()) {
            return ConfigValue.empty();
        }
        if (!value.isTextual()) {
            reject(key, value.toString(), "must be a string");
            return ConfigValue.unset();
        }
        return value.textValue().isBlank() ? ConfigValue.empty() : ConfigValue.of(value.textValue());
    }
    
    public ConfigValue<Integer> integer(String key) {
        JsonNode value = node.get(key);
        if (value == null) {
            return ConfigValue.unset();
        }
        if (value.isNull()) {
            return ConfigValue.empty();
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            reject(key, value.toString(), "must be a whole number");
            return ConfigValue.unset();
        }
        return ConfigValue.of(value.intValue());
    }
    
    /**
     * A nested block. An empty object is a declared block whose keys all take their defaults.
     */
    public ConfigValue<JobDocument> object(String key) {
        JsonNode value = node.get(key);
        if (value == null) {
            return ConfigValue.unset();
        }
        if (value.isNull()) {
            return ConfigValue.empty();
        }
        if (!value.isObject()) {
            reject(key, value.toString(), "must be an object");
            return ConfigValue.unset();
        }
        return ConfigValue.of(new JobDocument((ObjectNode) value, path(key), violations));
    }
    
    /**
     * A string to string map. Non-string entries are rejected individually.
     */
    public ConfigValue<Map<String, String>> stringMap(String key) {
        ConfigValue<JobDocument> block = object(key);
        if (!block.isSet()) {
            return block.map(doc -> Map.of());
        }
        JobDocument doc = block.get();
        Map<String, String> result = new LinkedHashMap<>();
        doc.node.fields().forEachRemaining(entry -> {
            if (entry.getValue().isTextual()) {
                result.put(entry.getKey(), entry.getValue().textValue());
            } else {
                doc.reject(entry.getKey(), entry.getValue().toString(), "must be a string");
            }
        });
        return ConfigValue.of(result);
    }
    
    public ConfigValue<List<Integer>> integerList(String key) {
        List<JsonNode> elements = elements(key);
        if (elements == null) {
            return listPresence(key);
        }
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = elements.get(i);
            if (element.isIntegralNumber() && element.canConvertToInt()) {
                result.add(element.intValue());
            } else {
                violations.add(new FieldViolation(path(key) + "[" + i + "]", element.toString(), "must be a whole number"));
            }
        }
        return ConfigValue.of(result);
    }
    
    public ConfigValue<List<String>> stringList(String key) {
        List<JsonNode> elements = elements(key);
        if (elements == null) {
            return listPresence(key);
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = elements.get(i);
            if (element.isTextual()) {
                result.add(element.textValue());
            } else {
                violations.add(new FieldViolation(path(key) + "[" + i + "]", element.toString(), "must be a string"));
            }
        }
        return ConfigValue.of(result);
    }
    
    public ConfigValue<List<JobDocument>> objectList(String key) {
        List<JsonNode> elements = elements(key);
        if (elements == null) {
            return listPresence(key);
        }
        List<JobDocument> result = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = elements.get(i);
            String elementPath = path(key) + "[" + i + "]";
            if (element.isObject()) {
                result.add(new JobDocument((ObjectNode) element, elementPath, violations));
            } else {
                violations.add(new FieldViolation(elementPath, element.toString(), "must be an object"));
            }
        }
        return ConfigValue.of(result);
    }
    
    /**
     * @return the elements of a non-empty array, otherwise {@code null}
     */
    private List<JsonNode> elements(String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            return null;
        }
        if (value.isEmpty()) {
            return null;
        }
        List<JsonNode> result = new ArrayList<>(value.size());
        value.forEach(result::add);
        return result;
    }
    
    private <T> ConfigValue<T> listPresence(String key) {
        JsonNode value = node.get(key);
        if (value == null) {
            return ConfigValue.unset();
        }
        if (!value.isNull() && !value.isArray()) {
            reject(key, value.toString(), "must be a list");
            return ConfigValue.unset();
        }
        return ConfigValue.empty();
    }
}
