package com.ifblock.variable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ifblock.exception.ConfigurationException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.Map;
import java.util.TreeMap;

/**
 * Factory for creating VariableAccessors from maps, JSON objects and YAML documents.
 */
public final class VariableAccessorFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private VariableAccessorFactory() {
    }

    /**
     * Create an accessor over a map of variables.
     *
     * @param variables Variables keyed by name; nested maps are navigable by dot-path
     * @return Accessor snapshot of the map
     */
    public static VariableAccessor fromMap(Map<String, ?> variables) {
        return new MapVariableAccessor(variables);
    }

    /**
     * Create an accessor from declared defaults overlaid by supplied arguments.
     * Argument names replace defaults case-insensitively.
     *
     * @param defaults  Declared default values (may be null)
     * @param arguments Supplied argument values (may be null)
     * @return Accessor over the merged store
     */
    public static VariableAccessor merged(Map<String, ?> defaults, Map<String, ?> arguments) {
        Map<String, Object> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (defaults != null) {
            merged.putAll(defaults);
        }
        if (arguments != null) {
            merged.putAll(arguments);
        }
        return new MapVariableAccessor(merged);
    }

    /**
     * Create an accessor from a JSON object document.
     *
     * @param json JSON text whose root is an object
     * @return Accessor over the parsed object
     */
    public static VariableAccessor fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new MapVariableAccessor(Map.of());
        }
        return new MapVariableAccessor(parseJson(json));
    }

    /**
     * Create an accessor from a YAML mapping document.
     *
     * @param yaml YAML text whose root is a mapping
     * @return Accessor over the parsed mapping
     */
    public static VariableAccessor fromYaml(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            return new MapVariableAccessor(Map.of());
        }
        return new MapVariableAccessor(parseYaml(yaml));
    }

    static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid JSON variables: " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> parseYaml(String yaml) {
        Object root;
        try {
            root = new Yaml().load(yaml);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML variables: " + e.getMessage(), e);
        }
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map)) {
            throw new ConfigurationException("YAML variables must be a mapping, found "
                    + root.getClass().getSimpleName());
        }
        return (Map<String, Object>) root;
    }
}
