package com.ifblock.variable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ifblock.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link VariableAccessor} over a nested map tree.
 * <p>
 * Keys are matched case-insensitively at every level. A dot-path is resolved
 * greedily, so both nested maps ({"USER": {"NAME": "x"}}) and flattened keys
 * ({"USER.NAME": "x"}) resolve "user.name". Scalars map to their Value kind;
 * lists and maps resolve to their compact JSON text.
 */
public final class MapVariableAccessor implements VariableAccessor {

    private static final Logger log = LoggerFactory.getLogger(MapVariableAccessor.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, Object> variables;

    public MapVariableAccessor(Map<String, ?> variables) {
        this.variables = variables == null ? Collections.emptyMap() : normalize(variables);
    }

    @Override
    public Optional<Value> tryGet(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        String[] segments = path.trim().split("\\.", -1);
        return resolve(variables, segments, 0).flatMap(this::toValue);
    }

    /**
     * Number of top-level variables.
     */
    public int size() {
        return variables.size();
    }

    @SuppressWarnings("unchecked")
    private Optional<Object> resolve(Map<String, Object> map, String[] segments, int from) {
        // Longest key first so flattened keys win over partial nesting
        for (int to = segments.length; to > from; to--) {
            String key = String.join(".", Arrays.copyOfRange(segments, from, to));
            if (!map.containsKey(key)) {
                continue;
            }
            Object value = map.get(key);
            if (to == segments.length) {
                return Optional.ofNullable(value);
            }
            if (value instanceof Map<?, ?> nested) {
                Optional<Object> found = resolve((Map<String, Object>) nested, segments, to);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Value> toValue(Object raw) {
        if (raw instanceof String s) {
            return Optional.of(Value.of(s));
        }
        if (raw instanceof Boolean b) {
            return Optional.of(Value.of(b));
        }
        if (raw instanceof Number n) {
            return Optional.of(Value.of(n.doubleValue()));
        }
        if (raw instanceof Character c) {
            return Optional.of(Value.of(String.valueOf(c)));
        }
        if (raw instanceof Enum<?> e) {
            return Optional.of(Value.of(e.name()));
        }
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
            try {
                return Optional.of(Value.of(objectMapper.writeValueAsString(raw)));
            } catch (JsonProcessingException e) {
                log.warn("Cannot render structured variable as text: {}", e.getMessage());
                return Optional.of(Value.of(String.valueOf(raw)));
            }
        }
        return Optional.of(Value.of(String.valueOf(raw)));
    }

    private static Map<String, Object> normalize(Map<?, ?> source) {
        Map<String, Object> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                value = normalize(nested);
            }
            result.put(String.valueOf(entry.getKey()), value);
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "MapVariableAccessor" + variables.keySet();
    }
}
