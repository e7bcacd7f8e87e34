package com.phonepe.memoria.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Values flowing between the steps of one run. Thread safe, as the durable runner executes independent steps of a
 * wave in parallel. Values restored from a checkpoint are kept as JSON until first read through a typed key.
 */
public class PipelineState {
    private final ObjectMapper mapper;
    private final Map<String, Object> values = new ConcurrentHashMap<>();
    private volatile boolean degraded;

    public PipelineState(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static PipelineState restore(ObjectMapper mapper, Map<String, JsonNode> snapshot, boolean degraded) {
        final var state = new PipelineState(mapper);
        if (snapshot != null) {
            state.values.putAll(snapshot);
        }
        state.degraded = degraded;
        return state;
    }

    public <T> PipelineState put(StateKey<T> key, T value) {
        if (value == null) {
            values.remove(key.getName());
        }
        else {
            values.put(key.getName(), value);
        }
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(StateKey<T> key) {
        final var value = values.get(key.getName());
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof JsonNode node) {
            final T converted = mapper.convertValue(node, key.getType());
            values.put(key.getName(), converted);
            return Optional.ofNullable(converted);
        }
        return Optional.of((T) value);
    }

    /**
     * Value for the key. A missing required value means the step sequence was not validated, hence the state error.
     */
    public <T> T require(StateKey<T> key) {
        return get(key).orElseThrow(() -> new IllegalStateException("Missing pipeline state value: " + key));
    }

    public <T> T getOrDefault(StateKey<T> key, T defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Set<String> keys() {
        return Set.copyOf(values.keySet());
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void markDegraded() {
        this.degraded = true;
    }

    /**
     * JSON form of every value, for checkpoints
     */
    public Map<String, JsonNode> snapshot() {
        final var snapshot = new HashMap<String, JsonNode>();
        values.forEach((name, value) -> snapshot.put(name, mapper.valueToTree(value)));
        return snapshot;
    }
}
