package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.model.domain.AutomateNode;

import java.util.List;
import java.util.Map;

/**
 * Typed reads over a node's free-form config. Missing, blank and zero values count
 * as unset and yield the fallback.
 */
public final class NodeConfig {

    private final Map<String, Object> values;

    private NodeConfig(Map<String, Object> values) {
        this.values = values != null ? values : Map.of();
    }

    public static NodeConfig of(AutomateNode node) {
        return new NodeConfig(node.getConfig());
    }

    public Object raw(String key) {
        return values.get(key);
    }

    public String text(String key) {
        Object value = values.get(key);
        if (value == null) return null;
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    public String text(String key, String fallback) {
        String text = text(key);
        return text != null ? text : fallback;
    }

    public int integer(String key, int fallback) {
        Object value = values.get(key);
        int parsed = 0;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else if (value instanceof String s && !s.isBlank()) {
            try {
                parsed = (int) Double.parseDouble(s.trim());
            } catch (NumberFormatException ignored) {
                parsed = 0;
            }
        }
        return parsed != 0 ? parsed : fallback;
    }

    public Double decimal(String key) {
        Object value = values.get(key);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public Integer optionalInteger(String key) {
        Object value = values.get(key);
        return value instanceof Number number ? number.intValue() : null;
    }

    public boolean flag(String key) {
        Object value = values.get(key);
        return Boolean.TRUE.equals(value) || "true".equals(value);
    }

    public boolean flagUnlessFalse(String key) {
        Object value = values.get(key);
        return !(Boolean.FALSE.equals(value) || "false".equals(value));
    }

    public List<?> list(String key) {
        Object value = values.get(key);
        return value instanceof List<?> list ? list : List.of();
    }
}
