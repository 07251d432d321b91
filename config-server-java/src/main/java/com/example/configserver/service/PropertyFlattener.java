package com.example.configserver.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Base64;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a parsed YAML document into dotted / indexed keys. Scalars keep their native
 * type; non-string map keys are stringified.
 */
@Component
public class PropertyFlattener {

    public void flatten(Object document, Map<String, Object> target) {
        flatten(null, document, target);
    }

    private void flatten(String prefix, Object value, Map<String, Object> target) {
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                String key = String.valueOf(entry.getKey());
                flatten(prefix == null ? key : prefix + "." + key, entry.getValue(), target);
            }
        } else if (value instanceof Set) {
            // !!set is a mapping whose values are all null
            for (Object member : (Set<?>) value) {
                String key = String.valueOf(member);
                put(prefix == null ? key : prefix + "." + key, null, target);
            }
        } else if (value instanceof Collection) {
            int index = 0;
            for (Object element : (Collection<?>) value) {
                String key = (prefix == null ? "" : prefix) + "[" + index++ + "]";
                flatten(key, element, target);
            }
        } else {
            put(prefix, scalar(value), target);
        }
    }

    private void put(String key, Object value, Map<String, Object> target) {
        if (key != null) {
            target.put(key, value);
        }
    }

    private Object scalar(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? value : 0;
        }
        if (value instanceof byte[]) {
            return Base64.getEncoder().encodeToString((byte[]) value);
        }
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long
                || value instanceof BigInteger || value instanceof BigDecimal) {
            return value;
        }
        return value.toString();
    }
}
