package com.pagescribe.extractor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens nested record fields into dot-joined keys for tabular storage,
 * e.g. {@code {"patient": {"age": {"num": 3}}}} becomes {@code {"patient.age.num": 3}}.
 * <p>
 * Lists and scalars are leaves and are left untouched; an empty nested object becomes a {@code null} leaf.
 */
public final class RecordFlattener {
    public static final String SEPARATOR = ".";

    private RecordFlattener() {}

    public static Map<String, Object> flatten(Map<String, ?> fields) {
        Map<String, Object> out = new LinkedHashMap<>();
        flattenInto("", fields, out);
        return out;
    }

    private static void flattenInto(String prefix, Map<?, ?> node, Map<String, Object> out) {
        for (Map.Entry<?, ?> e : node.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(e.getKey()) : prefix + SEPARATOR + e.getKey();
            Object value = e.getValue();
            if (value instanceof Map<?, ?> nested) {
                if (nested.isEmpty()) {
                    out.put(key, null);
                } else {
                    flattenInto(key, nested, out);
                }
            } else {
                out.put(key, value);
            }
        }
    }
}
