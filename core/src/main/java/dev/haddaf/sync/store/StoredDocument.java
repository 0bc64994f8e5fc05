package dev.haddaf.sync.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one document. Accessors are lenient: a field with an unexpected type reads as absent,
 * so decoders can drop malformed documents instead of failing.
 */
public record StoredDocument(DocumentPath path, Map<String, Object> data) {

    public StoredDocument {
        Objects.requireNonNull(path, "path");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public String id() {
        return path.id();
    }

    public boolean has(String field) {
        return data.get(field) != null;
    }

    public Object get(String field) {
        return data.get(field);
    }

    public String getString(String field) {
        return data.get(field) instanceof String value ? value : null;
    }

    public Boolean getBoolean(String field) {
        return data.get(field) instanceof Boolean value ? value : null;
    }

    public Long getLong(String field) {
        return data.get(field) instanceof Number value ? value.longValue() : null;
    }

    public Instant getInstant(String field) {
        return data.get(field) instanceof Instant value ? value : null;
    }

    public List<String> getStringList(String field) {
        if (!(data.get(field) instanceof List<?> values)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value instanceof String text) {
                result.add(text);
            }
        }
        return List.copyOf(result);
    }
}
