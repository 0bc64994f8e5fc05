package dev.haddaf.sync.firestore;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.FieldValue;
import dev.haddaf.sync.store.ServerValue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Firestore client values and the plain Java values used by the store port.
 */
final class FirestoreValues {

    private FirestoreValues() {
    }

    static Map<String, Object> toFirestore(Map<String, Object> fields) {
        Map<String, Object> converted = new LinkedHashMap<>();
        fields.forEach((field, value) -> converted.put(field, toFirestore(value)));
        return converted;
    }

    static Object toFirestore(Object value) {
        if (value == ServerValue.TIMESTAMP) {
            return FieldValue.serverTimestamp();
        }
        if (value == ServerValue.DELETE) {
            return FieldValue.delete();
        }
        if (value instanceof Instant instant) {
            return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((key, nested) -> converted.put(String.valueOf(key), toFirestore(nested)));
            return converted;
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(nested -> converted.add(toFirestore(nested)));
            return converted;
        }
        return value;
    }

    static Map<String, Object> fromFirestore(Map<String, Object> data) {
        if (data == null) {
            return Map.of();
        }
        Map<String, Object> converted = new LinkedHashMap<>();
        data.forEach((field, value) -> converted.put(field, fromFirestore(value)));
        return converted;
    }

    static Object fromFirestore(Object value) {
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof DocumentReference reference) {
            return reference.getId();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((key, nested) -> converted.put(String.valueOf(key), fromFirestore(nested)));
            return converted;
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(nested -> converted.add(fromFirestore(nested)));
            return converted;
        }
        return value;
    }
}
