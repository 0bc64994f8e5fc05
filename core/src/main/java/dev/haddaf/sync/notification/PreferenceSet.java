package dev.haddaf.sync.notification;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-user opt-outs. A type without a stored flag is enabled.
 */
public record PreferenceSet(Map<NotificationType, Boolean> flags) {

    public static final PreferenceSet ALL_ENABLED = new PreferenceSet(Map.of());

    public PreferenceSet {
        flags = flags == null ? Map.of() : Map.copyOf(flags);
    }

    public boolean isEnabled(NotificationType type) {
        return flags.getOrDefault(type, Boolean.TRUE);
    }

    static PreferenceSet fromUserDocument(Map<String, Object> data) {
        Map<NotificationType, Boolean> flags = new EnumMap<>(NotificationType.class);
        for (NotificationType type : NotificationType.values()) {
            type.preferenceField().ifPresent(field -> {
                if (data.get(field) instanceof Boolean enabled) {
                    flags.put(type, enabled);
                }
            });
        }
        return new PreferenceSet(flags);
    }
}
