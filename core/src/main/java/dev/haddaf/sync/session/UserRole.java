package dev.haddaf.sync.session;

import java.util.Locale;
import java.util.Optional;

public enum UserRole {
    PLAYER("player"),
    COACH("coach");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses the stored {@code role} field. Unknown values (for example {@code admin}) are not a session role.
     */
    public static Optional<UserRole> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (UserRole role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
