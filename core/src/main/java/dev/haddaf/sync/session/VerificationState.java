package dev.haddaf.sync.session;

import java.util.Locale;
import java.util.Optional;

public enum VerificationState {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private static final String UNDER_REVIEW = "under_review";

    private final String value;

    VerificationState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses the stored {@code coachStatus} field; {@code under_review} is read as {@link #PENDING}.
     */
    public static Optional<VerificationState> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (UNDER_REVIEW.equals(normalized)) {
            return Optional.of(PENDING);
        }
        for (VerificationState state : values()) {
            if (state.value.equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
