package dev.haddaf.sync.invitation;

import java.util.Optional;

public enum InvitationStatus {
    PENDING("pending"),
    ACCEPTED("accepted"),
    DECLINED("declined");

    private final String value;

    InvitationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<InvitationStatus> fromValue(String raw) {
        for (InvitationStatus status : values()) {
            if (status.value.equals(raw)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
