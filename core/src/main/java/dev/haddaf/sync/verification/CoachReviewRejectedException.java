package dev.haddaf.sync.verification;

import dev.haddaf.sync.store.TransactionPreconditionException;

public class CoachReviewRejectedException extends TransactionPreconditionException {

    public enum Reason {
        NOT_ADMINISTRATOR,
        NOT_FOUND,
        ALREADY_REVIEWED,
        COACH_MISSING
    }

    private final Reason reason;

    public CoachReviewRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
