package dev.haddaf.sync.invitation;

import dev.haddaf.sync.store.TransactionPreconditionException;

/**
 * An invitation operation was refused; nothing was written.
 */
public class InvitationRejectedException extends TransactionPreconditionException {

    public enum Reason {
        NOT_FOUND,
        NOT_RECIPIENT,
        NOT_PENDING,
        RECIPIENT_MISSING,
        UNAUTHORIZED,
        ALREADY_INVITED
    }

    private final Reason reason;
    private final String invitationId;

    public InvitationRejectedException(Reason reason, String invitationId, String message) {
        super(message);
        this.reason = reason;
        this.invitationId = invitationId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getInvitationId() {
        return invitationId;
    }
}
