package dev.haddaf.sync.invitation;

/**
 * The store could not complete an invitation operation. Nothing was committed and the call may be retried.
 */
public class InvitationWorkflowException extends RuntimeException {

    public InvitationWorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
