package dev.haddaf.sync.verification;

/**
 * The store could not complete a review. Nothing was committed.
 */
public class CoachReviewException extends RuntimeException {

    public CoachReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
