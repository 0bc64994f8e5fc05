package dev.haddaf.sync.store;

/**
 * Thrown from {@link TransactionWork} when a precondition read inside the transaction does not hold.
 * Stores roll back and rethrow it unchanged, so callers can react to the typed subclass.
 */
public class TransactionPreconditionException extends RuntimeException {

    public TransactionPreconditionException(String message) {
        super(message);
    }
}
