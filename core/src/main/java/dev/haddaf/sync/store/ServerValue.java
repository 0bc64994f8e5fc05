package dev.haddaf.sync.store;

/**
 * Sentinels resolved by the store at commit time.
 */
public enum ServerValue {
    /** Replaced with the store's commit timestamp. */
    TIMESTAMP,
    /** Removes the field. */
    DELETE
}
