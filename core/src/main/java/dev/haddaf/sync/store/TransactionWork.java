package dev.haddaf.sync.store;

/**
 * Body of a transaction. It may be executed more than once on contention, so it must not have side effects
 * outside the given {@link StoreTransaction}.
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(StoreTransaction transaction);
}
