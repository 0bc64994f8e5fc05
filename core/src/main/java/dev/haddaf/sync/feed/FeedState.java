package dev.haddaf.sync.feed;

import java.util.List;

/**
 * Published state of a feed. {@code stale} is set when the live subscription failed and the items are the
 * last good snapshot.
 */
public record FeedState<T>(List<T> items, boolean loading, boolean stale) {

    public FeedState {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> FeedState<T> idle() {
        return new FeedState<>(List.of(), false, false);
    }

    public static <T> FeedState<T> loadingState() {
        return new FeedState<>(List.of(), true, false);
    }

    public FeedState<T> withItems(List<T> nextItems) {
        return new FeedState<>(nextItems, false, stale);
    }

    public FeedState<T> markStale() {
        return new FeedState<>(items, false, true);
    }
}
