package dev.haddaf.sync.feed;

import java.time.Instant;

/**
 * Item of a projected feed: identified by {@link #id()} and ordered by {@link #orderingTimestamp()},
 * newest first.
 */
public interface FeedEntry {

    String id();

    Instant orderingTimestamp();
}
