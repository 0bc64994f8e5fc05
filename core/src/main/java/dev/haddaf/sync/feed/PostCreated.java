package dev.haddaf.sync.feed;

/**
 * A post was created locally and is not yet confirmed by a snapshot.
 */
public record PostCreated(VideoPost post) {
}
