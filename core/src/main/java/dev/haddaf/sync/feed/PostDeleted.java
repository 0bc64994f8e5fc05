package dev.haddaf.sync.feed;

public record PostDeleted(String postId) {
}
