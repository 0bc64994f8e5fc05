package dev.haddaf.sync.feed;

/**
 * Display name and photo of a user, as shown next to posts and invitations.
 */
public record UserSummary(String userId, String fullName, String photoUrl) {
}
