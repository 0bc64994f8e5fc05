package dev.haddaf.sync.feed;

/**
 * Local like or comment change on a post. {@code likeCount} and {@code likedByViewer} are applied when not
 * null; {@code commentDelta} is added to the comment counter.
 */
public record PostInteractionChanged(String postId, Long likeCount, Boolean likedByViewer, int commentDelta) {

    public static PostInteractionChanged liked(String postId, long likeCount, boolean likedByViewer) {
        return new PostInteractionChanged(postId, likeCount, likedByViewer, 0);
    }

    public static PostInteractionChanged commented(String postId, int delta) {
        return new PostInteractionChanged(postId, null, null, delta);
    }
}
