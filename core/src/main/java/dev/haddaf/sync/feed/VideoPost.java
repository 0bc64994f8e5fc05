package dev.haddaf.sync.feed;

import java.time.Instant;

public record VideoPost(String id,
                        String authorId,
                        String caption,
                        String thumbnailUrl,
                        String videoUrl,
                        Instant uploadedAt,
                        boolean visible,
                        String authorName,
                        String authorPhotoUrl,
                        long likeCount,
                        long commentCount,
                        boolean likedByViewer) implements FeedEntry {

    @Override
    public Instant orderingTimestamp() {
        return uploadedAt;
    }

    public VideoPost withAuthor(String name, String photoUrl) {
        return new VideoPost(id, authorId, caption, thumbnailUrl, videoUrl, uploadedAt, visible, name, photoUrl,
            likeCount, commentCount, likedByViewer);
    }

    public VideoPost withLikes(long likes, boolean liked) {
        return new VideoPost(id, authorId, caption, thumbnailUrl, videoUrl, uploadedAt, visible, authorName,
            authorPhotoUrl, Math.max(0, likes), commentCount, liked);
    }

    public VideoPost withCommentCount(long comments) {
        return new VideoPost(id, authorId, caption, thumbnailUrl, videoUrl, uploadedAt, visible, authorName,
            authorPhotoUrl, likeCount, Math.max(0, comments), likedByViewer);
    }
}
