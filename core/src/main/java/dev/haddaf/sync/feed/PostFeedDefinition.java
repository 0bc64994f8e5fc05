package dev.haddaf.sync.feed;

import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.StoredDocument;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Posts authored by the signed in user, newest upload first.
 */
public class PostFeedDefinition implements FeedDefinition<VideoPost> {

    static final String AUTHOR_FIELD = "authorId";
    static final String UPLOADED_AT_FIELD = "uploadDateTime";

    private final String postsCollection;
    private final UserProfileLookup profiles;

    public PostFeedDefinition(String postsCollection, UserProfileLookup profiles) {
        this.postsCollection = Objects.requireNonNull(postsCollection, "postsCollection");
        this.profiles = Objects.requireNonNull(profiles, "profiles");
    }

    @Override
    public String name() {
        return "posts";
    }

    @Override
    public DocumentQuery query(String ownerId) {
        return DocumentQuery.collection(postsCollection)
            .whereEqualTo(AUTHOR_FIELD, ownerId)
            .orderBy(UPLOADED_AT_FIELD, true);
    }

    @Override
    public Optional<VideoPost> decode(StoredDocument document, String ownerId) {
        String authorId = document.getString(AUTHOR_FIELD);
        Instant uploadedAt = document.getInstant(UPLOADED_AT_FIELD);
        String videoUrl = document.getString("url");
        if (!StringUtils.hasText(authorId) || uploadedAt == null || !StringUtils.hasText(videoUrl)) {
            return Optional.empty();
        }
        Long likes = document.getLong("likeCount");
        Long comments = document.getLong("commentCount");
        return Optional.of(new VideoPost(
            document.id(),
            authorId,
            Objects.requireNonNullElse(document.getString("caption"), ""),
            document.getString("thumbnailURL"),
            videoUrl,
            uploadedAt,
            !"private".equalsIgnoreCase(document.getString("visibility")),
            document.getString("authorUsername"),
            document.getString("profilePic"),
            likes == null ? 0 : likes,
            comments == null ? 0 : comments,
            document.getStringList("likedBy").contains(ownerId)));
    }

    @Override
    public VideoPost enrich(VideoPost post) {
        if (StringUtils.hasText(post.authorName()) && StringUtils.hasText(post.authorPhotoUrl())) {
            return post;
        }
        return profiles.find(post.authorId())
            .map(author -> post.withAuthor(
                StringUtils.hasText(post.authorName()) ? post.authorName() : author.fullName(),
                StringUtils.hasText(post.authorPhotoUrl()) ? post.authorPhotoUrl() : author.photoUrl()))
            .orElse(post);
    }
}
