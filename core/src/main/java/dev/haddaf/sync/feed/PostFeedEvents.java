package dev.haddaf.sync.feed;

import dev.haddaf.sync.events.EventSubscription;
import dev.haddaf.sync.events.LocalEventBus;

/**
 * Routes local post events into the owned posts feed.
 */
public final class PostFeedEvents {

    private PostFeedEvents() {
    }

    public static EventSubscription bind(LocalEventBus bus, FeedProjector<VideoPost> feed) {
        return EventSubscription.composite(
            bus.subscribe(PostCreated.class, event -> {
                if (feed.ownerId().filter(owner -> owner.equals(event.post().authorId())).isPresent()) {
                    feed.applyCreated(event.post());
                }
            }),
            bus.subscribe(PostDeleted.class, event -> feed.applyDeleted(event.postId())),
            bus.subscribe(PostInteractionChanged.class, event -> feed.applyUpdate(event.postId(), post -> {
                VideoPost updated = post;
                if (event.likeCount() != null) {
                    boolean liked = event.likedByViewer() != null ? event.likedByViewer() : post.likedByViewer();
                    updated = updated.withLikes(event.likeCount(), liked);
                }
                if (event.commentDelta() != 0) {
                    updated = updated.withCommentCount(updated.commentCount() + event.commentDelta());
                }
                return updated;
            })));
    }
}
