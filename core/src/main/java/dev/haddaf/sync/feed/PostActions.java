package dev.haddaf.sync.feed;

import dev.haddaf.sync.events.LocalEventBus;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User actions on posts that update the local feed before the store confirms them.
 */
public class PostActions {

    private static final Logger log = LoggerFactory.getLogger(PostActions.class);

    private final DocumentStore store;
    private final LocalEventBus bus;
    private final String postsCollection;

    public PostActions(DocumentStore store, LocalEventBus bus, String postsCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.postsCollection = Objects.requireNonNull(postsCollection, "postsCollection");
    }

    /**
     * Announces a post whose document was just written by the upload pipeline.
     */
    public void announceCreated(VideoPost post) {
        bus.publish(new PostCreated(post));
    }

    /**
     * Hides the post locally, then deletes the document. When the delete fails the next snapshot (after the
     * tombstone expires) brings the post back.
     *
     * @return {@code true} when the store accepted the delete
     */
    public boolean deletePost(String postId) {
        bus.publish(new PostDeleted(postId));
        try {
            store.delete(DocumentPath.of(postsCollection, postId));
            return true;
        } catch (DocumentStoreException ex) {
            log.error("Failed to delete post {}", postId, ex);
            return false;
        }
    }
}
