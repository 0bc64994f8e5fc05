package dev.haddaf.sync.web;

import dev.haddaf.sync.feed.FeedProjector;
import dev.haddaf.sync.feed.FeedState;
import dev.haddaf.sync.feed.PostActions;
import dev.haddaf.sync.feed.VideoPost;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/feed")
public class FeedController {

    private final FeedProjector<VideoPost> postFeed;
    private final PostActions postActions;
    private final CallerResolver callers;

    public FeedController(FeedProjector<VideoPost> postFeed, PostActions postActions, CallerResolver callers) {
        this.postFeed = postFeed;
        this.postActions = postActions;
        this.callers = callers;
    }

    @GetMapping
    public FeedState<VideoPost> feed(Authentication authentication) {
        callers.requireSessionOwner(authentication);
        return postFeed.state();
    }

    @DeleteMapping("/posts/{postId}")
    public ResponseEntity<Void> deletePost(@PathVariable String postId, Authentication authentication) {
        String uid = callers.requireSessionOwner(authentication);
        if (!postFeed.ownerId().map(uid::equals).orElse(false)) {
            throw new NotSignedInException();
        }
        return postActions.deletePost(postId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
}
