package dev.haddaf.sync.web;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.haddaf.sync.feed.FeedProjector;
import dev.haddaf.sync.feed.FeedState;
import dev.haddaf.sync.feed.PostActions;
import dev.haddaf.sync.feed.VideoPost;
import dev.haddaf.sync.session.Session;
import dev.haddaf.sync.session.SessionContext;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class FeedControllerTests {

    private static final TestingAuthenticationToken PLAYER =
        new TestingAuthenticationToken("player-1", null, "ROLE_USER");

    private MockMvc mockMvc;

    @Mock
    private FeedProjector<VideoPost> postFeed;

    @Mock
    private PostActions postActions;

    @Mock
    private SessionContext sessionContext;

    @BeforeEach
    void setUp() {
        FeedController controller = new FeedController(postFeed, postActions, new CallerResolver(sessionContext));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void returnsPublishedFeed() throws Exception {
        VideoPost post = new VideoPost("p1", "player-1", "Left foot", "https://cdn/thumb.jpg", "https://cdn/p1.mp4",
            Instant.parse("2025-06-01T08:00:00Z"), true, "Sara", null, 3, 1, false);
        when(sessionContext.current()).thenReturn(Session.signedIn("player-1"));
        when(postFeed.state()).thenReturn(new FeedState<>(List.of(post), false, true));

        mockMvc.perform(get("/api/feed").principal(PLAYER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items[0].id").value("p1"))
            .andExpect(jsonPath("$.items[0].authorName").value("Sara"))
            .andExpect(jsonPath("$.stale").value(true));
    }

    @Test
    void deletesOwnPost() throws Exception {
        when(sessionContext.current()).thenReturn(Session.signedIn("player-1"));
        when(postFeed.ownerId()).thenReturn(Optional.of("player-1"));
        when(postActions.deletePost("p1")).thenReturn(true);

        mockMvc.perform(delete("/api/feed/posts/p1").principal(PLAYER))
            .andExpect(status().isNoContent());
    }

    @Test
    void failedDeleteIsServiceUnavailable() throws Exception {
        when(sessionContext.current()).thenReturn(Session.signedIn("player-1"));
        when(postFeed.ownerId()).thenReturn(Optional.of("player-1"));
        when(postActions.deletePost("p1")).thenReturn(false);

        mockMvc.perform(delete("/api/feed/posts/p1").principal(PLAYER))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    void deleteRequiresSignIn() throws Exception {
        mockMvc.perform(delete("/api/feed/posts/p1"))
            .andExpect(status().isUnauthorized());

        verify(postActions, never()).deletePost(anyString());
    }

    @Test
    void deleteBeforeTheFeedIsBoundIsUnauthorized() throws Exception {
        when(sessionContext.current()).thenReturn(Session.signedIn("player-1"));
        when(postFeed.ownerId()).thenReturn(Optional.empty());

        mockMvc.perform(delete("/api/feed/posts/p1").principal(PLAYER))
            .andExpect(status().isUnauthorized());

        verify(postActions, never()).deletePost(anyString());
    }

    @Test
    void feedOfAnotherSessionIsForbidden() throws Exception {
        when(sessionContext.current()).thenReturn(Session.signedIn("player-2"));

        mockMvc.perform(get("/api/feed").principal(PLAYER))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error_code").value("SESSION_MISMATCH"));

        verify(postFeed, never()).state();
    }
}
