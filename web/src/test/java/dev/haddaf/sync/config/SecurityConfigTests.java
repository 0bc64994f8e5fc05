package dev.haddaf.sync.config;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentStore;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Runs requests through the full filter chain. Firebase is disabled, so a bearer token is taken as the uid.
 */
@SpringBootTest(properties = {
    "firestore.enabled=false",
    "firebase.enabled=false",
    "sync.scheduled-checks.enabled=false",
    "sync.internal-token=internal-s3cret"
})
@AutoConfigureMockMvc
class SecurityConfigTests {

    private static final String EVENT = """
        {"type":"player_challenge_submitted","recipients":["p1"],"fields":{"challengeId":"c1"}}
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DocumentStore documentStore;

    @BeforeEach
    void seedInvitation() {
        documentStore.merge(DocumentPath.of("users", "p1"), Map.of("role", "player"));
        documentStore.merge(DocumentPath.of("users", "c1"), Map.of("role", "coach", "coachStatus", "approved"));
        documentStore.merge(DocumentPath.of("invitations", "inv-1"), Map.of(
            "coachID", "c1",
            "playerID", "p1",
            "teamID", "t1",
            "teamName", "Jeddah Stars",
            "status", "pending",
            "createdAt", Instant.parse("2025-02-14T16:00:00Z")));
    }

    @Test
    void anonymousInvitationAnswerIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/invitations/inv-1/response")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accept\":true}"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void invitationIsAnsweredAsTheCallerOfEachRequest() throws Exception {
        mockMvc.perform(post("/api/invitations/inv-1/response")
                .header(HttpHeaders.AUTHORIZATION, "Bearer p2")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accept\":true}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error_code").value("INVITATION_NOT_RECIPIENT"));

        mockMvc.perform(post("/api/invitations/inv-1/response")
                .header(HttpHeaders.AUTHORIZATION, "Bearer p1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accept\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invitation.status").value("ACCEPTED"));
    }

    @Test
    void coachReviewRequiresAuthentication() throws Exception {
        mockMvc.perform(post("/api/coach-requests/req-1/approve"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void notificationEventsRefuseAnonymousAndUserCallers() throws Exception {
        mockMvc.perform(post("/api/notification-events")
                .contentType(MediaType.APPLICATION_JSON)
                .content(EVENT))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/notification-events")
                .header(HttpHeaders.AUTHORIZATION, "Bearer p1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(EVENT))
            .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/notification-events")
                .header(ApiAuthenticationFilter.INTERNAL_TOKEN_HEADER, "wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .content(EVENT))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void internalProducerPublishesNotificationEvents() throws Exception {
        mockMvc.perform(post("/api/notification-events")
                .header(ApiAuthenticationFilter.INTERNAL_TOKEN_HEADER, "internal-s3cret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(EVENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcomes.p1").exists());
    }

    @Test
    void internalTokenDoesNotGrantUserEndpoints() throws Exception {
        mockMvc.perform(get("/api/notifications")
                .header(ApiAuthenticationFilter.INTERNAL_TOKEN_HEADER, "internal-s3cret"))
            .andExpect(status().isForbidden());
    }

    @Test
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk());
    }
}
