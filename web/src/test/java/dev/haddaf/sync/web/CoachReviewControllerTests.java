package dev.haddaf.sync.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.haddaf.sync.notification.FanOutResult;
import dev.haddaf.sync.notification.NotificationOutcome;
import dev.haddaf.sync.session.SessionContext;
import dev.haddaf.sync.verification.CoachReviewRejectedException;
import dev.haddaf.sync.verification.CoachReviewWorkflow;
import dev.haddaf.sync.verification.ReviewDecision;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class CoachReviewControllerTests {

    private static final TestingAuthenticationToken ADMIN =
        new TestingAuthenticationToken("admin-1", null, "ROLE_USER");

    private MockMvc mockMvc;

    @Mock
    private CoachReviewWorkflow workflow;

    @Mock
    private SessionContext sessionContext;

    @BeforeEach
    void setUp() {
        CoachReviewController controller = new CoachReviewController(workflow, new CallerResolver(sessionContext));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void approvesRequest() throws Exception {
        when(workflow.approve("req-1", "admin-1")).thenReturn(new ReviewDecision("req-1", "coach-1", "approved",
            new FanOutResult(Map.of("coach-1", NotificationOutcome.CREATED))));

        mockMvc.perform(post("/api/coach-requests/req-1/approve").principal(ADMIN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.coachId").value("coach-1"))
            .andExpect(jsonPath("$.status").value("approved"));
    }

    @Test
    void rejectsRequestWithReason() throws Exception {
        when(workflow.reject("req-1", "admin-1", "License expired", "documents")).thenReturn(new ReviewDecision(
            "req-1", "coach-1", "rejected", new FanOutResult(Map.of("coach-1", NotificationOutcome.CREATED))));

        mockMvc.perform(post("/api/coach-requests/req-1/reject")
                .principal(ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"License expired\",\"category\":\"documents\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("rejected"));
    }

    @Test
    void rejectionWithoutReasonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/coach-requests/req-1/reject")
                .principal(ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\" \"}"))
            .andExpect(status().isBadRequest());

        verify(workflow, never()).reject(any(), any(), any(), any());
    }

    @Test
    void anonymousReviewIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/coach-requests/req-1/approve"))
            .andExpect(status().isUnauthorized());

        verify(workflow, never()).approve(any(), any());
        verify(workflow, never()).approve(any());
    }

    @Test
    void nonAdministratorIsForbidden() throws Exception {
        when(workflow.approve("req-1", "admin-1")).thenThrow(new CoachReviewRejectedException(
            CoachReviewRejectedException.Reason.NOT_ADMINISTRATOR, "User admin-1 is not an administrator"));

        mockMvc.perform(post("/api/coach-requests/req-1/approve").principal(ADMIN))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error_code").value("REVIEW_NOT_ADMINISTRATOR"));
    }

    @Test
    void reviewedRequestIsConflict() throws Exception {
        when(workflow.approve("req-1", "admin-1")).thenThrow(new CoachReviewRejectedException(
            CoachReviewRejectedException.Reason.ALREADY_REVIEWED, "Coach request req-1 was already approved"));

        mockMvc.perform(post("/api/coach-requests/req-1/approve").principal(ADMIN))
            .andExpect(status().isConflict());
    }
}
