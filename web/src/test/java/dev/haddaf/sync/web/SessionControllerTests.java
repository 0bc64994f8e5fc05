package dev.haddaf.sync.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.haddaf.sync.session.AuthenticationState;
import dev.haddaf.sync.session.LocalAuthenticationStateSource;
import dev.haddaf.sync.session.Session;
import dev.haddaf.sync.session.SessionContext;
import dev.haddaf.sync.session.UserRole;
import dev.haddaf.sync.session.VerificationState;
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
class SessionControllerTests {

    private MockMvc mockMvc;

    @Mock
    private LocalAuthenticationStateSource authenticationSource;

    @Mock
    private SessionContext sessionContext;

    @Mock
    private IdTokenVerifier idTokenVerifier;

    @BeforeEach
    void setUp() {
        SessionController controller = new SessionController(authenticationSource, sessionContext, idTokenVerifier,
            new CallerResolver(sessionContext));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void reportsResolvedSession() throws Exception {
        when(sessionContext.current()).thenReturn(
            new Session("coach-1", false, UserRole.COACH, VerificationState.APPROVED, null, null));

        mockMvc.perform(get("/api/session").principal(user("coach-1")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.userId").value("coach-1"))
            .andExpect(jsonPath("$.role").value("coach"))
            .andExpect(jsonPath("$.verification").value("approved"))
            .andExpect(jsonPath("$.verifiedCoach").value(true));
    }

    @Test
    void signsInWithVerifiedIdToken() throws Exception {
        when(idTokenVerifier.verifyIdToken("token-abc")).thenReturn("player-1");

        mockMvc.perform(post("/api/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"idToken\":\"token-abc\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.userId").value("player-1"))
            .andExpect(jsonPath("$.authenticated").value(true));

        verify(authenticationSource).publish(AuthenticationState.signedIn("player-1"));
        verifyNoInteractions(sessionContext);
    }

    @Test
    void rejectsInvalidIdToken() throws Exception {
        when(idTokenVerifier.verifyIdToken("forged")).thenThrow(new InvalidCredentialsException("ID token is invalid"));

        mockMvc.perform(post("/api/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"idToken\":\"forged\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error_code").value("UNAUTHENTICATED"));

        verifyNoInteractions(authenticationSource);
    }

    @Test
    void rawUidRequiresDevelopmentVerifier() throws Exception {
        when(idTokenVerifier.acceptsRawUid()).thenReturn(false);

        mockMvc.perform(post("/api/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"uid\":\"player-1\"}"))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(authenticationSource);
    }

    @Test
    void acceptsRawUidWhenAllowed() throws Exception {
        when(idTokenVerifier.acceptsRawUid()).thenReturn(true);

        mockMvc.perform(post("/api/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"uid\":\" player-1 \"}"))
            .andExpect(status().isAccepted());

        verify(authenticationSource).publish(AuthenticationState.signedIn("player-1"));
    }

    @Test
    void continuesAsGuest() throws Exception {
        mockMvc.perform(post("/api/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"guest\":true}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.guest").value(true));

        verify(authenticationSource).publish(AuthenticationState.guestState());
    }

    @Test
    void emptySignInIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/session")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));

        verify(authenticationSource, never()).publish(any());
    }

    @Test
    void signsOut() throws Exception {
        when(sessionContext.current()).thenReturn(Session.signedIn("player-1"));

        mockMvc.perform(delete("/api/session").principal(user("player-1")))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.authenticated").value(false));

        verify(authenticationSource).publish(AuthenticationState.signedOut());
    }

    @Test
    void sessionOfAnotherUserCanBeNeitherReadNorEnded() throws Exception {
        when(sessionContext.current()).thenReturn(Session.signedIn("player-1"));

        mockMvc.perform(get("/api/session").principal(user("player-2")))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error_code").value("SESSION_MISMATCH"));
        mockMvc.perform(delete("/api/session").principal(user("player-2")))
            .andExpect(status().isForbidden());
        mockMvc.perform(delete("/api/session"))
            .andExpect(status().isUnauthorized());

        verify(authenticationSource, never()).publish(any());
    }

    private static TestingAuthenticationToken user(String uid) {
        return new TestingAuthenticationToken(uid, null, "ROLE_USER");
    }
}
