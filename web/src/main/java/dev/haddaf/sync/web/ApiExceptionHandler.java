package dev.haddaf.sync.web;

import dev.haddaf.sync.invitation.InvitationRejectedException;
import dev.haddaf.sync.invitation.InvitationWorkflowException;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.verification.CoachReviewException;
import dev.haddaf.sync.verification.CoachReviewRejectedException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures to JSON bodies of the form {@code {"error_code", "message", "timestamp"}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvitationRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleInvitationRejected(InvitationRejectedException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NOT_RECIPIENT, UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case NOT_PENDING, RECIPIENT_MISSING, ALREADY_INVITED -> HttpStatus.CONFLICT;
        };
        log.info("Invitation {} refused: {}", ex.getInvitationId(), ex.getReason());
        return ResponseEntity.status(status).body(errorResponse("INVITATION_" + ex.getReason().name(), ex.getMessage()));
    }

    @ExceptionHandler(CoachReviewRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleReviewRejected(CoachReviewRejectedException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_ADMINISTRATOR -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_REVIEWED, COACH_MISSING -> HttpStatus.CONFLICT;
        };
        log.info("Coach review refused: {}", ex.getReason());
        return ResponseEntity.status(status).body(errorResponse("REVIEW_" + ex.getReason().name(), ex.getMessage()));
    }

    @ExceptionHandler({
        InvitationWorkflowException.class,
        CoachReviewException.class,
        DocumentStoreException.class
    })
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleStoreUnavailable(RuntimeException ex) {
        log.warn("Store unavailable: {}", ex.getMessage());
        return errorResponse("STORE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler({InvalidCredentialsException.class, NotSignedInException.class})
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, Object> handleUnauthenticated(RuntimeException ex) {
        return errorResponse("UNAUTHENTICATED", ex.getMessage());
    }

    @ExceptionHandler(SessionMismatchException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleSessionMismatch(SessionMismatchException ex) {
        log.info("Refused request: {}", ex.getMessage());
        return errorResponse("SESSION_MISMATCH", ex.getMessage());
    }

    @ExceptionHandler(NotificationNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotificationNotFound(NotificationNotFoundException ex) {
        return errorResponse("NOTIFICATION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("request body is invalid");
        return errorResponse("INVALID_ARGUMENT", message);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
