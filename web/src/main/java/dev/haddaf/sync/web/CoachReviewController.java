package dev.haddaf.sync.web;

import dev.haddaf.sync.verification.CoachReviewWorkflow;
import dev.haddaf.sync.verification.ReviewDecision;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/coach-requests")
public class CoachReviewController {

    private final CoachReviewWorkflow workflow;
    private final CallerResolver callers;

    public CoachReviewController(CoachReviewWorkflow workflow, CallerResolver callers) {
        this.workflow = workflow;
        this.callers = callers;
    }

    @PostMapping("/{requestId}/approve")
    public ReviewDecision approve(@PathVariable String requestId, Authentication authentication) {
        return workflow.approve(requestId, callers.requireUid(authentication));
    }

    @PostMapping("/{requestId}/reject")
    public ReviewDecision reject(@PathVariable String requestId,
                                 @Valid @RequestBody RejectionRequest request,
                                 Authentication authentication) {
        return workflow.reject(requestId, callers.requireUid(authentication), request.reason(), request.category());
    }

    public record RejectionRequest(@NotBlank String reason, String category) {
    }
}
