package dev.haddaf.sync.web;

import dev.haddaf.sync.feed.FeedProjector;
import dev.haddaf.sync.feed.FeedState;
import dev.haddaf.sync.invitation.InvitationResult;
import dev.haddaf.sync.invitation.InvitationWorkflow;
import dev.haddaf.sync.invitation.PendingInvitation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invitations")
public class InvitationController {

    private final FeedProjector<PendingInvitation> invitationFeed;
    private final InvitationWorkflow workflow;
    private final CallerResolver callers;

    public InvitationController(FeedProjector<PendingInvitation> invitationFeed,
                                InvitationWorkflow workflow,
                                CallerResolver callers) {
        this.invitationFeed = invitationFeed;
        this.workflow = workflow;
        this.callers = callers;
    }

    @GetMapping
    public FeedState<PendingInvitation> pending(Authentication authentication) {
        callers.requireSessionOwner(authentication);
        return invitationFeed.state();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public InvitationResult send(@Valid @RequestBody SendInvitationRequest request, Authentication authentication) {
        String coachId = callers.requireUid(authentication);
        return workflow.sendInvitation(coachId, request.teamId(), request.teamName(), request.playerId());
    }

    @PostMapping("/{invitationId}/response")
    public InvitationResult respond(@PathVariable String invitationId,
                                    @Valid @RequestBody InvitationAnswer answer,
                                    Authentication authentication) {
        return workflow.respond(invitationId, callers.requireUid(authentication), answer.accept());
    }

    public record SendInvitationRequest(@NotBlank String teamId, String teamName, @NotBlank String playerId) {
    }

    public record InvitationAnswer(@NotNull Boolean accept) {
    }
}
