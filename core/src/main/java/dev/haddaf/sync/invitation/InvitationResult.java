package dev.haddaf.sync.invitation;

import dev.haddaf.sync.notification.FanOutResult;

public record InvitationResult(Invitation invitation, FanOutResult notification) {
}
