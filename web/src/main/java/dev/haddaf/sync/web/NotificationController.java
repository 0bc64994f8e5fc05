package dev.haddaf.sync.web;

import dev.haddaf.sync.notification.InboxState;
import dev.haddaf.sync.notification.NotificationInbox;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationInbox inbox;
    private final CallerResolver callers;

    public NotificationController(NotificationInbox inbox, CallerResolver callers) {
        this.inbox = inbox;
        this.callers = callers;
    }

    @GetMapping
    public InboxState inbox(Authentication authentication) {
        callers.requireSessionOwner(authentication);
        return inbox.state();
    }

    @GetMapping("/unread-count")
    public Map<String, Integer> unreadCount(Authentication authentication) {
        callers.requireSessionOwner(authentication);
        return Map.of("unreadCount", inbox.unreadCount());
    }

    @PostMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@PathVariable String notificationId, Authentication authentication) {
        callers.requireSessionOwner(authentication);
        requireKnown(notificationId);
        return outcome(inbox.markRead(notificationId));
    }

    @PostMapping("/read-all")
    public Map<String, Integer> markAllRead(Authentication authentication) {
        String uid = callers.requireSessionOwner(authentication);
        return Map.of("updated", inbox.markAllRead(uid));
    }

    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Void> dismiss(@PathVariable String notificationId, Authentication authentication) {
        callers.requireSessionOwner(authentication);
        requireKnown(notificationId);
        return outcome(inbox.dismiss(notificationId));
    }

    private void requireKnown(String notificationId) {
        if (inbox.find(notificationId).isEmpty()) {
            throw new NotificationNotFoundException(notificationId);
        }
    }

    private static ResponseEntity<Void> outcome(boolean written) {
        return written
            ? ResponseEntity.noContent().build()
            : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
}
