package dev.haddaf.sync.web;

import dev.haddaf.sync.notification.FanOutResult;
import dev.haddaf.sync.notification.NotificationFanOutService;
import dev.haddaf.sync.notification.NotificationType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for producers of domain events (upload pipeline, challenge administration) that need a
 * notification fanned out.
 */
@RestController
@RequestMapping("/api/notification-events")
public class NotificationEventController {

    private final NotificationFanOutService fanOut;

    public NotificationEventController(NotificationFanOutService fanOut) {
        this.fanOut = fanOut;
    }

    @PostMapping
    public FanOutResult publish(@Valid @RequestBody NotificationEventRequest request) {
        NotificationType type = NotificationType.fromValue(request.type())
            .orElseThrow(() -> new IllegalArgumentException("Unknown notification type " + request.type()));
        return fanOut.notify(type, request.recipients(), request.fields());
    }

    public record NotificationEventRequest(@NotBlank String type,
                                           @NotEmpty List<String> recipients,
                                           Map<String, String> fields) {
    }
}
