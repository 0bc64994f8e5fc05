package dev.haddaf.sync.config;

import dev.haddaf.sync.notification.ChallengeNotificationJobs;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "sync.scheduled-checks.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(NotificationCheckScheduler.class);

    private final ChallengeNotificationJobs jobs;

    public NotificationCheckScheduler(ChallengeNotificationJobs jobs) {
        this.jobs = jobs;
    }

    @Scheduled(fixedDelayString = "${sync.scheduled-checks.interval:PT1H}",
        initialDelayString = "${sync.scheduled-checks.initial-delay:PT1M}")
    public void runChecks() {
        long ended = run("ended challenges", jobs::notifyEndedChallenges);
        long started = run("new challenges", jobs::notifyNewChallenges);
        long reminders = run("administrator reminders", jobs::remindAdministrators);
        log.info("Scheduled challenge checks created {} ended, {} new and {} reminder notification(s)",
            ended, started, reminders);
    }

    private long run(String check, LongSupplier task) {
        try {
            return task.getAsLong();
        } catch (RuntimeException ex) {
            log.error("Scheduled check for {} failed", check, ex);
            return 0;
        }
    }
}
