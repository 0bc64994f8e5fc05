package dev.haddaf.sync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tuning of the sync core.
 *
 * @param fetchThreads size of the pool running secondary fetches (author profiles, team logos)
 * @param tombstoneTtl how long a locally deleted feed item stays hidden while snapshots still contain it
 * @param profileCacheTtl how long author and coach display fields are reused before being read again
 * @param adminReminderDay day of month on which administrators are reminded to plan next month's challenge
 * @param scheduledChecks periodic challenge notification checks
 * @param internalToken shared secret presented by internal producers of notification events; when blank the
 *                      notification events endpoint refuses every caller
 */
@ConfigurationProperties(prefix = "sync")
public record SyncProperties(@DefaultValue("4") int fetchThreads,
                             @DefaultValue("30s") Duration tombstoneTtl,
                             @DefaultValue("5m") Duration profileCacheTtl,
                             @DefaultValue("25") int adminReminderDay,
                             @DefaultValue ScheduledChecks scheduledChecks,
                             String internalToken) {

    /**
     * @param enabled whether the checks run at all
     * @param interval delay between the end of one run and the start of the next
     * @param initialDelay delay before the first run after startup
     */
    public record ScheduledChecks(@DefaultValue("true") boolean enabled,
                                  @DefaultValue("1h") Duration interval,
                                  @DefaultValue("1m") Duration initialDelay) {
    }
}
