package com.speculum.archiver.crawl.policy;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.storage.MirrorStorage;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Coarse wall-clock budgets per job. Bounds how long one job can hold a worker and a
 * subprocess; it is not an SLA.
 */
@Component
public class TimeoutPolicy {
    private final ArchiverProperties.Timeouts timeouts;

    public TimeoutPolicy(ArchiverProperties properties) {
        this.timeouts = properties.getTimeouts();
    }

    public Duration totalBudget(CrawlJob job) {
        return switch (job.kind()) {
            case BROWSER_SNAPSHOT -> Duration.ofMinutes(timeouts.getSnapshotBudgetMinutes());
            case VIDEO_CHANNEL -> longBudget().multipliedBy(timeouts.getVideoBudgetMultiplier());
            case PAGE_MIRROR -> isLargeSite(job) ? longBudget() : shortBudget();
        };
    }

    public Duration stallBudget() {
        return Duration.ofSeconds(timeouts.getStallTimeoutSeconds());
    }

    public Duration probeBudget() {
        return Duration.ofSeconds(timeouts.getProbeTimeoutSeconds());
    }

    boolean isLargeSite(CrawlJob job) {
        if (job.sizeBytes() > timeouts.getLargeSiteThresholdBytes()) {
            return true;
        }
        String host = MirrorStorage.hostOf(job.url());
        if (host == null) {
            return false;
        }
        for (String domain : timeouts.getKnownLargeDomains()) {
            if (domain == null || domain.isBlank()) {
                continue;
            }
            String candidate = domain.trim().toLowerCase(Locale.ROOT);
            if (host.equals(candidate) || host.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }

    private Duration shortBudget() {
        return Duration.ofMinutes(timeouts.getShortBudgetMinutes());
    }

    private Duration longBudget() {
        return Duration.ofMinutes(timeouts.getLongBudgetMinutes());
    }
}
