package com.speculum.archiver.crawl.policy;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.speculum.archiver.crawl.TestJobs.job;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeoutPolicyTest {

    private final TimeoutPolicy policy = new TimeoutPolicy(new ArchiverProperties());

    @Test
    void ordinarySiteGetsShortBudget() {
        assertEquals(Duration.ofHours(1), policy.totalBudget(job(1, "https://example.com/", JobKind.PAGE_MIRROR)));
    }

    @Test
    void knownLargeDomainAndSubdomainsGetLongBudget() {
        assertEquals(Duration.ofHours(4), policy.totalBudget(job(1, "https://wikipedia.org/", JobKind.PAGE_MIRROR)));
        assertEquals(Duration.ofHours(4), policy.totalBudget(job(1, "https://en.wikipedia.org/wiki/Java", JobKind.PAGE_MIRROR)));
        assertFalse(policy.isLargeSite(job(1, "https://notwikipedia.org/", JobKind.PAGE_MIRROR)));
    }

    @Test
    void previouslyLargeSiteGetsLongBudget() {
        long overThreshold = 100L * 1024 * 1024 + 1;
        assertTrue(policy.isLargeSite(job(1, "https://example.com/", JobKind.PAGE_MIRROR, JobStatus.READY, 0, overThreshold)));
    }

    @Test
    void videoChannelsGetMultipliedLongBudget() {
        assertEquals(Duration.ofHours(12), policy.totalBudget(job(1, "https://www.youtube.com/@chan", JobKind.VIDEO_CHANNEL)));
    }

    @Test
    void snapshotsGetFixedBudget() {
        assertEquals(Duration.ofMinutes(5), policy.totalBudget(job(1, "https://wikipedia.org/", JobKind.BROWSER_SNAPSHOT)));
    }

    @Test
    void stallAndProbeBudgetsComeFromConfiguration() {
        ArchiverProperties properties = new ArchiverProperties();
        properties.getTimeouts().setStallTimeoutSeconds(42);
        TimeoutPolicy configured = new TimeoutPolicy(properties);
        assertEquals(Duration.ofSeconds(42), configured.stallBudget());
        assertEquals(Duration.ofSeconds(60), configured.probeBudget());
    }
}
