package com.speculum.archiver.crawl.policy;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.model.ErrorClass;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.model.RetryDecision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RetryPolicyTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final RetryPolicy policy = new RetryPolicy(new ArchiverProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void firstRecoverableFailureIsRetriedAfterFiveMinutes() {
        RetryDecision decision = policy.onFailure(0, "Connection refused");
        assertEquals(JobStatus.RETRY_PENDING, decision.status());
        assertEquals(1, decision.retryCount());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), decision.nextAttemptAt());
        assertEquals(ErrorClass.RECOVERABLE, decision.errorClass());
    }

    @Test
    void secondFailureWaitsFifteenMinutes() {
        RetryDecision decision = policy.onFailure(1, "503 Service Unavailable");
        assertEquals(JobStatus.RETRY_PENDING, decision.status());
        assertEquals(2, decision.retryCount());
        assertEquals(NOW.plus(Duration.ofMinutes(15)), decision.nextAttemptAt());
    }

    @Test
    void thirdFailureRestsInError() {
        RetryDecision decision = policy.onFailure(2, "Connection refused");
        assertEquals(JobStatus.ERROR, decision.status());
        assertEquals(3, decision.retryCount());
        assertNull(decision.nextAttemptAt());
    }

    @Test
    void retryCountNeverExceedsMaxAttempts() {
        for (int current = 0; current < 10; current++) {
            assertThat(policy.onFailure(current, "boom").retryCount()).isEqualTo(Math.min(current + 1, 3));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 2, 5})
    void permanentFailureIsDeadWhateverTheRetryCount(int currentRetryCount) {
        RetryDecision decision = policy.onFailure(currentRetryCount, "ERROR 404: Not Found");
        assertEquals(JobStatus.DEAD, decision.status());
        assertEquals(ErrorClass.PERMANENT, decision.errorClass());
        assertEquals(Math.min(currentRetryCount + 1, 3), decision.retryCount());
        assertNull(decision.nextAttemptAt());
    }

    @Test
    void unknownFailureIsRetried() {
        RetryDecision decision = policy.onFailure(0, "Tool stalled: no output within the stall budget");
        assertEquals(JobStatus.RETRY_PENDING, decision.status());
        assertEquals(ErrorClass.UNKNOWN, decision.errorClass());
    }

    @Test
    void backoffLadderRepeatsItsLastStep() {
        assertEquals(Duration.ofMinutes(5), policy.delayFor(1));
        assertEquals(Duration.ofMinutes(15), policy.delayFor(2));
        assertEquals(Duration.ofMinutes(45), policy.delayFor(3));
        assertEquals(Duration.ofMinutes(45), policy.delayFor(7));
    }
}
