package com.speculum.archiver.crawl.policy;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.model.ErrorClass;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.model.RetryDecision;
import com.speculum.archiver.crawl.util.ErrorClassifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decides the next status of a job after a failed attempt.
 *
 * <p>Permanent failures go straight to {@code dead}. Anything else is retried on a fixed
 * ladder ({@code archiver.retry.backoff-minutes}, last step repeating) until
 * {@code archiver.retry.max-attempts} is reached, after which the job rests in {@code error}.
 */
@Component
public class RetryPolicy {
    private final ArchiverProperties.Retry retry;
    private final Clock clock;

    public RetryPolicy(ArchiverProperties properties, Clock clock) {
        this.retry = properties.getRetry();
        this.clock = clock;
    }

    public RetryDecision onFailure(int currentRetryCount, String errorMessage) {
        int maxAttempts = retry.getMaxAttempts();
        int retryCount = Math.min(Math.max(0, currentRetryCount) + 1, maxAttempts);
        ErrorClass errorClass = ErrorClassifier.classify(errorMessage);
        if (!ErrorClassifier.isRetryable(errorClass)) {
            return new RetryDecision(JobStatus.DEAD, retryCount, null, errorClass);
        }
        if (retryCount >= maxAttempts) {
            return new RetryDecision(JobStatus.ERROR, retryCount, null, errorClass);
        }
        Instant nextAttemptAt = clock.instant().plus(delayFor(retryCount));
        return new RetryDecision(JobStatus.RETRY_PENDING, retryCount, nextAttemptAt, errorClass);
    }

    /**
     * Delay before the given attempt number (1-based).
     */
    public Duration delayFor(int attempt) {
        List<Integer> backoff = retry.getBackoffMinutes();
        int index = Math.min(Math.max(0, attempt - 1), backoff.size() - 1);
        int minutes = backoff.get(index);
        return Duration.ofMinutes(Math.max(1, minutes));
    }
}
