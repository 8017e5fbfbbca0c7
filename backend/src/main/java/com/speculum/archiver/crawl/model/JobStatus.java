package com.speculum.archiver.crawl.model;

import java.util.Locale;

/**
 * Persisted job status. Stored lower-case in {@code crawl_jobs.status}.
 */
public enum JobStatus {
    PENDING,
    CRAWLING,
    READY,
    RETRY_PENDING,
    ERROR,
    DEAD;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
