package com.speculum.archiver.crawl.model;

import java.util.Locale;

public enum AttemptOutcome {
    RUNNING,
    SUCCESS,
    ERROR,
    CANCELLED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AttemptOutcome fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            return RUNNING;
        }
        return AttemptOutcome.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
