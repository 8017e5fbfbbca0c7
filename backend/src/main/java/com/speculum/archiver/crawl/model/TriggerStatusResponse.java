package com.speculum.archiver.crawl.model;

import java.time.Instant;

public record TriggerStatusResponse(
    boolean running,
    int liveCrawls,
    Instant lastCycleAt,
    int lastCycleEnqueued
) {
}
