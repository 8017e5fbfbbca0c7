package com.speculum.archiver.crawl.model;

public record TriggerCycleSummary(int reconciled, int dueEnqueued, int retriesEnqueued) {
    public int totalEnqueued() {
        return dueEnqueued + retriesEnqueued;
    }
}
