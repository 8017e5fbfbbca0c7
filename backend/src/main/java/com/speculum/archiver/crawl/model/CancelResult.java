package com.speculum.archiver.crawl.model;

public record CancelResult(boolean ok, String message) {
}
