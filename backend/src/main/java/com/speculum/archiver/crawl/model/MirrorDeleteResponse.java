package com.speculum.archiver.crawl.model;

public record MirrorDeleteResponse(long jobId, boolean deleted) {
}
