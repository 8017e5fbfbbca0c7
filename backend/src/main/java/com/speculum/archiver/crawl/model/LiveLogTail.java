package com.speculum.archiver.crawl.model;

import java.util.List;

public record LiveLogTail(long jobId, List<String> lines) {
}
