package com.speculum.archiver.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CrawlJobNotFoundException extends RuntimeException {
    public CrawlJobNotFoundException(long jobId) {
        super("Crawl job " + jobId + " not found");
    }
}
