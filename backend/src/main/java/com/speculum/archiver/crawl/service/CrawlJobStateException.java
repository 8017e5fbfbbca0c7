package com.speculum.archiver.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CrawlJobStateException extends RuntimeException {
    public CrawlJobStateException(String message) {
        super(message);
    }
}
