package com.speculum.archiver.crawl.model;

public enum ErrorClass {
    PERMANENT,
    RECOVERABLE,
    UNKNOWN
}
