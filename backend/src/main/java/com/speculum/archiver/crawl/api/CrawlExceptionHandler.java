package com.speculum.archiver.crawl.api;

import com.speculum.archiver.crawl.service.CrawlJobNotFoundException;
import com.speculum.archiver.crawl.service.CrawlJobStateException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(CrawlJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(CrawlJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "crawl_job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(CrawlJobStateException.class)
  public ResponseEntity<Map<String, String>> handleConflict(CrawlJobStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "crawl_job_conflict", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalid(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}
