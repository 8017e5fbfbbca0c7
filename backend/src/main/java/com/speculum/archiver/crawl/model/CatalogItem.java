package com.speculum.archiver.crawl.model;

import java.time.LocalDate;

/**
 * One downloaded item of a video channel, read from its {@code .info.json} sidecar.
 */
public record CatalogItem(
    String itemId,
    String title,
    String description,
    Integer durationSeconds,
    LocalDate uploadDate,
    String filename,
    String thumbnailFilename,
    long sizeBytes
) {
}
