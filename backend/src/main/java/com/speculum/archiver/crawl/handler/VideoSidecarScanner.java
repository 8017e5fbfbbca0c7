package com.speculum.archiver.crawl.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.speculum.archiver.crawl.model.CatalogItem;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Catalogs downloaded videos from the {@code .info.json} files yt-dlp writes next to them.
 * Expects one directory per video under the channel directory.
 */
@Component
public class VideoSidecarScanner {
    private static final Logger log = LoggerFactory.getLogger(VideoSidecarScanner.class);
    private static final String SIDECAR_SUFFIX = ".info.json";
    private static final List<String> VIDEO_SUFFIXES = List.of(".mp4", ".webm", ".mkv");
    private static final List<String> THUMBNAIL_SUFFIXES = List.of(".jpg", ".png", ".webp");
    private static final DateTimeFormatter UPLOAD_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final int MAX_TITLE_LENGTH = 500;

    private final ObjectMapper objectMapper;
    private final CrawlJobRepository repository;

    public VideoSidecarScanner(ObjectMapper objectMapper, CrawlJobRepository repository) {
        this.objectMapper = objectMapper;
        this.repository = repository;
    }

    /**
     * @return number of catalog rows inserted; items already cataloged for the job are skipped
     */
    public int scan(long jobId, Long attemptId, Path channelDir) {
        if (channelDir == null || !Files.isDirectory(channelDir)) {
            return 0;
        }
        int inserted = 0;
        for (Path itemDir : listSorted(channelDir)) {
            if (!Files.isDirectory(itemDir)) {
                continue;
            }
            List<Path> files = listSorted(itemDir);
            for (Path file : files) {
                if (!file.getFileName().toString().endsWith(SIDECAR_SUFFIX)) {
                    continue;
                }
                CatalogItem item = readItem(file, itemDir, files);
                if (item != null && repository.upsertCatalogItem(jobId, attemptId, item)) {
                    inserted++;
                }
            }
        }
        log.info("Cataloged {} new items for job {} from {}", inserted, jobId, channelDir);
        return inserted;
    }

    CatalogItem readItem(Path sidecar, Path itemDir, List<Path> siblings) {
        JsonNode info;
        try {
            info = objectMapper.readTree(sidecar.toFile());
        } catch (IOException e) {
            log.warn("Skipping unreadable sidecar {}: {}", sidecar, e.getMessage());
            return null;
        }
        if (info == null || !info.isObject() || "playlist".equals(info.path("_type").asText())) {
            return null;
        }

        String itemId = textOrNull(info, "id");
        if (itemId == null) {
            itemId = itemDir.getFileName().toString();
        }
        String title = textOrNull(info, "title");
        if (title != null && title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH);
        }

        String videoFile = null;
        long videoSize = 0L;
        String thumbnailFile = null;
        for (Path sibling : siblings) {
            String name = sibling.getFileName().toString();
            String lower = name.toLowerCase(Locale.ROOT);
            if (videoFile == null && endsWithAny(lower, VIDEO_SUFFIXES)) {
                videoFile = name;
                videoSize = sizeOf(sibling);
            } else if (thumbnailFile == null && endsWithAny(lower, THUMBNAIL_SUFFIXES)) {
                thumbnailFile = name;
            }
        }

        return new CatalogItem(
            itemId,
            title == null ? "" : title,
            textOrNull(info, "description"),
            info.path("duration").isNumber() ? (int) Math.round(info.path("duration").asDouble()) : null,
            parseUploadDate(textOrNull(info, "upload_date")),
            videoFile,
            thumbnailFile,
            videoSize
        );
    }

    static LocalDate parseUploadDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value, UPLOAD_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static List<Path> listSorted(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted().toList();
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", dir, e.getMessage());
            return new ArrayList<>();
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Cannot size {}: {}", file, e.getMessage());
            return 0L;
        }
    }

    private static boolean endsWithAny(String name, List<String> suffixes) {
        for (String suffix : suffixes) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
