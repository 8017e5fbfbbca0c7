package com.speculum.archiver.crawl.storage;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.model.CrawlStats;
import com.speculum.archiver.crawl.model.JobKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Layout of the mirror tree:
 * <pre>
 *   &lt;mirrors&gt;/&lt;site&gt;/...                 page mirrors (wget -P &lt;mirrors&gt;)
 *   &lt;mirrors&gt;/_snapshots/&lt;site&gt;/...      browser snapshots
 *   &lt;mirrors&gt;/youtube/&lt;channelId&gt;/...    video channels, one directory per video
 * </pre>
 * {@code <site>} is named the way wget names its host directory: the lower-cased host, plus
 * {@code :port} when the port is not the scheme's default. Page mirrors and snapshots never
 * share a tree.
 */
@Component
public class MirrorStorage {
    private static final Logger log = LoggerFactory.getLogger(MirrorStorage.class);
    private static final Set<String> PAGE_EXTENSIONS = Set.of(".html", ".htm");
    private static final Set<String> VIDEO_EXTENSIONS = Set.of(".mp4", ".webm", ".mkv", ".avi", ".mov");
    private static final String SNAPSHOT_DIR = "_snapshots";

    private final Path mirrorsRoot;

    public MirrorStorage(ArchiverProperties properties) {
        this.mirrorsRoot = Paths.get(properties.getMirrorsPath()).toAbsolutePath().normalize();
    }

    public Path mirrorsRoot() {
        return mirrorsRoot;
    }

    public Path pageMirrorDir(String url) {
        return resolveInside(siteDirOf(url));
    }

    public Path snapshotDir(String url) {
        return resolveInside(SNAPSHOT_DIR).resolve(safeSegment(siteDirOf(url)));
    }

    public Path channelDir(String channelId) {
        return resolveInside("youtube").resolve(safeSegment(channelId));
    }

    public CrawlStats measure(Path dir, JobKind kind) {
        if (dir == null || !Files.isDirectory(dir)) {
            return CrawlStats.EMPTY;
        }
        Set<String> countedExtensions = kind == JobKind.VIDEO_CHANNEL ? VIDEO_EXTENSIONS : PAGE_EXTENSIONS;
        long[] totals = new long[2];
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        totals[0] += attrs.size();
                        if (hasExtension(file, countedExtensions)) {
                            totals[1]++;
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable file {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to measure " + dir, e);
        }
        return new CrawlStats(totals[0], (int) Math.min(Integer.MAX_VALUE, totals[1]));
    }

    public boolean delete(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return false;
        }
        Path normalized = dir.toAbsolutePath().normalize();
        if (!normalized.startsWith(mirrorsRoot) || normalized.equals(mirrorsRoot)) {
            throw new IllegalArgumentException("Refusing to delete outside the mirrors root: " + dir);
        }
        try (Stream<Path> paths = Files.walk(normalized)) {
            paths.sorted(Comparator.reverseOrder()).forEach(MirrorStorage::deletePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + dir, e);
        }
        log.info("Deleted mirror at {}", normalized);
        return true;
    }

    public static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Host directory wget creates for the URL when run with {@code -P} and without {@code -nH}.
     */
    public static String siteDirOf(String url) {
        String host = requireHost(url);
        int port = URI.create(url.trim()).getPort();
        if (port < 0 || port == defaultPortOf(url)) {
            return host;
        }
        return host + ":" + port;
    }

    /**
     * Directory-safe name derived from a URL, used when no better identifier is known.
     */
    public static String slugOf(String url) {
        if (url == null || url.isBlank()) {
            return "unknown";
        }
        String stripped = url.trim().replaceFirst("^[a-zA-Z][a-zA-Z0-9+.-]*://", "");
        String slug = stripped.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("^_+|_+$", "");
        if (slug.isEmpty()) {
            return "unknown";
        }
        return slug.length() > 120 ? slug.substring(0, 120) : slug;
    }

    private Path resolveInside(String segment) {
        Path resolved = mirrorsRoot.resolve(safeSegment(segment)).normalize();
        if (!resolved.startsWith(mirrorsRoot)) {
            throw new IllegalArgumentException("Path escapes mirrors root: " + segment);
        }
        return resolved;
    }

    private static String requireHost(String url) {
        String host = hostOf(url);
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        return host;
    }

    private static int defaultPortOf(String url) {
        String scheme = URI.create(url.trim()).getScheme();
        if (scheme == null) {
            return -1;
        }
        return switch (scheme.toLowerCase(Locale.ROOT)) {
            case "http" -> 80;
            case "https" -> 443;
            case "ftp" -> 21;
            default -> -1;
        };
    }

    private static String safeSegment(String segment) {
        if (segment == null || segment.isBlank() || segment.contains("/") || segment.contains("\\")
            || segment.equals(".") || segment.equals("..")) {
            throw new IllegalArgumentException("Invalid mirror path segment: " + segment);
        }
        return segment;
    }

    private static boolean hasExtension(Path file, Set<String> extensions) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static void deletePath(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + path, e);
        }
    }
}
