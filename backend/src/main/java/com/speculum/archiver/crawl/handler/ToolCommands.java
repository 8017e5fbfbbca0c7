package com.speculum.archiver.crawl.handler;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.storage.MirrorStorage;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command lines for the external archiving tools.
 */
@Component
public class ToolCommands {
    static final String REJECTED_FILES = "*.exe,*.zip,*.tar.gz,*.rar,*.7z,*.iso,*.dmg";
    static final String REJECTED_URLS = "(logout|signout|login|signin|auth|session)";
    static final String VIDEO_FORMAT = "bestvideo[height<=1080]+bestaudio/best[height<=1080]/best";
    static final String VIDEO_OUTPUT_TEMPLATE = "%(id)s/%(title)s [%(id)s].%(ext)s";

    private final ArchiverProperties properties;

    public ToolCommands(ArchiverProperties properties) {
        this.properties = properties;
    }

    public List<String> wget(String url, Path mirrorsRoot, int depth, boolean includeExternal) {
        List<String> command = new ArrayList<>(List.of(
            properties.getTools().getWget(),
            "--mirror",
            "--convert-links",
            "--adjust-extension",
            "--page-requisites",
            "--no-parent",
            "--wait=0.5",
            "--random-wait",
            "--tries=3",
            "--timeout=30",
            "--no-check-certificate",
            "--execute=robots=off",
            "--user-agent=" + properties.getUserAgent(),
            "-P",
            mirrorsRoot.toString()
        ));
        if (depth > 0) {
            command.add("-l");
            command.add(String.valueOf(depth));
        }
        if (includeExternal) {
            String host = MirrorStorage.hostOf(url);
            command.add("--span-hosts");
            if (host != null) {
                command.add("--domains=" + host);
            }
        }
        command.add("--reject");
        command.add(REJECTED_FILES);
        command.add("--reject-regex");
        command.add(REJECTED_URLS);
        command.add(url);
        return command;
    }

    public List<String> ytDlp(String url, Path outputDir) {
        return List.of(
            properties.getTools().getYtDlp(),
            "--format", VIDEO_FORMAT,
            "--merge-output-format", "mp4",
            "--write-info-json",
            "--write-thumbnail",
            "--convert-thumbnails", "jpg",
            "--embed-thumbnail",
            "--add-metadata",
            "--output", outputDir.resolve(VIDEO_OUTPUT_TEMPLATE).toString(),
            "--restrict-filenames",
            "--no-overwrites",
            "--ignore-errors",
            "--sleep-interval", "2",
            "--max-sleep-interval", "5",
            url
        );
    }

    public List<String> ytDlpProbe(String url) {
        return List.of(
            properties.getTools().getYtDlp(),
            "--dump-json",
            "--playlist-items", "1",
            url
        );
    }

    public List<String> singleFile(String url, Path outputDir) {
        return List.of(
            properties.getTools().getSingleFile(),
            url,
            "--output-directory=" + outputDir,
            "--user-agent=" + properties.getUserAgent()
        );
    }
}
