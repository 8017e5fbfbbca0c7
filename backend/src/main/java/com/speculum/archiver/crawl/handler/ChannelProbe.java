package com.speculum.archiver.crawl.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.speculum.archiver.crawl.policy.TimeoutPolicy;
import com.speculum.archiver.crawl.process.ProcessMonitor;
import com.speculum.archiver.crawl.process.ProcessResult;
import com.speculum.archiver.crawl.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves the channel id of a video URL from the metadata of its first item.
 */
@Component
public class ChannelProbe {
    private static final Logger log = LoggerFactory.getLogger(ChannelProbe.class);
    private static final Pattern CHANNEL_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final ProcessRunner processRunner;
    private final ToolCommands toolCommands;
    private final TimeoutPolicy timeoutPolicy;
    private final ObjectMapper objectMapper;

    public ChannelProbe(
        ProcessRunner processRunner,
        ToolCommands toolCommands,
        TimeoutPolicy timeoutPolicy,
        ObjectMapper objectMapper
    ) {
        this.processRunner = processRunner;
        this.toolCommands = toolCommands;
        this.timeoutPolicy = timeoutPolicy;
        this.objectMapper = objectMapper;
    }

    /**
     * The probe process is registered with {@code monitor} so it can be cancelled, but its
     * JSON output is kept out of the monitor's log.
     */
    public Optional<String> probe(String url, ProcessMonitor monitor) {
        ProcessResult result = processRunner.run(
            toolCommands.ytDlpProbe(url),
            timeoutPolicy.probeBudget(),
            timeoutPolicy.probeBudget(),
            new QuietMonitor(monitor)
        );
        if (!result.exitedWith(List.of(0))) {
            log.warn("Channel probe for {} ended as {} (exit code {})", url, result.status(), result.exitCode());
            return Optional.empty();
        }
        return parseChannelId(result.log());
    }

    Optional<String> parseChannelId(List<String> lines) {
        for (String line : lines) {
            String trimmed = line == null ? "" : line.trim();
            if (!trimmed.startsWith("{")) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                String channelId = node.path("channel_id").asText("");
                if (CHANNEL_ID.matcher(channelId).matches()) {
                    return Optional.of(channelId);
                }
            } catch (JsonProcessingException e) {
                log.warn("Unreadable channel probe output: {}", e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    private record QuietMonitor(ProcessMonitor delegate) implements ProcessMonitor {
        @Override
        public void processStarted(Process process) {
            delegate.processStarted(process);
        }

        @Override
        public void processFinished(Process process) {
            delegate.processFinished(process);
        }

        @Override
        public boolean isCancelled() {
            return delegate.isCancelled();
        }
    }
}
