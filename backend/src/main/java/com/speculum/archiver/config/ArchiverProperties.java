package com.speculum.archiver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "archiver")
public class ArchiverProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String mirrorsPath = "/mirrors";
    private String userAgent;
    private Tools tools = new Tools();
    private Timeouts timeouts = new Timeouts();
    private Retry retry = new Retry();
    private Live live = new Live();
    private Trigger trigger = new Trigger();

    public String getMirrorsPath() {
        return mirrorsPath;
    }

    public void setMirrorsPath(String mirrorsPath) {
        this.mirrorsPath = (mirrorsPath == null || mirrorsPath.isBlank()) ? "/mirrors" : mirrorsPath.trim();
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Tools getTools() {
        return tools;
    }

    public void setTools(Tools tools) {
        this.tools = tools;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Live getLive() {
        return live;
    }

    public void setLive(Live live) {
        this.live = live;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public void setTrigger(Trigger trigger) {
        this.trigger = trigger;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Tools {
        private String wget = "wget";
        private String ytDlp = "yt-dlp";
        private String singleFile = "single-file";
        private List<Integer> wgetSuccessCodes = new ArrayList<>(List.of(0, 8));

        public String getWget() {
            return wget;
        }

        public void setWget(String wget) {
            this.wget = wget;
        }

        public String getYtDlp() {
            return ytDlp;
        }

        public void setYtDlp(String ytDlp) {
            this.ytDlp = ytDlp;
        }

        public String getSingleFile() {
            return singleFile;
        }

        public void setSingleFile(String singleFile) {
            this.singleFile = singleFile;
        }

        public List<Integer> getWgetSuccessCodes() {
            return wgetSuccessCodes;
        }

        public void setWgetSuccessCodes(List<Integer> wgetSuccessCodes) {
            this.wgetSuccessCodes = wgetSuccessCodes == null || wgetSuccessCodes.isEmpty()
                ? new ArrayList<>(List.of(0))
                : new ArrayList<>(wgetSuccessCodes);
        }
    }

    public static class Timeouts {
        private int shortBudgetMinutes = 60;
        private int longBudgetMinutes = 240;
        private int videoBudgetMultiplier = 3;
        private int snapshotBudgetMinutes = 5;
        private int stallTimeoutSeconds = 300;
        private int probeTimeoutSeconds = 60;
        private int terminateGraceSeconds = 5;
        private int pollIntervalMs = 250;
        private long largeSiteThresholdBytes = 100L * 1024 * 1024;
        private List<String> knownLargeDomains = new ArrayList<>(List.of(
            "wikipedia.org",
            "wikimedia.org",
            "wiktionary.org",
            "archive.org",
            "gutenberg.org",
            "stackexchange.com",
            "stackoverflow.com",
            "github.com"
        ));

        public int getShortBudgetMinutes() {
            return Math.max(1, shortBudgetMinutes);
        }

        public void setShortBudgetMinutes(int shortBudgetMinutes) {
            this.shortBudgetMinutes = Math.max(1, shortBudgetMinutes);
        }

        public int getLongBudgetMinutes() {
            return Math.max(1, longBudgetMinutes);
        }

        public void setLongBudgetMinutes(int longBudgetMinutes) {
            this.longBudgetMinutes = Math.max(1, longBudgetMinutes);
        }

        public int getVideoBudgetMultiplier() {
            return Math.max(1, videoBudgetMultiplier);
        }

        public void setVideoBudgetMultiplier(int videoBudgetMultiplier) {
            this.videoBudgetMultiplier = Math.max(1, videoBudgetMultiplier);
        }

        public int getSnapshotBudgetMinutes() {
            return Math.max(1, snapshotBudgetMinutes);
        }

        public void setSnapshotBudgetMinutes(int snapshotBudgetMinutes) {
            this.snapshotBudgetMinutes = Math.max(1, snapshotBudgetMinutes);
        }

        public int getStallTimeoutSeconds() {
            return Math.max(1, stallTimeoutSeconds);
        }

        public void setStallTimeoutSeconds(int stallTimeoutSeconds) {
            this.stallTimeoutSeconds = Math.max(1, stallTimeoutSeconds);
        }

        public int getProbeTimeoutSeconds() {
            return Math.max(1, probeTimeoutSeconds);
        }

        public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
            this.probeTimeoutSeconds = Math.max(1, probeTimeoutSeconds);
        }

        public int getTerminateGraceSeconds() {
            return Math.max(0, terminateGraceSeconds);
        }

        public void setTerminateGraceSeconds(int terminateGraceSeconds) {
            this.terminateGraceSeconds = Math.max(0, terminateGraceSeconds);
        }

        public int getPollIntervalMs() {
            return Math.max(10, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(10, pollIntervalMs);
        }

        public long getLargeSiteThresholdBytes() {
            return largeSiteThresholdBytes;
        }

        public void setLargeSiteThresholdBytes(long largeSiteThresholdBytes) {
            this.largeSiteThresholdBytes = largeSiteThresholdBytes;
        }

        public List<String> getKnownLargeDomains() {
            return knownLargeDomains;
        }

        public void setKnownLargeDomains(List<String> knownLargeDomains) {
            this.knownLargeDomains = knownLargeDomains == null ? new ArrayList<>() : new ArrayList<>(knownLargeDomains);
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private List<Integer> backoffMinutes = new ArrayList<>(List.of(5, 15, 45));

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public List<Integer> getBackoffMinutes() {
            return backoffMinutes;
        }

        public void setBackoffMinutes(List<Integer> backoffMinutes) {
            this.backoffMinutes = backoffMinutes == null || backoffMinutes.isEmpty()
                ? new ArrayList<>(List.of(5))
                : new ArrayList<>(backoffMinutes);
        }
    }

    public static class Live {
        private int logBufferLines = 500;
        private int capturedLogLines = 1000;
        private int progressTailLines = 20;

        public int getLogBufferLines() {
            return Math.max(1, logBufferLines);
        }

        public void setLogBufferLines(int logBufferLines) {
            this.logBufferLines = Math.max(1, logBufferLines);
        }

        public int getCapturedLogLines() {
            return Math.max(1, capturedLogLines);
        }

        public void setCapturedLogLines(int capturedLogLines) {
            this.capturedLogLines = Math.max(1, capturedLogLines);
        }

        public int getProgressTailLines() {
            return Math.max(1, progressTailLines);
        }

        public void setProgressTailLines(int progressTailLines) {
            this.progressTailLines = Math.max(1, progressTailLines);
        }
    }

    public static class Trigger {
        private boolean enabled = false;
        private int pollIntervalSeconds = 300;
        private int dueBatchLimit = 50;
        private int retryBatchLimit = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalSeconds() {
            return Math.max(1, pollIntervalSeconds);
        }

        public void setPollIntervalSeconds(int pollIntervalSeconds) {
            this.pollIntervalSeconds = Math.max(1, pollIntervalSeconds);
        }

        public int getDueBatchLimit() {
            return Math.max(1, dueBatchLimit);
        }

        public void setDueBatchLimit(int dueBatchLimit) {
            this.dueBatchLimit = Math.max(1, dueBatchLimit);
        }

        public int getRetryBatchLimit() {
            return Math.max(1, retryBatchLimit);
        }

        public void setRetryBatchLimit(int retryBatchLimit) {
            this.retryBatchLimit = Math.max(1, retryBatchLimit);
        }
    }
}
