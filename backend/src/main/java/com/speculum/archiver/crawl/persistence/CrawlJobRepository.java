package com.speculum.archiver.crawl.persistence;

import com.speculum.archiver.crawl.model.AttemptOutcome;
import com.speculum.archiver.crawl.model.CatalogItem;
import com.speculum.archiver.crawl.model.CrawlAttempt;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlStats;
import com.speculum.archiver.crawl.model.ErrorClass;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.model.NewCrawlJob;
import com.speculum.archiver.crawl.model.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Job Registry backed by {@code crawl_jobs}, {@code crawl_attempts} and {@code catalog_items}.
 *
 * <p>Every write that moves a job out of {@code crawling} is guarded by
 * {@code status = 'crawling'} and reports whether it applied, so a late writer can never move
 * a job backward. Attempt records are finalized at most once ({@code finished_at IS NULL}).
 */
@Repository
public class CrawlJobRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public CrawlJobRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertJob(NewCrawlJob job) {
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", job.url())
            .addValue("kind", job.kind().name())
            .addValue("depth", Math.max(0, job.depth()))
            .addValue("includeExternal", job.includeExternal())
            .addValue("intervalDays", Math.max(1, job.intervalDays()))
            .addValue("status", JobStatus.PENDING.dbValue())
            .addValue("now", toTimestamp(now));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_jobs (
                    url,
                    kind,
                    depth,
                    include_external,
                    interval_days,
                    status,
                    retry_count,
                    size_bytes,
                    item_count,
                    created_at,
                    updated_at
                )
                VALUES (
                    :url,
                    :kind,
                    :depth,
                    :includeExternal,
                    :intervalDays,
                    :status,
                    0,
                    0,
                    0,
                    :now,
                    :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id returned for new crawl job " + job.url());
        }
        return key.longValue();
    }

    public CrawlJob findJob(long jobId) {
        List<CrawlJob> rows = jdbc.query(
            """
                SELECT *
                FROM crawl_jobs
                WHERE id = :jobId
                """,
            new MapSqlParameterSource("jobId", jobId),
            crawlJobRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CrawlJob> findJobsInStatus(JobStatus status) {
        return jdbc.query(
            """
                SELECT *
                FROM crawl_jobs
                WHERE status = :status
                ORDER BY updated_at ASC, id ASC
                """,
            new MapSqlParameterSource("status", status.dbValue()),
            crawlJobRowMapper()
        );
    }

    /**
     * Jobs never crawled, or finished jobs whose recrawl interval has elapsed.
     */
    public List<Long> findDueForCrawl(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("pending", JobStatus.PENDING.dbValue())
            .addValue("ready", JobStatus.READY.dbValue())
            .addValue("now", toTimestamp(now))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id
                FROM crawl_jobs
                WHERE status = :pending
                   OR (status = :ready AND next_crawl_at IS NOT NULL AND next_crawl_at <= :now)
                ORDER BY COALESCE(next_crawl_at, created_at) ASC, id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
    }

    public List<Long> findDueForRetry(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", JobStatus.RETRY_PENDING.dbValue())
            .addValue("now", toTimestamp(now))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id
                FROM crawl_jobs
                WHERE status = :status
                  AND (next_crawl_at IS NULL OR next_crawl_at <= :now)
                ORDER BY next_crawl_at ASC, id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
    }

    /**
     * Moves a dispatchable job ({@code pending}, {@code ready}, {@code retry_pending}) to
     * {@code crawling} and clears its last error.
     *
     * @return false when the job is missing or in any other status
     */
    public boolean markCrawling(long jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("crawling", JobStatus.CRAWLING.dbValue())
            .addValue("dispatchable", List.of(
                JobStatus.PENDING.dbValue(),
                JobStatus.READY.dbValue(),
                JobStatus.RETRY_PENDING.dbValue()
            ))
            .addValue("now", toTimestamp(clock.instant()));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :crawling,
                    last_error = NULL,
                    updated_at = :now
                WHERE id = :jobId
                  AND status IN (:dispatchable)
                """,
            params
        );
        return updated == 1;
    }

    public boolean markSuccess(long jobId, CrawlStats stats, Instant finishedAt, Instant nextCrawlAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("ready", JobStatus.READY.dbValue())
            .addValue("crawling", JobStatus.CRAWLING.dbValue())
            .addValue("sizeBytes", stats.sizeBytes())
            .addValue("itemCount", stats.itemCount())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("nextCrawlAt", toTimestamp(nextCrawlAt));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :ready,
                    last_error = NULL,
                    retry_count = 0,
                    size_bytes = :sizeBytes,
                    item_count = :itemCount,
                    last_crawl_at = :finishedAt,
                    next_crawl_at = :nextCrawlAt,
                    updated_at = :finishedAt
                WHERE id = :jobId
                  AND status = :crawling
                """,
            params
        );
        return updated == 1;
    }

    public boolean markFailure(long jobId, RetryDecision decision, String error) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", decision.status().dbValue())
            .addValue("crawling", JobStatus.CRAWLING.dbValue())
            .addValue("retryCount", decision.retryCount())
            .addValue("nextCrawlAt", toTimestamp(decision.nextAttemptAt()))
            .addValue("lastError", error)
            .addValue("now", toTimestamp(clock.instant()));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :status,
                    retry_count = :retryCount,
                    next_crawl_at = :nextCrawlAt,
                    last_error = :lastError,
                    updated_at = :now
                WHERE id = :jobId
                  AND status = :crawling
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Ends a crawl that did not run to completion (manual cancel, orphan reset) in
     * {@code error} without touching the retry count.
     */
    public boolean markCancelled(long jobId, String message) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("error", JobStatus.ERROR.dbValue())
            .addValue("crawling", JobStatus.CRAWLING.dbValue())
            .addValue("lastError", message)
            .addValue("now", toTimestamp(clock.instant()));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :error,
                    last_error = :lastError,
                    updated_at = :now
                WHERE id = :jobId
                  AND status = :crawling
                """,
            params
        );
        return updated == 1;
    }

    public boolean resetToPending(long jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("pending", JobStatus.PENDING.dbValue())
            .addValue("resettable", List.of(JobStatus.ERROR.dbValue(), JobStatus.DEAD.dbValue()))
            .addValue("now", toTimestamp(clock.instant()));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :pending,
                    retry_count = 0,
                    last_error = NULL,
                    next_crawl_at = NULL,
                    updated_at = :now
                WHERE id = :jobId
                  AND status IN (:resettable)
                """,
            params
        );
        return updated == 1;
    }

    public void updateChannelId(long jobId, String channelId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("channelId", channelId)
            .addValue("now", toTimestamp(clock.instant()));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET channel_id = :channelId,
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
    }

    public long insertAttempt(long jobId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("outcome", AttemptOutcome.RUNNING.dbValue());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_attempts (
                    job_id,
                    started_at,
                    outcome,
                    items_crawled,
                    bytes_transferred
                )
                VALUES (
                    :jobId,
                    :startedAt,
                    :outcome,
                    0,
                    0
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id returned for crawl attempt of job " + jobId);
        }
        return key.longValue();
    }

    public boolean finalizeAttempt(
        long attemptId,
        Instant finishedAt,
        AttemptOutcome outcome,
        CrawlStats stats,
        String logTail,
        String errorMessage,
        ErrorClass errorClass
    ) {
        MapSqlParameterSource params = finalizeParams(finishedAt, outcome, stats, logTail, errorMessage, errorClass)
            .addValue("attemptId", attemptId);
        int updated = jdbc.update(
            """
                UPDATE crawl_attempts
                SET finished_at = :finishedAt,
                    outcome = :outcome,
                    items_crawled = :itemsCrawled,
                    bytes_transferred = :bytesTransferred,
                    log_tail = :logTail,
                    error_message = :errorMessage,
                    error_class = :errorClass
                WHERE id = :attemptId
                  AND finished_at IS NULL
                """,
            params
        );
        if (updated == 0) {
            log.debug("Attempt {} already finalized, {} ignored", attemptId, outcome);
        }
        return updated == 1;
    }

    public int finalizeOpenAttempts(
        long jobId,
        Instant finishedAt,
        AttemptOutcome outcome,
        String logTail,
        String errorMessage
    ) {
        MapSqlParameterSource params = finalizeParams(finishedAt, outcome, CrawlStats.EMPTY, logTail, errorMessage, null)
            .addValue("jobId", jobId);
        return jdbc.update(
            """
                UPDATE crawl_attempts
                SET finished_at = :finishedAt,
                    outcome = :outcome,
                    log_tail = :logTail,
                    error_message = :errorMessage
                WHERE job_id = :jobId
                  AND finished_at IS NULL
                """,
            params
        );
    }

    public List<CrawlAttempt> findAttempts(long jobId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT *
                FROM crawl_attempts
                WHERE job_id = :jobId
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            crawlAttemptRowMapper()
        );
    }

    public CrawlAttempt findAttempt(long attemptId) {
        List<CrawlAttempt> rows = jdbc.query(
            """
                SELECT *
                FROM crawl_attempts
                WHERE id = :attemptId
                """,
            new MapSqlParameterSource("attemptId", attemptId),
            crawlAttemptRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Inserts a catalog row unless the job already has one with the same item id.
     *
     * @return true when a row was inserted
     */
    public boolean upsertCatalogItem(long jobId, Long attemptId, CatalogItem item) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("attemptId", attemptId)
            .addValue("itemId", item.itemId())
            .addValue("title", item.title())
            .addValue("description", item.description())
            .addValue("durationSeconds", item.durationSeconds())
            .addValue("uploadDate", item.uploadDate() == null ? null : Date.valueOf(item.uploadDate()))
            .addValue("filename", item.filename())
            .addValue("thumbnailFilename", item.thumbnailFilename())
            .addValue("sizeBytes", item.sizeBytes())
            .addValue("now", toTimestamp(clock.instant()));

        Integer existing = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM catalog_items
                WHERE job_id = :jobId
                  AND item_id = :itemId
                """,
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO catalog_items (
                        job_id,
                        attempt_id,
                        item_id,
                        title,
                        description,
                        duration_seconds,
                        upload_date,
                        filename,
                        thumbnail_filename,
                        size_bytes,
                        created_at
                    )
                    VALUES (
                        :jobId,
                        :attemptId,
                        :itemId,
                        :title,
                        :description,
                        :durationSeconds,
                        :uploadDate,
                        :filename,
                        :thumbnailFilename,
                        :sizeBytes,
                        :now
                    )
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Catalog item {} of job {} inserted concurrently", item.itemId(), jobId);
            return false;
        }
    }

    public int countCatalogItems(long jobId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM catalog_items
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource("jobId", jobId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private MapSqlParameterSource finalizeParams(
        Instant finishedAt,
        AttemptOutcome outcome,
        CrawlStats stats,
        String logTail,
        String errorMessage,
        ErrorClass errorClass
    ) {
        CrawlStats safeStats = stats == null ? CrawlStats.EMPTY : stats;
        return new MapSqlParameterSource()
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("outcome", outcome.dbValue())
            .addValue("itemsCrawled", safeStats.itemCount())
            .addValue("bytesTransferred", safeStats.sizeBytes())
            .addValue("logTail", logTail)
            .addValue("errorMessage", errorMessage)
            .addValue("errorClass", errorClass == null ? null : errorClass.name());
    }

    private RowMapper<CrawlJob> crawlJobRowMapper() {
        return (rs, rowNum) -> new CrawlJob(
            rs.getLong("id"),
            rs.getString("url"),
            JobKind.valueOf(rs.getString("kind")),
            rs.getInt("depth"),
            rs.getBoolean("include_external"),
            rs.getInt("interval_days"),
            JobStatus.fromDb(rs.getString("status")),
            rs.getString("last_error"),
            rs.getInt("retry_count"),
            rs.getLong("size_bytes"),
            rs.getInt("item_count"),
            rs.getString("channel_id"),
            toInstant(rs.getTimestamp("last_crawl_at")),
            toInstant(rs.getTimestamp("next_crawl_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private RowMapper<CrawlAttempt> crawlAttemptRowMapper() {
        return (rs, rowNum) -> {
            String errorClass = rs.getString("error_class");
            return new CrawlAttempt(
                rs.getLong("id"),
                rs.getLong("job_id"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at")),
                AttemptOutcome.fromDb(rs.getString("outcome")),
                rs.getInt("items_crawled"),
                rs.getLong("bytes_transferred"),
                rs.getString("log_tail"),
                rs.getString("error_message"),
                errorClass == null ? null : ErrorClass.valueOf(errorClass)
            );
        };
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
