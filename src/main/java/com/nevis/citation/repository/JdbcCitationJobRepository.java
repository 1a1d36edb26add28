package com.nevis.citation.repository;

import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobResult;
import com.nevis.citation.model.CitationJobStatus;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobErrorCode;
import com.nevis.citation.model.JobStatusCounts;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcCitationJobRepository implements CitationJobRepository {

    private final JdbcClient jdbcClient;
    private final JsonColumns json;

    private CitationJob mapJob(ResultSet rs, int rowNum) throws SQLException {
        String errorCode = rs.getString("error_code");
        JobError error = errorCode == null
            ? null
            : new JobError(JobErrorCode.valueOf(errorCode), rs.getString("error_message"));

        Array elementIds = rs.getArray("element_ids");

        return new CitationJob(
            rs.getObject("id", UUID.class),
            rs.getObject("search_history_id", UUID.class),
            rs.getString("reference"),
            CitationJobStatus.valueOf(rs.getString("status")),
            elementIds == null ? null : Arrays.asList((String[]) elementIds.getArray()),
            rs.getString("claim_hash"),
            json.read(rs.getString("result"), CitationJobResult.class),
            error,
            json.read(rs.getString("deep_analysis"), DeepAnalysisResult.class),
            rs.getObject("started_at", OffsetDateTime.class),
            rs.getObject("completed_at", OffsetDateTime.class),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    }

    @Override
    public Optional<CitationJob> createIfNoneInFlight(UUID searchHistoryId, String reference, List<String> elementIds,
                                                      String claimHash) {
        String sql = """
            INSERT INTO citation_jobs (search_history_id, reference, status, element_ids, claim_hash)
            VALUES (:searchHistoryId, :reference, 'PENDING', :elementIds, :claimHash)
            ON CONFLICT (search_history_id, reference) WHERE status IN ('PENDING', 'PROCESSING')
            DO NOTHING
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("searchHistoryId", searchHistoryId)
            .param("reference", reference)
            .param("elementIds", elementIds == null ? null : elementIds.toArray(new String[0]))
            .param("claimHash", claimHash)
            .query(this::mapJob)
            .optional();
    }

    @Override
    public Optional<CitationJob> findInFlight(UUID searchHistoryId, String reference) {
        String sql = """
            SELECT * FROM citation_jobs
            WHERE search_history_id = :searchHistoryId
              AND reference = :reference
              AND status IN ('PENDING', 'PROCESSING')
            """;

        return jdbcClient.sql(sql)
            .param("searchHistoryId", searchHistoryId)
            .param("reference", reference)
            .query(this::mapJob)
            .optional();
    }

    @Override
    public Optional<CitationJob> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM citation_jobs WHERE id = :id")
            .param("id", id)
            .query(this::mapJob)
            .optional();
    }

    @Override
    public List<CitationJob> findBySearchHistory(UUID searchHistoryId, Optional<CitationJobStatus> status) {
        String sql = """
            SELECT * FROM citation_jobs
            WHERE search_history_id = :searchHistoryId
            """ +
            status.map(s -> "AND status = :status\n").orElse("") +
            "ORDER BY created_at DESC";

        var statement = jdbcClient.sql(sql)
            .param("searchHistoryId", searchHistoryId);

        status.ifPresent(s -> statement.param("status", s.name()));

        return statement.query(this::mapJob).list();
    }

    @Override
    public JobStatusCounts countByStatus(UUID searchHistoryId) {
        Map<CitationJobStatus, Long> counts = new EnumMap<>(CitationJobStatus.class);

        jdbcClient.sql("""
                SELECT status, COUNT(*) AS total
                FROM citation_jobs
                WHERE search_history_id = :searchHistoryId
                GROUP BY status
                """)
            .param("searchHistoryId", searchHistoryId)
            .query((rs, rowNum) -> Map.entry(CitationJobStatus.valueOf(rs.getString("status")), rs.getLong("total")))
            .list()
            .forEach(e -> counts.put(e.getKey(), e.getValue()));

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new JobStatusCounts(
            total,
            counts.getOrDefault(CitationJobStatus.PENDING, 0L),
            counts.getOrDefault(CitationJobStatus.PROCESSING, 0L),
            counts.getOrDefault(CitationJobStatus.COMPLETED, 0L),
            counts.getOrDefault(CitationJobStatus.FAILED, 0L)
        );
    }

    @Override
    public Optional<CitationJob> claimForProcessing(UUID id) {
        String sql = """
            UPDATE citation_jobs
            SET status = 'PROCESSING',
                started_at = NOW(),
                updated_at = NOW()
            WHERE id = :id AND status = 'PENDING'
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .query(this::mapJob)
            .optional();
    }

    @Override
    public boolean complete(UUID id, CitationJobResult result) {
        String sql = """
            UPDATE citation_jobs
            SET status = 'COMPLETED',
                result = :result::jsonb,
                error_code = NULL,
                error_message = NULL,
                completed_at = NOW(),
                updated_at = NOW()
            WHERE id = :id AND status = 'PROCESSING'
            """;

        return jdbcClient.sql(sql)
            .param("result", json.write(result))
            .param("id", id)
            .update() > 0;
    }

    @Override
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200))
    public boolean fail(UUID id, JobError error) {
        String sql = """
            UPDATE citation_jobs
            SET status = 'FAILED',
                result = NULL,
                error_code = :errorCode,
                error_message = :errorMessage,
                completed_at = NOW(),
                updated_at = NOW()
            WHERE id = :id AND status IN ('PENDING', 'PROCESSING')
            """;

        return jdbcClient.sql(sql)
            .param("errorCode", error.code().name())
            .param("errorMessage", error.message())
            .param("id", id)
            .update() > 0;
    }

    @Override
    public List<UUID> failStaleProcessing(Duration timeout, JobError error) {
        String sql = """
            UPDATE citation_jobs
            SET status = 'FAILED',
                error_code = :errorCode,
                error_message = :errorMessage,
                completed_at = NOW(),
                updated_at = NOW()
            WHERE status = 'PROCESSING'
              AND started_at < NOW() - (INTERVAL '1 millisecond' * :timeoutMillis)
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("errorCode", error.code().name())
            .param("errorMessage", error.message())
            .param("timeoutMillis", timeout.toMillis())
            .query(UUID.class)
            .list();
    }

    @Override
    public List<UUID> findOrphanedPending(Duration olderThan) {
        String sql = """
            SELECT id FROM citation_jobs
            WHERE status = 'PENDING'
              AND created_at < NOW() - (INTERVAL '1 millisecond' * :ageMillis)
            ORDER BY created_at ASC
            """;

        return jdbcClient.sql(sql)
            .param("ageMillis", olderThan.toMillis())
            .query(UUID.class)
            .list();
    }

    @Override
    public int failInFlightForSearch(UUID searchHistoryId, JobError error) {
        String sql = """
            UPDATE citation_jobs
            SET status = 'FAILED',
                error_code = :errorCode,
                error_message = :errorMessage,
                completed_at = NOW(),
                updated_at = NOW()
            WHERE search_history_id = :searchHistoryId
              AND status IN ('PENDING', 'PROCESSING')
            """;

        return jdbcClient.sql(sql)
            .param("errorCode", error.code().name())
            .param("errorMessage", error.message())
            .param("searchHistoryId", searchHistoryId)
            .update();
    }

    @Override
    public Optional<CitationJob> findLatestCompleted(UUID searchHistoryId, String reference) {
        String sql = """
            SELECT * FROM citation_jobs
            WHERE search_history_id = :searchHistoryId
              AND reference = :reference
              AND status = 'COMPLETED'
            ORDER BY completed_at DESC
            LIMIT 1
            """;

        return jdbcClient.sql(sql)
            .param("searchHistoryId", searchHistoryId)
            .param("reference", reference)
            .query(this::mapJob)
            .optional();
    }

    @Override
    public boolean saveDeepAnalysis(UUID id, DeepAnalysisResult deepAnalysis) {
        String sql = """
            UPDATE citation_jobs
            SET deep_analysis = :deepAnalysis::jsonb,
                updated_at = NOW()
            WHERE id = :id AND status = 'COMPLETED'
            """;

        return jdbcClient.sql(sql)
            .param("deepAnalysis", json.write(deepAnalysis))
            .param("id", id)
            .update() > 0;
    }

    @Override
    public Map<String, DeepAnalysisResult> findLatestDeepAnalyses(UUID searchHistoryId, Collection<String> references) {
        return latestDeepAnalyses(searchHistoryId, references, null);
    }

    @Override
    public Map<String, DeepAnalysisResult> findLatestDeepAnalyses(UUID searchHistoryId, Collection<String> references,
                                                                  String claimHash) {
        return latestDeepAnalyses(searchHistoryId, references, claimHash);
    }

    private Map<String, DeepAnalysisResult> latestDeepAnalyses(UUID searchHistoryId, Collection<String> references,
                                                               String claimHash) {
        if (references == null || references.isEmpty()) {
            return Map.of();
        }

        String sql = """
            SELECT DISTINCT ON (reference) reference, deep_analysis
            FROM citation_jobs
            WHERE search_history_id = :searchHistoryId
              AND status = 'COMPLETED'
              AND deep_analysis IS NOT NULL
              AND reference IN (:references)
            """ +
            (claimHash == null ? "" : "AND claim_hash = :claimHash\n") +
            "ORDER BY reference, completed_at DESC";

        var statement = jdbcClient.sql(sql)
            .param("searchHistoryId", searchHistoryId)
            .param("references", references);

        if (claimHash != null) {
            statement.param("claimHash", claimHash);
        }

        Map<String, DeepAnalysisResult> analyses = new HashMap<>();
        statement
            .query((rs, rowNum) -> Map.entry(
                rs.getString("reference"),
                json.read(rs.getString("deep_analysis"), DeepAnalysisResult.class)))
            .list()
            .forEach(e -> analyses.put(e.getKey(), e.getValue()));
        return analyses;
    }
}
