package com.nevis.citation.repository;

import com.nevis.citation.model.CitationLocation;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.MatchFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcCitationMatchRepository implements CitationMatchRepository {

    // newest job first so re-runs shadow older matches in ranked reads
    private static final String RANK_ORDER = "score DESC NULLS LAST, element_order ASC, created_at DESC";

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    private CitationMatch mapMatch(ResultSet rs, int rowNum) throws SQLException {
        double rawScore = rs.getDouble("score");
        Double score = rs.wasNull() ? null : rawScore;
        return new CitationMatch(
            rs.getObject("id", UUID.class),
            rs.getObject("search_history_id", UUID.class),
            rs.getObject("citation_job_id", UUID.class),
            rs.getString("reference"),
            rs.getString("element_id"),
            rs.getString("element_text"),
            rs.getInt("element_order"),
            rs.getString("parsed_element_text"),
            rs.getString("matching_text"),
            score,
            rs.getString("reasoning"),
            json.read(rs.getString("citation_location"), CitationLocation.class),
            json.read(rs.getString("deep_analysis"), DeepAnalysisResult.class),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    }

    @Override
    public void saveAll(List<CitationMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO citation_matches (
                id, search_history_id, citation_job_id, reference, element_id, element_text,
                element_order, parsed_element_text, matching_text, score, reasoning, citation_location
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb))
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                CitationMatch match = matches.get(i);
                ps.setObject(1, match.id());
                ps.setObject(2, match.searchHistoryId());
                ps.setObject(3, match.citationJobId());
                ps.setString(4, match.reference());
                ps.setString(5, match.elementId());
                ps.setString(6, match.elementText());
                ps.setInt(7, match.elementOrder());
                ps.setString(8, match.parsedElementText());
                ps.setString(9, match.matchingText());
                if (match.score() == null) {
                    ps.setNull(10, Types.DOUBLE);
                } else {
                    ps.setDouble(10, match.score());
                }
                ps.setString(11, match.reasoning());
                ps.setString(12, json.write(match.citationLocation()));
            }

            @Override
            public int getBatchSize() {
                return matches.size();
            }
        });
    }

    @Override
    public List<CitationMatch> findByJob(UUID citationJobId) {
        return jdbcClient.sql("SELECT * FROM citation_matches WHERE citation_job_id = :jobId ORDER BY " + RANK_ORDER)
            .param("jobId", citationJobId)
            .query(this::mapMatch)
            .list();
    }

    @Override
    public List<CitationMatch> findBySearchHistory(UUID searchHistoryId, MatchFilter filter) {
        StringBuilder sql = new StringBuilder("""
            SELECT * FROM citation_matches
            WHERE search_history_id = :searchHistoryId
            """);

        filter.reference().ifPresent(r -> sql.append("  AND reference = :reference\n"));
        filter.minScore().ifPresent(s -> sql.append("  AND score >= :minScore\n"));
        filter.hasDeepAnalysis().ifPresent(has ->
            sql.append(has ? "  AND deep_analysis IS NOT NULL\n" : "  AND deep_analysis IS NULL\n"));
        sql.append("ORDER BY ").append(RANK_ORDER);

        var statement = jdbcClient.sql(sql.toString())
            .param("searchHistoryId", searchHistoryId);

        filter.reference().ifPresent(r -> statement.param("reference", r));
        filter.minScore().ifPresent(s -> statement.param("minScore", s));

        return statement.query(this::mapMatch).list();
    }

    @Override
    public List<CitationMatch> findTopMatches(UUID searchHistoryId, Optional<String> reference, int limit) {
        // only matches of the latest completed job per reference count
        String sql = """
            SELECT m.* FROM citation_matches m
            JOIN (
                SELECT DISTINCT ON (reference) id
                FROM citation_jobs
                WHERE search_history_id = :searchHistoryId
                  AND status = 'COMPLETED'
                ORDER BY reference, completed_at DESC
            ) latest ON latest.id = m.citation_job_id
            WHERE m.search_history_id = :searchHistoryId
            """ +
            reference.map(r -> "  AND m.reference = :reference\n").orElse("") +
            """
            ORDER BY m.score DESC NULLS LAST, m.element_order ASC, m.reference ASC
            LIMIT :limit
            """;

        var statement = jdbcClient.sql(sql)
            .param("searchHistoryId", searchHistoryId)
            .param("limit", limit);

        reference.ifPresent(r -> statement.param("reference", r));

        return statement.query(this::mapMatch).list();
    }

    @Override
    public int attachDeepAnalysis(Collection<UUID> matchIds, DeepAnalysisResult deepAnalysis) {
        if (matchIds == null || matchIds.isEmpty()) {
            return 0;
        }

        String sql = """
            UPDATE citation_matches
            SET deep_analysis = :deepAnalysis::jsonb,
                updated_at = NOW()
            WHERE id IN (:ids) AND score IS NOT NULL
            """;

        return jdbcClient.sql(sql)
            .param("deepAnalysis", json.write(deepAnalysis))
            .param("ids", matchIds)
            .update();
    }
}
