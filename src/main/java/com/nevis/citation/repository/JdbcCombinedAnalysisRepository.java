package com.nevis.citation.repository;

import com.nevis.citation.model.CombinedAnalysis;
import com.nevis.citation.model.CombinedAnalysisRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Insert-only. Combined analyses are immutable snapshots.
 */
@Repository
@RequiredArgsConstructor
public class JdbcCombinedAnalysisRepository implements CombinedAnalysisRepository {

    private final JdbcClient jdbcClient;
    private final JsonColumns json;

    private CombinedAnalysisRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return new CombinedAnalysisRecord(
            rs.getObject("id", UUID.class),
            rs.getObject("search_history_id", UUID.class),
            rs.getObject("created_at", OffsetDateTime.class),
            new LinkedHashSet<>(Arrays.asList((String[]) rs.getArray("reference_numbers").getArray())),
            json.read(rs.getString("analysis"), CombinedAnalysis.class),
            rs.getString("claim1_text")
        );
    }

    @Override
    public CombinedAnalysisRecord save(CombinedAnalysisRecord record) {
        return jdbcClient.sql("""
                INSERT INTO combined_analyses (search_history_id, reference_numbers, analysis, claim1_text)
                VALUES (:searchHistoryId, :referenceNumbers, :analysis::jsonb, :claim1Text)
                RETURNING *
                """)
            .param("searchHistoryId", record.searchHistoryId())
            .param("referenceNumbers", record.referenceNumbers().toArray(new String[0]))
            .param("analysis", json.write(record.analysis()))
            .param("claim1Text", record.claim1Text())
            .query(this::mapRecord)
            .single();
    }

    @Override
    public List<CombinedAnalysisRecord> findBySearchHistory(UUID searchHistoryId) {
        return jdbcClient.sql("""
                SELECT * FROM combined_analyses
                WHERE search_history_id = :searchHistoryId
                ORDER BY created_at DESC, id
                """)
            .param("searchHistoryId", searchHistoryId)
            .query(this::mapRecord)
            .list();
    }
}
