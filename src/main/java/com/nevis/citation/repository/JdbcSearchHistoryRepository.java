package com.nevis.citation.repository;

import com.nevis.citation.model.SearchHistory;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcSearchHistoryRepository implements SearchHistoryRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<SearchHistory> searchHistoryRowMapper = (rs, rowNum) -> new SearchHistory(
        rs.getObject("id", UUID.class),
        rs.getString("tenant_id"),
        rs.getString("project_id"),
        rs.getString("query"),
        rs.getObject("invalidated_at", OffsetDateTime.class),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    public SearchHistory save(SearchHistory searchHistory) {
        return jdbcClient.sql("""
                INSERT INTO search_histories (tenant_id, project_id, query)
                VALUES (:tenantId, :projectId, :query)
                RETURNING *
                """)
            .param("tenantId", searchHistory.tenantId())
            .param("projectId", searchHistory.projectId())
            .param("query", searchHistory.query())
            .query(searchHistoryRowMapper)
            .single();
    }

    @Override
    public Optional<SearchHistory> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM search_histories WHERE id = :id")
            .param("id", id)
            .query(searchHistoryRowMapper)
            .optional();
    }

    @Override
    public boolean markInvalidated(UUID id) {
        return jdbcClient.sql("""
                UPDATE search_histories
                SET invalidated_at = NOW()
                WHERE id = :id AND invalidated_at IS NULL
                """)
            .param("id", id)
            .update() > 0;
    }
}
