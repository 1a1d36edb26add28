package com.nevis.citation.source;

import com.nevis.citation.exception.EntityNotFoundException;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.ClaimElement;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JdbcClaimSource implements ClaimSource {

    private final JdbcClient jdbcClient;

    @Override
    public Claim getClaim(UUID searchHistoryId) {
        String claimText = jdbcClient.sql("SELECT claim_text FROM claims WHERE search_history_id = :id")
            .param("id", searchHistoryId)
            .query(String.class)
            .optional()
            .orElseThrow(() -> new EntityNotFoundException(searchHistoryId));

        List<ClaimElement> elements = jdbcClient.sql("""
                SELECT element_id, element_text, element_order
                FROM claim_elements
                WHERE search_history_id = :id
                ORDER BY element_order ASC
                """)
            .param("id", searchHistoryId)
            .query((rs, rowNum) -> new ClaimElement(
                rs.getString("element_id"),
                rs.getString("element_text"),
                rs.getInt("element_order")
            ))
            .list();

        return new Claim(searchHistoryId, claimText, elements);
    }
}
