package com.nevis.citation.source;

import com.nevis.citation.exception.ReferenceUnavailableException;
import com.nevis.citation.model.ReferenceDocument;
import com.nevis.citation.model.ReferenceSection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcReferenceSource implements ReferenceSource {

    private final JdbcClient jdbcClient;

    @Override
    public ReferenceDocument getReference(String referenceNumber) {
        try {
            String title = jdbcClient.sql("SELECT COALESCE(title, '') AS title FROM reference_documents WHERE reference_number = :ref")
                .param("ref", referenceNumber)
                .query((rs, rowNum) -> rs.getString("title"))
                .optional()
                .orElseThrow(() -> new ReferenceUnavailableException(referenceNumber, "document not found"));

            List<ReferenceSection> sections = jdbcClient.sql("""
                    SELECT section_name, content
                    FROM reference_sections
                    WHERE reference_number = :ref
                    ORDER BY section_order ASC
                    """)
                .param("ref", referenceNumber)
                .query((rs, rowNum) -> new ReferenceSection(rs.getString("section_name"), rs.getString("content")))
                .list();

            ReferenceDocument document = new ReferenceDocument(referenceNumber, title, sections);
            if (!document.hasReadableText()) {
                throw new ReferenceUnavailableException(referenceNumber, "document has no readable text");
            }
            return document;
        } catch (DataAccessException e) {
            log.error("Failed to load reference {}", referenceNumber, e);
            throw new ReferenceUnavailableException(referenceNumber, "storage error");
        }
    }
}
