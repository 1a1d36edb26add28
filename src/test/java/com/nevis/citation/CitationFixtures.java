package com.nevis.citation;

import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobStatus;
import com.nevis.citation.model.CitationLocation;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.ClaimElement;
import com.nevis.citation.model.LocationSnippet;
import com.nevis.citation.model.ReferenceDocument;
import com.nevis.citation.model.ReferenceSection;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class CitationFixtures {

    public static final RequestContext CONTEXT = new RequestContext("tenant-1", "project-1", "user-1");

    private CitationFixtures() {
    }

    public static CitationProperties properties() {
        return new CitationProperties(
            new CitationProperties.Matcher(3, 500, 50, 400),
            new CitationProperties.Job(Duration.ofSeconds(2), Duration.ofMinutes(2), Duration.ofMillis(10), Duration.ofSeconds(1)),
            new CitationProperties.DeepAnalysis(0.3, 5),
            new CitationProperties.Combined(0.6)
        );
    }

    public static SearchHistory search(UUID id) {
        return new SearchHistory(id, CONTEXT.tenantId(), CONTEXT.projectId(), "wireless charging", null, OffsetDateTime.now());
    }

    public static Claim claim(UUID searchHistoryId) {
        return new Claim(searchHistoryId, "A charging pad comprising a coil, a controller and a housing.", List.of(
            new ClaimElement("E1", "a charging pad comprising a coil", 1),
            new ClaimElement("E2", "a controller regulating current through the coil", 2),
            new ClaimElement("E3", "a housing enclosing the coil and controller", 3)
        ));
    }

    public static ReferenceDocument reference(String number) {
        return new ReferenceDocument(number, "Inductive charger", List.of(
            new ReferenceSection("Abstract", "An inductive charger with a planar coil."),
            new ReferenceSection("Description", "A microcontroller regulates the coil current. The housing is plastic.")
        ));
    }

    public static CitationMatch match(String reference, String elementId, int order, Double score) {
        return new CitationMatch(
            UUID.randomUUID(),
            null,
            null,
            reference,
            elementId,
            "text of " + elementId,
            order,
            "text of " + elementId,
            score == null || score == 0 ? null : "matching " + elementId,
            score,
            "reasoning " + elementId,
            score == null || score == 0
                ? null
                : new CitationLocation(reference, elementId, List.of(new LocationSnippet("Description", "snippet " + elementId, "context"))),
            null,
            null,
            null
        );
    }

    public static CitationJob pendingJob(UUID jobId, UUID searchHistoryId, String reference) {
        return new CitationJob(jobId, searchHistoryId, reference, CitationJobStatus.PENDING, null, null, null, null, null,
            null, null, OffsetDateTime.now(), OffsetDateTime.now());
    }

    public static CitationJob processingJob(UUID jobId, UUID searchHistoryId, String reference) {
        return new CitationJob(jobId, searchHistoryId, reference, CitationJobStatus.PROCESSING, null, null, null, null, null,
            OffsetDateTime.now(), null, OffsetDateTime.now(), OffsetDateTime.now());
    }
}
