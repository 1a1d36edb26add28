package com.nevis.citation.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.exception.AnalysisUnavailableException;
import com.nevis.citation.exception.InvalidElementException;
import com.nevis.citation.infra.RateLimiter;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.ClaimElement;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.ElementAnalysis;
import com.nevis.citation.model.LocationSnippet;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static com.nevis.citation.service.ReferenceMatcherImpl.CHAT_LIMIT;

@Service
@Slf4j
public class DeepAnalysisEscalatorImpl implements DeepAnalysisEscalator {

    private static final String ANALYSIS_PROMPT_TEMPLATE =
        """
            Role: Senior patent examiner performing a detailed novelty review.

            Task: Assess how strongly reference %s anticipates the claim element below, using the
            cited passages and the preliminary match.

            Full claim:
            %s

            Claim element %s:
            %s

            Preliminary match (score %.2f): %s

            Cited passages:
            %s

            Output: a single JSON object and nothing else:
            {"relevance": <0.0-1.0>,
             "explanation": "<why the reference does or does not disclose the element>",
             "matched_concepts": ["<technical concept present in both>"],
             "key_findings": ["<short finding useful to a patent attorney>"],
             "recommendation": "<optional amendment or argument suggestion>"}
            """;

    record ElementVerdict(
        Double relevance,
        String explanation,
        @JsonProperty("matched_concepts") List<String> matchedConcepts,
        @JsonProperty("key_findings") List<String> keyFindings,
        String recommendation
    ) {}

    private record Analysed(ElementAnalysis analysis, ElementVerdict verdict) {}

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final ModelResponseParser parser;
    private final double minScore;

    public DeepAnalysisEscalatorImpl(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        ModelResponseParser parser,
        CitationProperties properties
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.parser = parser;
        this.minScore = properties.deepAnalysis().minScore();
    }

    @Override
    public List<CitationMatch> select(List<CitationMatch> topMatches, int limit) {
        return topMatches.stream()
            .filter(m -> m.score() != null && m.score() >= minScore)
            .sorted(CitationMatch.RANKING)
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public DeepAnalysisResult escalate(Claim claim, String reference, List<CitationMatch> topMatches, int limit) {
        List<CitationMatch> selected = select(topMatches, limit);
        if (selected.isEmpty()) {
            throw new AnalysisUnavailableException(
                "No match for " + reference + " scores at least " + minScore + "; nothing to analyse");
        }

        List<ClaimElement> elements = selected.stream()
            .map(m -> claim.element(m.elementId())
                .orElseThrow(() -> new InvalidElementException(m.elementId(), "Element is not part of the claim")))
            .toList();

        log.info("Deep analysis of {}: escalating {} of {} matches", reference, selected.size(), topMatches.size());

        List<Analysed> analysed = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            analysed.add(analyse(claim, reference, elements.get(i), selected.get(i)));
        }

        List<ElementAnalysis> elementAnalysis = analysed.stream().map(Analysed::analysis).toList();
        if (elementAnalysis.stream().allMatch(ElementAnalysis::failed)) {
            throw new AnalysisUnavailableException("Deep analysis failed for every element of " + reference);
        }

        Set<String> keyFindings = new LinkedHashSet<>();
        Set<String> recommendations = new LinkedHashSet<>();
        analysed.stream()
            .map(Analysed::verdict)
            .filter(Objects::nonNull)
            .forEach(v -> {
                if (v.keyFindings() != null) {
                    v.keyFindings().stream().filter(f -> f != null && !f.isBlank()).map(String::strip).forEach(keyFindings::add);
                }
                if (v.recommendation() != null && !v.recommendation().isBlank()) {
                    recommendations.add(v.recommendation().strip());
                }
            });

        return new DeepAnalysisResult(
            overallRelevance(selected, elementAnalysis),
            elementAnalysis,
            List.copyOf(keyFindings),
            recommendations.isEmpty() ? null : List.copyOf(recommendations)
        );
    }

    private Analysed analyse(Claim claim, String reference, ClaimElement element, CitationMatch match) {
        String passages = match.citationLocation() == null
            ? "(none)"
            : match.citationLocation().locations().stream()
                .map(LocationSnippet::text)
                .collect(Collectors.joining("\n---\n"));
        String prompt = String.format(ANALYSIS_PROMPT_TEMPLATE,
            reference,
            claim.text(),
            element.id(),
            element.text(),
            match.score(),
            match.reasoning() == null ? "" : match.reasoning(),
            passages);

        try {
            String raw = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt));
            ElementVerdict verdict = parser.parse(raw, ElementVerdict.class);
            ElementAnalysis analysis = new ElementAnalysis(
                element.id(),
                ModelResponseParser.clamp(verdict.relevance()),
                verdict.explanation(),
                verdict.matchedConcepts() == null ? Set.of() : new HashSet<>(verdict.matchedConcepts()),
                false
            );
            return new Analysed(analysis, verdict);
        } catch (Exception e) {
            log.warn("Deep analysis of {} element {} failed: {}", reference, element.id(), e.getMessage());
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new Analysed(ElementAnalysis.failure(element.id(), reason), null);
        }
    }

    /**
     * Relevance of every analysed element weighted by its preliminary match score. Failed
     * elements count with relevance 0. Falls back to the plain mean when every weight is zero.
     */
    static double overallRelevance(List<CitationMatch> selected, List<ElementAnalysis> analyses) {
        if (analyses.isEmpty()) {
            return 0.0;
        }
        double weighted = 0.0;
        double weights = 0.0;
        double plain = 0.0;
        for (int i = 0; i < analyses.size(); i++) {
            double relevance = analyses.get(i).failed() ? 0.0 : analyses.get(i).relevance();
            double weight = selected.get(i).score() == null ? 0.0 : selected.get(i).score();
            weighted += weight * relevance;
            weights += weight;
            plain += relevance;
        }
        double overall = weights > 0 ? weighted / weights : plain / analyses.size();
        return Math.max(0.0, Math.min(1.0, overall));
    }
}
