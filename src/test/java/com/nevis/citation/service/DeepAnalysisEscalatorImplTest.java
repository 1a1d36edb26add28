package com.nevis.citation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.citation.CitationFixtures;
import com.nevis.citation.exception.AnalysisUnavailableException;
import com.nevis.citation.exception.InvalidElementException;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.ElementAnalysis;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeepAnalysisEscalatorImplTest {

    @Mock
    private ChatModel chatModel;

    private DeepAnalysisEscalatorImpl escalator;

    private final Claim claim = CitationFixtures.claim(UUID.randomUUID());

    private final List<CitationMatch> topMatches = List.of(
        CitationFixtures.match("US1", "E1", 1, 0.6),
        CitationFixtures.match("US1", "E2", 2, 0.9),
        CitationFixtures.match("US1", "E3", 3, 0.1)
    );

    @BeforeEach
    void setUp() {
        escalator = new DeepAnalysisEscalatorImpl(
            chatModel,
            (key, permits) -> { },
            new ModelResponseParser(new ObjectMapper()),
            CitationFixtures.properties()
        );
    }

    private static String verdict(double relevance, String finding) {
        return """
            {"relevance": %s, "explanation": "explained", "matched_concepts": ["coil"],
             "key_findings": ["%s", "shared finding"], "recommendation": "narrow the claim"}
            """.formatted(relevance, finding);
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Drops low scores, ranks the rest and applies the limit")
        void selectsEligibleMatches() {
            List<CitationMatch> selected = escalator.select(topMatches, 5);

            assertThat(selected).extracting(CitationMatch::elementId).containsExactly("E2", "E1");
        }

        @Test
        @DisplayName("Limit of one escalates only the best match")
        void limitOne() {
            when(chatModel.chat(anyString())).thenReturn(verdict(0.8, "coil disclosed"));

            DeepAnalysisResult result = escalator.escalate(claim, "US1", topMatches, 1);

            assertThat(result.elementAnalysis()).hasSize(1);
            assertThat(result.elementAnalysis().get(0).elementId()).isEqualTo("E2");
            verify(chatModel, times(1)).chat(anyString());
        }

        @Test
        @DisplayName("Nothing above the minimum score means nothing to analyse")
        void noEligibleMatch() {
            List<CitationMatch> weak = List.of(CitationFixtures.match("US1", "E1", 1, 0.1));

            assertThatThrownBy(() -> escalator.escalate(claim, "US1", weak, 5))
                .isInstanceOf(AnalysisUnavailableException.class);

            verifyNoInteractions(chatModel);
        }

        @Test
        @DisplayName("Match for an element outside the claim is rejected")
        void foreignElementRejected() {
            List<CitationMatch> foreign = List.of(CitationFixtures.match("US1", "E99", 99, 0.9));

            assertThatThrownBy(() -> escalator.escalate(claim, "US1", foreign, 5))
                .isInstanceOf(InvalidElementException.class)
                .hasMessageContaining("E99");

            verifyNoInteractions(chatModel);
        }
    }

    @Nested
    @DisplayName("Analysis")
    class Analysis {

        @Test
        @DisplayName("Weights element relevance by match score and merges findings in order")
        void aggregatesElements() {
            when(chatModel.chat(anyString())).thenAnswer(inv -> {
                String prompt = inv.getArgument(0);
                return prompt.contains("Claim element E2:") ? verdict(1.0, "controller disclosed") : verdict(0.0, "coil absent");
            });

            DeepAnalysisResult result = escalator.escalate(claim, "US1", topMatches, 5);

            // (0.9 * 1.0 + 0.6 * 0.0) / (0.9 + 0.6)
            assertThat(result.overallRelevance()).isCloseTo(0.6, within(1e-9));
            assertThat(result.elementAnalysis()).extracting(ElementAnalysis::elementId).containsExactly("E2", "E1");
            assertThat(result.elementAnalysis().get(0).matchedConcepts()).isEqualTo(Set.of("coil"));
            assertThat(result.keyFindings()).containsExactly("controller disclosed", "shared finding", "coil absent");
            assertThat(result.recommendations()).containsExactly("narrow the claim");
        }

        @Test
        @DisplayName("A failing element is marked failed with zero relevance")
        void failedElementRecorded() {
            when(chatModel.chat(anyString())).thenAnswer(inv -> {
                String prompt = inv.getArgument(0);
                if (prompt.contains("Claim element E1:")) {
                    throw new RuntimeException("quota exceeded");
                }
                return verdict(0.8, "controller disclosed");
            });

            DeepAnalysisResult result = escalator.escalate(claim, "US1", topMatches, 5);

            ElementAnalysis failed = result.elementAnalysis().get(1);
            assertThat(failed.elementId()).isEqualTo("E1");
            assertThat(failed.failed()).isTrue();
            assertThat(failed.relevance()).isZero();
            assertThat(failed.explanation()).isEqualTo("Analysis failed: quota exceeded");
            // (0.9 * 0.8 + 0.6 * 0.0) / (0.9 + 0.6)
            assertThat(result.overallRelevance()).isCloseTo(0.48, within(1e-9));
        }

        @Test
        @DisplayName("Every element failing makes the analysis unavailable")
        void allElementsFail() {
            when(chatModel.chat(anyString())).thenReturn("not json");

            assertThatThrownBy(() -> escalator.escalate(claim, "US1", topMatches, 5))
                .isInstanceOf(AnalysisUnavailableException.class)
                .hasMessageContaining("US1");
        }
    }

    @Test
    @DisplayName("Zero weights fall back to the plain mean")
    void zeroWeightsUseMean() {
        List<CitationMatch> unscored = List.of(
            CitationFixtures.match("US1", "E1", 1, 0.0),
            CitationFixtures.match("US1", "E2", 2, 0.0)
        );
        List<ElementAnalysis> analyses = List.of(
            new ElementAnalysis("E1", 0.2, "x", Set.of(), false),
            new ElementAnalysis("E2", 0.6, "y", Set.of(), false)
        );

        assertThat(DeepAnalysisEscalatorImpl.overallRelevance(unscored, analyses)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("Failed elements keep their weight and count as zero relevance")
    void failedElementsWeighInOverall() {
        List<CitationMatch> selected = List.of(
            CitationFixtures.match("US1", "E1", 1, 0.9),
            CitationFixtures.match("US1", "E2", 2, 0.5)
        );
        List<ElementAnalysis> analyses = List.of(
            new ElementAnalysis("E1", 0.8, "x", Set.of(), false),
            ElementAnalysis.failure("E2", "timeout")
        );

        assertThat(DeepAnalysisEscalatorImpl.overallRelevance(selected, analyses))
            .isCloseTo(0.9 * 0.8 / 1.4, within(1e-9));
    }

    @Test
    @DisplayName("Zero weights average failed elements in as zero")
    void zeroWeightsCountFailures() {
        List<CitationMatch> unscored = List.of(
            CitationFixtures.match("US1", "E1", 1, 0.0),
            CitationFixtures.match("US1", "E2", 2, 0.0)
        );
        List<ElementAnalysis> analyses = List.of(
            new ElementAnalysis("E1", 0.6, "x", Set.of(), false),
            ElementAnalysis.failure("E2", "timeout")
        );

        assertThat(DeepAnalysisEscalatorImpl.overallRelevance(unscored, analyses)).isCloseTo(0.3, within(1e-9));
    }
}
