package com.nevis.citation.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeepAnalysisResultTest {

    @Test
    @DisplayName("Relevance just above 1 is rejected")
    void rejectsRelevanceAboveOne() {
        assertThatThrownBy(() -> new ElementAnalysis("E1", 1.0000005, "x", Set.of(), false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeepAnalysisResult(1.0000005, List.of(), List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Relevance of exactly 0 and 1 is accepted")
    void acceptsClosedInterval() {
        ElementAnalysis full = new ElementAnalysis("E1", 1.0, "x", Set.of(), false);
        DeepAnalysisResult result = new DeepAnalysisResult(0.0, List.of(full), List.of(), null);

        assertThat(result.overallRelevance()).isZero();
        assertThat(result.elementAnalysis().get(0).relevance()).isEqualTo(1.0);
    }
}
