package com.nevis.citation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.citation")
public record CitationProperties(
    @NotNull @Valid Matcher matcher,
    @NotNull @Valid Job job,
    @NotNull @Valid DeepAnalysis deepAnalysis,
    @NotNull @Valid Combined combined
) {

    public record Matcher(
        @Min(1) @Max(20) int candidatePassages,
        @Min(200) int chunkSize,
        @Min(0) int chunkOverlap,
        @Min(100) int maxPassageChars
    ) {}

    public record Job(
        @NotNull Duration processingTimeout,
        @NotNull Duration pendingRedispatchAfter,
        @NotNull Duration awaitPollInterval,
        @NotNull Duration maxAwait
    ) {}

    public record DeepAnalysis(
        @DecimalMin("0.0") @DecimalMax("1.0") double minScore,
        @Min(1) @Max(50) int defaultLimit
    ) {}

    public record Combined(
        @DecimalMin("0.0") @DecimalMax("1.0") double coverageThreshold
    ) {}
}
