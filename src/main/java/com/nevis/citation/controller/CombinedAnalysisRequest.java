package com.nevis.citation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CombinedAnalysisRequest(
    @NotBlank
    @JsonProperty("claim1_text")
    String claim1Text,

    @NotEmpty
    @JsonProperty("reference_numbers")
    List<@NotBlank String> referenceNumbers
) {}
