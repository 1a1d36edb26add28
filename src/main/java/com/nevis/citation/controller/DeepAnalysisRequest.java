package com.nevis.citation.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record DeepAnalysisRequest(
    @NotBlank
    String reference,

    @Min(1) @Max(50)
    Integer limit
) {}
