package com.nevis.citation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CitationJobRequest(
    @NotBlank
    String reference,

    @JsonProperty("element_ids")
    List<@NotBlank String> elementIds
) {}
