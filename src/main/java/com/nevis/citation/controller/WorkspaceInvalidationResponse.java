package com.nevis.citation.controller;

public record WorkspaceInvalidationResponse(int invalidated) {}
