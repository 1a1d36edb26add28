package com.nevis.citation.controller;

import com.nevis.citation.model.RequestContext;
import com.nevis.citation.service.SearchHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class SearchHistoryController {

    private final SearchHistoryService searchHistoryService;

    @DeleteMapping("/search-histories/{searchHistoryId}")
    public ResponseEntity<Void> deleteSearch(RequestContext context, @PathVariable UUID searchHistoryId) {
        searchHistoryService.deleteSearch(context, searchHistoryId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/workspace/invalidate")
    public ResponseEntity<WorkspaceInvalidationResponse> invalidateWorkspace(
        RequestContext context,
        @RequestBody(required = false) WorkspaceInvalidationRequest request) {

        Optional<UUID> searchHistoryId = Optional.ofNullable(request).map(WorkspaceInvalidationRequest::searchHistoryId);
        int removed = searchHistoryService.notifyWorkspaceChanged(context, searchHistoryId);
        return ResponseEntity.ok(new WorkspaceInvalidationResponse(removed));
    }
}
