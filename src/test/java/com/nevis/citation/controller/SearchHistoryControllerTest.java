package com.nevis.citation.controller;

import com.nevis.citation.CitationFixtures;
import com.nevis.citation.exception.TenantMismatchException;
import com.nevis.citation.service.SearchHistoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchHistoryController.class)
class SearchHistoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SearchHistoryService searchHistoryService;

    private final UUID searchId = UUID.randomUUID();

    @Test
    @DisplayName("DELETE search-histories/{id} returns 204")
    void delete_ShouldReturn204() throws Exception {
        mockMvc.perform(IdentityHeaders.as(delete("/search-histories/{id}", searchId)))
            .andExpect(status().isNoContent());

        verify(searchHistoryService).deleteSearch(CitationFixtures.CONTEXT, searchId);
    }

    @Test
    @DisplayName("DELETE search-histories/{id} returns 403 for another tenant's search")
    void delete_ShouldReturn403_WhenTenantMismatch() throws Exception {
        doThrow(new TenantMismatchException(searchId))
            .when(searchHistoryService).deleteSearch(CitationFixtures.CONTEXT, searchId);

        mockMvc.perform(IdentityHeaders.as(delete("/search-histories/{id}", searchId)))
            .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("POST workspace/invalidate scoped to one search")
    void invalidate_ShouldScopeToSearch() throws Exception {
        when(searchHistoryService.notifyWorkspaceChanged(CitationFixtures.CONTEXT, Optional.of(searchId))).thenReturn(3);

        mockMvc.perform(IdentityHeaders.as(post("/workspace/invalidate"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"search_history_id\": \"" + searchId + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invalidated").value(3));
    }

    @Test
    @DisplayName("POST workspace/invalidate without a body covers the whole project")
    void invalidate_ShouldCoverProjectWithoutBody() throws Exception {
        when(searchHistoryService.notifyWorkspaceChanged(CitationFixtures.CONTEXT, Optional.empty())).thenReturn(7);

        mockMvc.perform(IdentityHeaders.as(post("/workspace/invalidate")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invalidated").value(7));
    }
}
