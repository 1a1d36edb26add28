package com.nevis.citation.repository;

import com.nevis.citation.model.SearchHistory;

import java.util.Optional;
import java.util.UUID;

public interface SearchHistoryRepository {
    SearchHistory save(SearchHistory searchHistory);
    Optional<SearchHistory> findById(UUID id);
    boolean markInvalidated(UUID id);
}
