package com.nevis.citation.service;

import com.nevis.citation.CitationFixtures;
import com.nevis.citation.cache.ArtifactKind;
import com.nevis.citation.cache.CacheKey;
import com.nevis.citation.cache.ResultCache;
import com.nevis.citation.exception.EntityNotFoundException;
import com.nevis.citation.exception.TenantMismatchException;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobErrorCode;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.repository.SearchHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchHistoryServiceImplTest {

    @Mock
    private SearchHistoryRepository searchHistoryRepository;
    @Mock
    private CitationJobRepository jobRepository;

    private ResultCache resultCache;
    private SearchHistoryServiceImpl service;

    private final UUID searchId = UUID.randomUUID();
    private final SearchHistory search = CitationFixtures.search(searchId);

    @BeforeEach
    void setUp() {
        resultCache = new ResultCache(Duration.ofMinutes(5), 100);
        service = new SearchHistoryServiceImpl(searchHistoryRepository, jobRepository, resultCache);
    }

    @Nested
    @DisplayName("Access")
    class Access {

        @Test
        @DisplayName("Owner of the search gets it back")
        void ownerAllowed() {
            when(searchHistoryRepository.findById(searchId)).thenReturn(Optional.of(search));

            assertThat(service.requireSearch(CitationFixtures.CONTEXT, searchId)).isEqualTo(search);
        }

        @Test
        @DisplayName("Another tenant is refused")
        void otherTenantRefused() {
            when(searchHistoryRepository.findById(searchId)).thenReturn(Optional.of(search));
            RequestContext intruder = new RequestContext("tenant-2", "project-1", "user-9");

            assertThatThrownBy(() -> service.requireSearch(intruder, searchId))
                .isInstanceOf(TenantMismatchException.class);
        }

        @Test
        @DisplayName("Another project of the same tenant is refused")
        void otherProjectRefused() {
            when(searchHistoryRepository.findById(searchId)).thenReturn(Optional.of(search));
            RequestContext otherProject = new RequestContext("tenant-1", "project-2", "user-1");

            assertThatThrownBy(() -> service.requireSearch(otherProject, searchId))
                .isInstanceOf(TenantMismatchException.class);
        }

        @Test
        @DisplayName("Deleted search looks like a missing one")
        void deletedSearchNotFound() {
            SearchHistory deleted = new SearchHistory(searchId, "tenant-1", "project-1", "q",
                OffsetDateTime.now(), OffsetDateTime.now());
            when(searchHistoryRepository.findById(searchId)).thenReturn(Optional.of(deleted));

            assertThatThrownBy(() -> service.requireSearch(CitationFixtures.CONTEXT, searchId))
                .isInstanceOf(EntityNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("Deleting a search fails its in-flight jobs and drops its cached artifacts")
        void deleteSearch() {
            when(searchHistoryRepository.findById(searchId)).thenReturn(Optional.of(search));
            when(jobRepository.failInFlightForSearch(any(), any())).thenReturn(2);
            resultCache.set(CacheKey.of(search, ArtifactKind.TOP_MATCHES, "all@10"), "top");

            service.deleteSearch(CitationFixtures.CONTEXT, searchId);

            verify(searchHistoryRepository).markInvalidated(searchId);
            verify(jobRepository).failInFlightForSearch(searchId,
                new JobError(JobErrorCode.SEARCH_DELETED, "Search session deleted"));
            assertThat(resultCache.size()).isZero();
        }

        @Test
        @DisplayName("Workspace change for one search leaves other searches cached")
        void workspaceChangeForSearch() {
            SearchHistory other = CitationFixtures.search(UUID.randomUUID());
            when(searchHistoryRepository.findById(searchId)).thenReturn(Optional.of(search));
            resultCache.set(CacheKey.of(search, ArtifactKind.MATCHES, "a"), "a");
            resultCache.set(CacheKey.of(search, ArtifactKind.CONSOLIDATED, null), "b");
            resultCache.set(CacheKey.of(other, ArtifactKind.MATCHES, "a"), "c");

            int removed = service.notifyWorkspaceChanged(CitationFixtures.CONTEXT, Optional.of(searchId));

            assertThat(removed).isEqualTo(2);
            assertThat(resultCache.get(CacheKey.of(other, ArtifactKind.MATCHES, "a"), Object.class)).isPresent();
        }

        @Test
        @DisplayName("Workspace change without a search drops the whole project")
        void workspaceChangeForProject() {
            SearchHistory other = CitationFixtures.search(UUID.randomUUID());
            resultCache.set(CacheKey.of(search, ArtifactKind.MATCHES, "a"), "a");
            resultCache.set(CacheKey.of(other, ArtifactKind.MATCHES, "a"), "c");

            int removed = service.notifyWorkspaceChanged(CitationFixtures.CONTEXT, Optional.empty());

            assertThat(removed).isEqualTo(2);
            verify(searchHistoryRepository, never()).findById(any());
        }

        @Test
        @DisplayName("Artifact invalidation for an unknown search is a no-op")
        void invalidateUnknownSearch() {
            when(searchHistoryRepository.findById(searchId)).thenReturn(Optional.empty());
            resultCache.set(CacheKey.of(search, ArtifactKind.MATCHES, "a"), "a");

            service.invalidateArtifacts(searchId);

            assertThat(resultCache.size()).isEqualTo(1);
        }
    }
}
