package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.dto.ChangeSet;
import com.architecture.memory.traceback.model.SyncMetadata;
import com.architecture.memory.traceback.repository.SyncMetadataRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChangeDetectorTest {

    @Mock
    private SyncMetadataRepository syncMetadataRepository;

    @InjectMocks
    private ChangeDetector changeDetector;

    private static SyncMetadata stored(Set<String> ids) {
        return SyncMetadata.builder()
                .id("pharmacy_confluence_PH")
                .businessArea("pharmacy")
                .sourceId("confluence_PH")
                .lastSyncTimestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .documentIds(ids)
                .documentCount(ids.size())
                .build();
    }

    @Test
    void splitsCurrentIdsIntoAddedDeletedAndExisting() {
        when(syncMetadataRepository.findByBusinessAreaAndSourceId("pharmacy", "confluence_PH"))
                .thenReturn(Optional.of(stored(Set.of("a", "b", "c"))));

        ChangeSet changes = changeDetector.detectChanges("pharmacy", "confluence_PH", List.of("b", "c", "d", "e"));

        assertThat(changes.getAdded()).containsExactlyInAnyOrder("d", "e");
        assertThat(changes.getDeleted()).containsExactly("a");
        assertThat(changes.getExisting()).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void treatsEverythingAsAdded_onFirstSync() {
        when(syncMetadataRepository.findByBusinessAreaAndSourceId("pharmacy", "confluence_PH")).thenReturn(Optional.empty());

        ChangeSet changes = changeDetector.detectChanges("pharmacy", "confluence_PH", List.of("a", "b"));

        assertThat(changes.getAdded()).containsExactlyInAnyOrder("a", "b");
        assertThat(changes.getDeleted()).isEmpty();
        assertThat(changes.getExisting()).isEmpty();
        assertThat(changeDetector.getLastSyncTimestamp("pharmacy", "confluence_PH")).isEmpty();
    }

    @Test
    void createsSyncMetadata_whenNoneStored() {
        when(syncMetadataRepository.findByBusinessAreaAndSourceId("pharmacy", "confluence_PH")).thenReturn(Optional.empty());
        Instant now = Instant.parse("2026-03-01T10:00:00Z");

        changeDetector.updateSyncMetadata("pharmacy", "confluence_PH", List.of("a", "b", "a"), now);

        ArgumentCaptor<SyncMetadata> saved = ArgumentCaptor.forClass(SyncMetadata.class);
        verify(syncMetadataRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo("pharmacy_confluence_PH");
        assertThat(saved.getValue().getDocumentIds()).containsExactlyInAnyOrder("a", "b");
        assertThat(saved.getValue().getDocumentCount()).isEqualTo(2);
        assertThat(saved.getValue().getLastSyncTimestamp()).isEqualTo(now);
    }

    @Test
    void replacesStoredIds_onUpdate() {
        SyncMetadata existing = stored(Set.of("a", "b", "c"));
        when(syncMetadataRepository.findByBusinessAreaAndSourceId("pharmacy", "confluence_PH")).thenReturn(Optional.of(existing));

        changeDetector.updateSyncMetadata("pharmacy", "confluence_PH", List.of("c", "d"));

        verify(syncMetadataRepository).save(existing);
        assertThat(existing.getDocumentIds()).containsExactlyInAnyOrder("c", "d");
        assertThat(existing.getDocumentCount()).isEqualTo(2);
        assertThat(existing.getLastSyncTimestamp()).isAfter(Instant.parse("2026-01-01T00:00:00Z"));
    }
}
