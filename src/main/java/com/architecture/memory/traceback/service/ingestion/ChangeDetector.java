package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.dto.ChangeSet;
import com.architecture.memory.traceback.model.SyncMetadata;
import com.architecture.memory.traceback.repository.SyncMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks which documents each source delivered on its last sync.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeDetector {

    private final SyncMetadataRepository syncMetadataRepository;

    public Optional<Instant> getLastSyncTimestamp(String businessArea, String sourceId) {
        return syncMetadataRepository.findByBusinessAreaAndSourceId(businessArea, sourceId)
                .map(SyncMetadata::getLastSyncTimestamp);
    }

    public Set<String> getStoredDocumentIds(String businessArea, String sourceId) {
        return syncMetadataRepository.findByBusinessAreaAndSourceId(businessArea, sourceId)
                .map(metadata -> (Set<String>) new HashSet<>(metadata.getDocumentIds()))
                .orElseGet(HashSet::new);
    }

    public ChangeSet detectChanges(String businessArea, String sourceId, Collection<String> currentDocumentIds) {
        Set<String> stored = getStoredDocumentIds(businessArea, sourceId);
        Set<String> current = new HashSet<>(currentDocumentIds);

        Set<String> added = new HashSet<>(current);
        added.removeAll(stored);

        Set<String> deleted = new HashSet<>(stored);
        deleted.removeAll(current);

        Set<String> existing = new HashSet<>(current);
        existing.retainAll(stored);

        log.info("[change-detector] area={} source={} added={} deleted={} existing={}",
                businessArea, sourceId, added.size(), deleted.size(), existing.size());

        return ChangeSet.builder()
                .added(added)
                .deleted(deleted)
                .existing(existing)
                .build();
    }

    public void updateSyncMetadata(String businessArea, String sourceId, Collection<String> documentIds) {
        updateSyncMetadata(businessArea, sourceId, documentIds, Instant.now());
    }

    public void updateSyncMetadata(String businessArea, String sourceId, Collection<String> documentIds, Instant timestamp) {
        SyncMetadata metadata = syncMetadataRepository.findByBusinessAreaAndSourceId(businessArea, sourceId)
                .orElseGet(() -> SyncMetadata.builder()
                        .id(SyncMetadata.keyOf(businessArea, sourceId))
                        .businessArea(businessArea)
                        .sourceId(sourceId)
                        .build());

        metadata.setLastSyncTimestamp(timestamp);
        metadata.setDocumentIds(new HashSet<>(documentIds));
        metadata.setDocumentCount(metadata.getDocumentIds().size());
        syncMetadataRepository.save(metadata);

        log.info("[change-detector] Updated sync metadata area={} source={} documents={}",
                businessArea, sourceId, metadata.getDocumentCount());
    }
}
