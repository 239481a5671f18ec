package com.architecture.memory.traceback.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Last ingestion state of one source in one business area.
 */
@Document(collection = "sync_metadata")
@CompoundIndex(name = "area_source_idx", def = "{'businessArea': 1, 'sourceId': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncMetadata {

    @Id
    private String id;

    private String businessArea;
    private String sourceId;
    private Instant lastSyncTimestamp;

    @Builder.Default
    private Set<String> documentIds = new HashSet<>();

    private int documentCount;

    public static String keyOf(String businessArea, String sourceId) {
        return businessArea + "_" + sourceId;
    }
}
