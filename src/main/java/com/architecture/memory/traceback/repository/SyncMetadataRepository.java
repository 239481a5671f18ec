package com.architecture.memory.traceback.repository;

import com.architecture.memory.traceback.model.SyncMetadata;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncMetadataRepository extends MongoRepository<SyncMetadata, String> {

    Optional<SyncMetadata> findByBusinessAreaAndSourceId(String businessArea, String sourceId);

    List<SyncMetadata> findByBusinessArea(String businessArea);
}
