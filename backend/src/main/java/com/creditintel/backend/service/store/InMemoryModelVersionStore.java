package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.ModelVersion;

import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryModelVersionStore implements ModelVersionStore {

    private final ConcurrentSkipListMap<Long, ModelVersion> versions = new ConcurrentSkipListMap<>();

    @Override
    public void save(ModelVersion version) {
        versions.put(version.versionId(), version);
    }

    @Override
    public List<ModelVersion> findAll() {
        return List.copyOf(versions.values());
    }
}
