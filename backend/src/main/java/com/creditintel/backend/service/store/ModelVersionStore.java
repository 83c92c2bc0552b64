package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.ModelVersion;

import java.util.List;

/**
 * Durable copy of the model registry. Saving a version that already exists replaces it.
 */
public interface ModelVersionStore {

    void save(ModelVersion version);

    /**
     * Every stored version, ordered by version id.
     */
    List<ModelVersion> findAll();
}
