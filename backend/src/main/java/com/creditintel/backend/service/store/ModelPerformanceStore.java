package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.ModelPerformanceEntry;

import java.util.List;

public interface ModelPerformanceStore {

    void record(ModelPerformanceEntry entry);

    /**
     * Most recent entries first.
     */
    List<ModelPerformanceEntry> recent(int limit);
}
