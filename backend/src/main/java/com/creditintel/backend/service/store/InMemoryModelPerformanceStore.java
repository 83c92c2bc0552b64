package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.ModelPerformanceEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryModelPerformanceStore implements ModelPerformanceStore {

    private final List<ModelPerformanceEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void record(ModelPerformanceEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<ModelPerformanceEntry> recent(int limit) {
        List<ModelPerformanceEntry> copy = new ArrayList<>(entries);
        List<ModelPerformanceEntry> result = new ArrayList<>();
        for (int i = copy.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(copy.get(i));
        }
        return result;
    }
}
