package com.creditintel.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;
import java.util.TreeMap;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IngestionReport {

    private final String issuerId;
    private int accepted;
    private int revised;
    private int duplicates;
    private int rejected;
    private int rawDocuments;
    private int failedAdapters;
    private final Map<String, Integer> rejectionReasons = new TreeMap<>();

    public void recordRejection(String reason) {
        rejected++;
        rejectionReasons.merge(reason, 1, Integer::sum);
    }

    public void merge(IngestionReport other) {
        accepted += other.accepted;
        revised += other.revised;
        duplicates += other.duplicates;
        rawDocuments += other.rawDocuments;
        failedAdapters += other.failedAdapters;
        rejected += other.rejected;
        other.rejectionReasons.forEach((reason, count) -> rejectionReasons.merge(reason, count, Integer::sum));
    }

    public int stored() {
        return accepted + revised;
    }
}
