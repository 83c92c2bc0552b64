package com.creditintel.backend.pipeline;

import java.util.List;

/**
 * Non-fatal: the snapshot behind a score was built mostly from imputed values.
 */
public record LowCoverageWarning(
        String issuerId,
        long snapshotVersion,
        double imputedFraction,
        List<String> imputedFeatures
) {

    public static LowCoverageWarning of(FeatureSnapshot snapshot) {
        return new LowCoverageWarning(snapshot.issuerId(), snapshot.snapshotVersion(), snapshot.imputedFraction(),
                snapshot.imputedFeatures());
    }
}
