package com.creditintel.backend.service.model;

import com.creditintel.backend.exception.SchemaMismatchException;
import com.creditintel.backend.pipeline.FeatureSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a snapshot carries every feature of a model schema in schema order before any
 * arithmetic touches it.
 */
public final class SchemaGuard {

    private SchemaGuard() {
    }

    public static void check(FeatureSnapshot snapshot, List<String> schema) {
        List<String> missing = new ArrayList<>();
        for (String feature : schema) {
            if (!snapshot.hasFeature(feature)) {
                missing.add(feature);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(snapshot.issuerId(), missing, List.of());
        }
        List<String> restricted = snapshot.featureNames().stream().filter(schema::contains).toList();
        if (!restricted.equals(schema)) {
            List<String> misordered = new ArrayList<>();
            for (int i = 0; i < schema.size(); i++) {
                if (i >= restricted.size() || !schema.get(i).equals(restricted.get(i))) {
                    misordered.add(schema.get(i));
                }
            }
            throw new SchemaMismatchException(snapshot.issuerId(), List.of(), misordered);
        }
    }

    /**
     * Feature values in schema order, after {@link #check}.
     */
    public static double[] vector(FeatureSnapshot snapshot, List<String> schema) {
        check(snapshot, schema);
        double[] x = new double[schema.size()];
        for (int i = 0; i < schema.size(); i++) {
            x[i] = snapshot.value(schema.get(i));
        }
        return x;
    }
}
