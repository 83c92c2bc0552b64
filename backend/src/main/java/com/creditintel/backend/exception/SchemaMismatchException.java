package com.creditintel.backend.exception;

import java.util.List;
import java.util.stream.Stream;

public class SchemaMismatchException extends CreditIntelligenceException {

    private final List<String> missingFeatures;
    private final List<String> misorderedFeatures;

    public SchemaMismatchException(String issuerId, List<String> missingFeatures, List<String> misorderedFeatures) {
        super(ErrorKind.SCHEMA_MISMATCH, issuerId, describe(missingFeatures, misorderedFeatures),
                details(missingFeatures, misorderedFeatures));
        this.missingFeatures = List.copyOf(missingFeatures);
        this.misorderedFeatures = List.copyOf(misorderedFeatures);
    }

    public List<String> getMissingFeatures() {
        return missingFeatures;
    }

    public List<String> getMisorderedFeatures() {
        return misorderedFeatures;
    }

    private static String describe(List<String> missing, List<String> misordered) {
        StringBuilder message = new StringBuilder("Snapshot does not match model feature schema");
        if (!missing.isEmpty()) {
            message.append("; missing ").append(missing);
        }
        if (!misordered.isEmpty()) {
            message.append("; misordered ").append(misordered);
        }
        return message.toString();
    }

    private static List<String> details(List<String> missing, List<String> misordered) {
        return Stream.concat(
                missing.stream().map(name -> "missing:" + name),
                misordered.stream().map(name -> "misordered:" + name)).toList();
    }
}
