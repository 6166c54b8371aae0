package org.carball.sascan.model.analysis;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public record AnalysisResult(
        List<MetricsRecord> units,
        int highComplexityThreshold
) {

    public AnalysisResult {
        units = units.stream()
                .sorted(Comparator.comparing(MetricsRecord::getUnitName))
                .toList();
    }

    public int totalIssues() {
        return units.stream().mapToInt(u -> u.getIssues().size()).sum();
    }

    public long unitsAboveThreshold() {
        return units.stream()
                .filter(u -> u.getCyclomaticComplexity() > highComplexityThreshold)
                .count();
    }

    public Optional<MetricsRecord> mostComplex() {
        return units.stream().max(Comparator.comparingInt(MetricsRecord::getCyclomaticComplexity));
    }

    public long countByRisk(MigrationRisk risk) {
        return units.stream()
                .filter(u -> u.getMigrationRisk(highComplexityThreshold) == risk)
                .count();
    }
}
