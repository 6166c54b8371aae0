package org.carball.sascan.model.analysis;

import lombok.Getter;

@Getter
public enum MigrationRisk {
    LOW("🟢", "Straightforward to migrate"),
    MEDIUM("🟡", "Review branching before migrating"),
    HIGH("🔴", "Refactor or split before migrating");

    private final String marker;
    private final String description;

    MigrationRisk(String marker, String description) {
        this.marker = marker;
        this.description = description;
    }

    /**
     * Bands a complexity score against the high-complexity threshold: above the threshold is HIGH,
     * above half of it is MEDIUM.
     */
    public static MigrationRisk fromComplexity(int complexity, int highComplexityThreshold) {
        if (complexity > highComplexityThreshold) {
            return HIGH;
        } else if (complexity > highComplexityThreshold / 2) {
            return MEDIUM;
        } else {
            return LOW;
        }
    }
}
