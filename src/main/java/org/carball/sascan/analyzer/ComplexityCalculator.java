package org.carball.sascan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.model.analysis.Issue;
import org.carball.sascan.model.analysis.MetricsRecord;

/**
 * Final step of a unit's analysis: derives the McCabe score, raises the high-complexity issue and
 * freezes the record.
 */
@Slf4j
public class ComplexityCalculator {

    private final int highComplexityThreshold;

    public ComplexityCalculator(int highComplexityThreshold) {
        this.highComplexityThreshold = highComplexityThreshold;
    }

    public static int cyclomaticComplexity(int conditionals, int loops) {
        return conditionals + loops + 1;
    }

    public MetricsRecord finish(MetricsRecord record, int maxNestingDepth) {
        int complexity = cyclomaticComplexity(record.getConditionals(), record.getLoops());

        record.setCyclomaticComplexity(complexity);
        record.setMaxNestingDepth(maxNestingDepth);

        if (complexity > highComplexityThreshold) {
            log.debug("{} exceeds complexity threshold: {} > {}",
                    record.getUnitName(), complexity, highComplexityThreshold);
            record.addIssue(Issue.highComplexity(complexity, highComplexityThreshold));
        }

        record.freeze();
        return record;
    }
}
