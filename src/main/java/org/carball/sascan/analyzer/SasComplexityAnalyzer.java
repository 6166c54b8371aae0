package org.carball.sascan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.config.ThresholdConfig;
import org.carball.sascan.model.analysis.MetricsRecord;
import org.carball.sascan.model.construct.ClassifiedConstruct;
import org.carball.sascan.model.source.SourceUnit;

/**
 * Computes structural metrics for one SAS source unit.
 * <p>
 * Each call to {@link #analyze(SourceUnit)} builds its own record, nesting tracker and aggregator;
 * the instance itself only holds thresholds, so it can be shared across units and threads.
 */
@Slf4j
public class SasComplexityAnalyzer {

    private final ConstructClassifier classifier = new ConstructClassifier();
    private final int maxMacroParameters;
    private final int highComplexityThreshold;

    public SasComplexityAnalyzer() {
        this(ThresholdConfig.defaults());
    }

    public SasComplexityAnalyzer(ThresholdConfig thresholds) {
        this.maxMacroParameters = thresholds.getMaxMacroParameters();
        this.highComplexityThreshold = thresholds.getHighComplexityThreshold();
    }

    public MetricsRecord analyze(SourceUnit unit) {
        MetricsRecord record = new MetricsRecord(unit.name());
        NestingTracker tracker = new NestingTracker();
        MetricsAggregator aggregator = new MetricsAggregator(record, maxMacroParameters);

        for (ClassifiedConstruct construct : classifier.classify(unit.text(), tracker)) {
            aggregator.accept(construct);
        }

        new ComplexityCalculator(highComplexityThreshold).finish(record, tracker.getMaxDepth());

        log.debug("Analyzed {}: complexity={}, conditionals={}, loops={}, maxDepth={}, issues={}",
                unit.name(), record.getCyclomaticComplexity(), record.getConditionals(), record.getLoops(),
                record.getMaxNestingDepth(), record.getIssues().size());

        return record;
    }
}
