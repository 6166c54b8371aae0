package org.carball.sascan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.config.SasAnalyzerConfig;
import org.carball.sascan.config.ThresholdConfig;
import org.carball.sascan.model.analysis.AnalysisResult;
import org.carball.sascan.model.analysis.MetricsRecord;
import org.carball.sascan.model.source.SourceUnit;
import org.carball.sascan.parser.SasSourceScanner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class SasAnalyzer {

    private final SasAnalyzerConfig config;
    private final SasSourceScanner scanner;
    private final SasComplexityAnalyzer complexityAnalyzer;
    private final ThresholdConfig thresholds;

    public SasAnalyzer(SasAnalyzerConfig config) {
        this.config = config;

        this.thresholds = config.getThresholdConfig() != null ?
                config.getThresholdConfig() : ThresholdConfig.defaults();

        this.scanner = new SasSourceScanner(thresholds.getSourceExtension());
        this.complexityAnalyzer = new SasComplexityAnalyzer(thresholds);

        log.info("Initialized SasAnalyzer with config: {}", config);
        log.info("Using thresholds: {}", thresholds.getDescription());
    }

    public AnalysisResult analyze() throws IOException {
        log.info("Starting analysis of {}", config.getSourcePath());

        List<SourceUnit> units = scanner.scan(config.getSourcePath());
        if (units.isEmpty()) {
            log.warn("No {} files found under {}", thresholds.getSourceExtension(), config.getSourcePath());
        }

        List<MetricsRecord> records = new ArrayList<>();
        for (SourceUnit unit : units) {
            if (config.isVerbose()) {
                System.out.println("  - Analyzing " + unit.name());
            }
            records.add(complexityAnalyzer.analyze(unit));
        }

        AnalysisResult result = new AnalysisResult(records, thresholds.getHighComplexityThreshold());
        log.info("Analysis complete. {} units analyzed, {} above complexity threshold, {} issues",
                result.units().size(), result.unitsAboveThreshold(), result.totalIssues());

        return result;
    }

    public ThresholdConfig getThresholds() {
        return thresholds;
    }
}
