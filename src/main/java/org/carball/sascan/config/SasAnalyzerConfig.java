package org.carball.sascan.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class SasAnalyzerConfig {
    private Path sourcePath;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
    private ThresholdConfig thresholdConfig;
}
