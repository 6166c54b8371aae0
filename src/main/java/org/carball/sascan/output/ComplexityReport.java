package org.carball.sascan.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.model.analysis.AnalysisResult;
import org.carball.sascan.model.analysis.Issue;
import org.carball.sascan.model.analysis.MetricsRecord;
import org.carball.sascan.model.analysis.MigrationRisk;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class ComplexityReport {

    static final String NO_ISSUES_MARKER = "No issues found.";

    private final AnalysisResult analysisResult;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ComplexityReport(AnalysisResult analysisResult) {
        this(analysisResult, LocalDateTime.now());
    }

    public ComplexityReport(AnalysisResult analysisResult, LocalDateTime timestamp) {
        this.analysisResult = analysisResult;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        int threshold = analysisResult.highComplexityThreshold();

        // Header
        md.append("# SAS Complexity Analysis Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Complexity Threshold:** ").append(threshold).append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Files Analyzed | ").append(analysisResult.units().size()).append(" |\n");
        md.append("| Files Above Threshold | ").append(analysisResult.unitsAboveThreshold()).append(" |\n");
        md.append("| Total Issues | ").append(analysisResult.totalIssues()).append(" |\n");
        analysisResult.mostComplex().ifPresent(top ->
                md.append("| Highest Complexity | ").append(top.getCyclomaticComplexity())
                        .append(" (`").append(top.getUnitName()).append("`) |\n"));
        md.append("\n");

        md.append("### Migration Risk\n\n");
        md.append("| Risk | Files | Guidance |\n");
        md.append("|------|-------|----------|\n");
        for (MigrationRisk risk : MigrationRisk.values()) {
            md.append("| ").append(risk.getMarker()).append(" **").append(risk).append("** | ")
                    .append(analysisResult.countByRisk(risk)).append(" | ")
                    .append(risk.getDescription()).append(" |\n");
        }
        md.append("\n");

        if (analysisResult.units().isEmpty()) {
            md.append("**No source files were analyzed.**\n\n");
        }

        for (MetricsRecord unit : analysisResult.units()) {
            md.append(renderUnit(unit, threshold));
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by SAS Complexity Analyzer*\n");

        return md.toString();
    }

    /**
     * Markdown section for a single unit; always ends with either its issues or the no-issues marker.
     */
    public static String renderUnit(MetricsRecord unit, int highComplexityThreshold) {
        StringBuilder md = new StringBuilder();
        MigrationRisk risk = unit.getMigrationRisk(highComplexityThreshold);

        md.append("## ").append(unit.getUnitName()).append("\n\n");
        md.append("- **Cyclomatic Complexity:** ").append(unit.getCyclomaticComplexity()).append("\n");
        md.append("- **Migration Risk:** ").append(risk.getMarker()).append(" ").append(risk).append("\n\n");

        md.append("| Metric | Count |\n");
        md.append("|--------|-------|\n");
        appendRow(md, "DATA Steps", unit.getDataSteps());
        appendRow(md, "PROC Steps", unit.getProcSteps());
        appendRow(md, "Macro Definitions", unit.getMacroDefinitions());
        appendRow(md, "Macro Calls", unit.getMacroCalls());
        appendRow(md, "Conditionals", unit.getConditionals());
        appendRow(md, "Loops", unit.getLoops());
        appendRow(md, "Merge Operations", unit.getDataMerges());
        appendRow(md, "PROC SQL Blocks", unit.getQueryBlocks());
        appendRow(md, "Max Nesting Depth", unit.getMaxNestingDepth());
        md.append("\n");

        md.append("### Issues\n\n");
        if (unit.getIssues().isEmpty()) {
            md.append(NO_ISSUES_MARKER).append("\n\n");
        } else {
            for (Issue issue : unit.getIssues()) {
                md.append("- **").append(issue.kind().getDisplayName()).append(":** ")
                        .append(issue.message()).append("\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private static void appendRow(StringBuilder md, String label, int value) {
        md.append("| ").append(label).append(" | ").append(value).append(" |\n");
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        int threshold = analysisResult.highComplexityThreshold();

        report.setMetadata(new ReportMetadata(
                timestamp,
                threshold,
                analysisResult.units().size(),
                analysisResult.totalIssues()
        ));

        List<UnitReport> units = analysisResult.units().stream()
                .map(unit -> {
                    UnitReport ur = new UnitReport();
                    ur.setMetrics(unit);
                    ur.setMigrationRisk(unit.getMigrationRisk(threshold));
                    return ur;
                })
                .collect(Collectors.toList());
        report.setUnits(units);

        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private List<UnitReport> units;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private int highComplexityThreshold;
        private int totalUnitsAnalyzed;
        private int totalIssues;
    }

    @lombok.Data
    private static class UnitReport {
        private MetricsRecord metrics;
        private MigrationRisk migrationRisk;
    }
}
