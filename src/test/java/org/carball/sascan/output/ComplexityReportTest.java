package org.carball.sascan.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.sascan.analyzer.SasComplexityAnalyzer;
import org.carball.sascan.model.analysis.AnalysisResult;
import org.carball.sascan.model.analysis.MetricsRecord;
import org.carball.sascan.model.source.SourceUnit;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

public class ComplexityReportTest {

    private static final LocalDateTime GENERATED = LocalDateTime.of(2024, 3, 1, 9, 30);

    private final SasComplexityAnalyzer analyzer = new SasComplexityAnalyzer();

    @Test
    public void shouldRenderNoIssuesMarkerForCleanUnit() {
        MetricsRecord clean = analyzer.analyze(SourceUnit.of("clean.sas", "if a then b = 1;"));

        String markdown = new ComplexityReport(new AnalysisResult(List.of(clean), 10), GENERATED).toMarkdown();

        assertThat(markdown).contains("## clean.sas");
        assertThat(markdown).contains("- **Cyclomatic Complexity:** 2");
        assertThat(markdown).contains("| Conditionals | 1 |");
        assertThat(markdown).contains(ComplexityReport.NO_ISSUES_MARKER);
        assertThat(markdown).contains("**Generated:** 2024-03-01T09:30:00");
    }

    @Test
    public void shouldListIssuesForFlaggedUnit() {
        String source = "%macro wide(a, b, c, d, e);\n" + IntStream.rangeClosed(1, 11)
                .mapToObj(i -> "if x = " + i + " then y = 1;")
                .collect(Collectors.joining("\n"));
        MetricsRecord flagged = analyzer.analyze(SourceUnit.of("flagged.sas", source));

        String markdown = ComplexityReport.renderUnit(flagged, 10);

        assertThat(markdown).doesNotContain(ComplexityReport.NO_ISSUES_MARKER);
        assertThat(markdown).contains("- **Excess macro parameters:** Macro 'wide' declares 5 parameters (limit 3)");
        assertThat(markdown).contains("- **High complexity:** Cyclomatic complexity 12 exceeds threshold 10");
        assertThat(markdown).contains("HIGH");
    }

    @Test
    public void shouldSummarizeBatch() {
        MetricsRecord simple = analyzer.analyze(SourceUnit.of("b.sas", "x = 1;"));
        MetricsRecord branchy = analyzer.analyze(SourceUnit.of("a.sas", IntStream.rangeClosed(1, 12)
                .mapToObj(i -> "if x = " + i + " then y = 1;")
                .collect(Collectors.joining("\n"))));

        String markdown = new ComplexityReport(new AnalysisResult(List.of(simple, branchy), 10), GENERATED)
                .toMarkdown();

        assertThat(markdown).contains("| Files Analyzed | 2 |");
        assertThat(markdown).contains("| Files Above Threshold | 1 |");
        assertThat(markdown).contains("| Highest Complexity | 13 (`a.sas`) |");
        // Units are ordered by name
        assertThat(markdown.indexOf("## a.sas")).isLessThan(markdown.indexOf("## b.sas"));
    }

    @Test
    public void shouldRenderEmptyBatch() {
        String markdown = new ComplexityReport(new AnalysisResult(List.of(), 10), GENERATED).toMarkdown();

        assertThat(markdown).contains("| Files Analyzed | 0 |");
        assertThat(markdown).contains("**No source files were analyzed.**");
    }

    @Test
    public void shouldRenderJsonWithIssueCodes() throws Exception {
        MetricsRecord record = analyzer.analyze(SourceUnit.of("macro.sas", "%macro m(a, b, c, d);"));

        String json = new ComplexityReport(new AnalysisResult(List.of(record), 10), GENERATED).toJson();
        JsonNode root = new ObjectMapper().readTree(json);

        assertThat(root.at("/metadata/timestamp").asText()).isEqualTo("2024-03-01T09:30:00");
        assertThat(root.at("/metadata/totalUnitsAnalyzed").asInt()).isEqualTo(1);
        JsonNode unit = root.at("/units/0");
        assertThat(unit.at("/metrics/unitName").asText()).isEqualTo("macro.sas");
        assertThat(unit.at("/metrics/macroDefinitions").asInt()).isEqualTo(1);
        assertThat(unit.at("/metrics/cyclomaticComplexity").asInt()).isEqualTo(1);
        assertThat(unit.at("/metrics/issues/0/kind").asText()).isEqualTo("excess-macro-parameters");
        assertThat(unit.at("/migrationRisk").asText()).isEqualTo("LOW");
        assertThat(unit.at("/metrics/frozen").isMissingNode()).isTrue();
    }
}
