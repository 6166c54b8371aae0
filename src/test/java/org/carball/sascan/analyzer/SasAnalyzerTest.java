package org.carball.sascan.analyzer;

import org.carball.sascan.config.SasAnalyzerConfig;
import org.carball.sascan.config.ThresholdConfig;
import org.carball.sascan.model.analysis.AnalysisResult;
import org.carball.sascan.model.analysis.IssueKind;
import org.carball.sascan.model.analysis.MetricsRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SasAnalyzerTest {

    @Test
    public void shouldAnalyzeSampleProgramDirectory() throws Exception {
        Path programs = Paths.get(getClass().getResource("/programs").toURI());

        AnalysisResult result = new SasAnalyzer(configFor(programs)).analyze();

        // README.txt is skipped by the extension filter
        assertThat(result.units()).hasSize(1);
        MetricsRecord claims = result.units().get(0);
        assertThat(claims.getUnitName()).endsWith("claims_load.sas");
        assertThat(claims.getDataSteps()).isEqualTo(2);
        assertThat(claims.getProcSteps()).isEqualTo(2);
        assertThat(claims.getMacroDefinitions()).isEqualTo(2);
        assertThat(claims.getMacroCalls()).isEqualTo(2);
        assertThat(claims.getConditionals()).isEqualTo(3);
        assertThat(claims.getLoops()).isEqualTo(2);
        assertThat(claims.getDataMerges()).isEqualTo(1);
        assertThat(claims.getQueryBlocks()).isEqualTo(1);
        assertThat(claims.getMaxNestingDepth()).isEqualTo(2);
        assertThat(claims.getCyclomaticComplexity()).isEqualTo(6);
        assertThat(claims.getIssues()).extracting(issue -> issue.kind())
                .containsExactly(IssueKind.EXCESS_MACRO_PARAMETERS);
    }

    @Test
    public void shouldProduceIndependentRecordsPerFile(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("b_nested.sas"), """
            do i = 1 to 2;
              do j = 1 to 2;
                if i then x = j;
            """);
        Files.writeString(tempDir.resolve("a_flat.sas"), "x = 1;\n");

        AnalysisResult result = new SasAnalyzer(configFor(tempDir)).analyze();

        assertThat(result.units()).extracting(MetricsRecord::getUnitName)
                .allMatch(name -> name.endsWith(".sas"));
        MetricsRecord flat = result.units().get(0);
        MetricsRecord nested = result.units().get(1);
        assertThat(flat.getUnitName()).endsWith("a_flat.sas");
        assertThat(flat.getMaxNestingDepth()).isZero();
        assertThat(flat.getCyclomaticComplexity()).isEqualTo(1);
        assertThat(nested.getMaxNestingDepth()).isEqualTo(2);
        assertThat(nested.getCyclomaticComplexity()).isEqualTo(4);
    }

    @Test
    public void shouldAnalyzeSingleFile(@TempDir Path tempDir) throws Exception {
        Path program = tempDir.resolve("single.sas");
        Files.writeString(program, "if a then b = 1;\n");

        AnalysisResult result = new SasAnalyzer(configFor(program)).analyze();

        assertThat(result.units()).hasSize(1);
        assertThat(result.units().get(0).getCyclomaticComplexity()).isEqualTo(2);
    }

    @Test
    public void shouldPropagateAccessFailures(@TempDir Path tempDir) {
        SasAnalyzer analyzer = new SasAnalyzer(configFor(tempDir.resolve("gone")));

        assertThatThrownBy(analyzer::analyze).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    public void shouldFallBackToDefaultThresholds(@TempDir Path tempDir) {
        SasAnalyzerConfig config = new SasAnalyzerConfig();
        config.setSourcePath(tempDir);

        SasAnalyzer analyzer = new SasAnalyzer(config);

        assertThat(analyzer.getThresholds().getHighComplexityThreshold()).isEqualTo(10);
    }

    private SasAnalyzerConfig configFor(Path sourcePath) {
        SasAnalyzerConfig config = new SasAnalyzerConfig();
        config.setSourcePath(sourcePath);
        config.setThresholdConfig(ThresholdConfig.defaults());
        return config;
    }
}
