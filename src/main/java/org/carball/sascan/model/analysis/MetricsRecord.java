package org.carball.sascan.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structural metrics for a single source unit.
 * <p>
 * A record is filled in while its unit is scanned and frozen once the complexity score has been
 * computed. Any mutation after {@link #freeze()} fails with {@link IllegalStateException}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class MetricsRecord {

    private final String unitName;

    private int dataSteps;
    private int procSteps;
    private int macroDefinitions;
    private int macroCalls;
    private int conditionals;
    private int loops;
    private int dataMerges;
    private int queryBlocks;

    private int maxNestingDepth;
    private int cyclomaticComplexity = 1;

    @Getter(lombok.AccessLevel.NONE)
    private final List<Issue> issues = new ArrayList<>();

    @JsonIgnore
    private boolean frozen;

    public MetricsRecord(String unitName) {
        this.unitName = unitName;
    }

    public void incrementDataSteps() {
        checkMutable();
        dataSteps++;
    }

    public void incrementProcSteps() {
        checkMutable();
        procSteps++;
    }

    public void incrementMacroDefinitions() {
        checkMutable();
        macroDefinitions++;
    }

    public void incrementMacroCalls() {
        checkMutable();
        macroCalls++;
    }

    public void incrementConditionals() {
        checkMutable();
        conditionals++;
    }

    public void incrementLoops() {
        checkMutable();
        loops++;
    }

    public void incrementDataMerges() {
        checkMutable();
        dataMerges++;
    }

    public void incrementQueryBlocks() {
        checkMutable();
        queryBlocks++;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        checkMutable();
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("Nesting depth must not be negative: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public void setCyclomaticComplexity(int cyclomaticComplexity) {
        checkMutable();
        if (cyclomaticComplexity < 1) {
            throw new IllegalArgumentException("Cyclomatic complexity must be at least 1: " + cyclomaticComplexity);
        }
        this.cyclomaticComplexity = cyclomaticComplexity;
    }

    public void addIssue(Issue issue) {
        checkMutable();
        issues.add(issue);
    }

    public List<Issue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    /** Structural step headers of both families. */
    public int getStructuralSteps() {
        return dataSteps + procSteps;
    }

    public MigrationRisk getMigrationRisk(int highComplexityThreshold) {
        return MigrationRisk.fromComplexity(cyclomaticComplexity, highComplexityThreshold);
    }

    public void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Metrics for '" + unitName + "' are finalized and cannot be modified");
        }
    }
}
