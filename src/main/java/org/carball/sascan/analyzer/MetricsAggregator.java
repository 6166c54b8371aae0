package org.carball.sascan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.model.analysis.Issue;
import org.carball.sascan.model.analysis.MetricsRecord;
import org.carball.sascan.model.construct.ClassifiedConstruct;
import org.carball.sascan.model.construct.MacroDefinition;

/**
 * Folds classified constructs into a {@link MetricsRecord}.
 */
@Slf4j
public class MetricsAggregator {

    private final MetricsRecord record;
    private final int maxMacroParameters;

    public MetricsAggregator(MetricsRecord record, int maxMacroParameters) {
        this.record = record;
        this.maxMacroParameters = maxMacroParameters;
    }

    public void accept(ClassifiedConstruct construct) {
        switch (construct.kind()) {
            case DATA_STEP:
                record.incrementDataSteps();
                break;
            case PROC_STEP:
                record.incrementProcSteps();
                break;
            case MACRO_DEFINITION:
                record.incrementMacroDefinitions();
                checkMacroParameters(construct.macro());
                break;
            case MACRO_CALL:
                record.incrementMacroCalls();
                break;
            case CONDITIONAL:
                record.incrementConditionals();
                break;
            case LOOP_OPEN:
                record.incrementLoops();
                break;
            case DATA_MERGE:
                record.incrementDataMerges();
                break;
            case QUERY_BLOCK:
                record.incrementQueryBlocks();
                break;
            case BLOCK_CLOSE:
                // depth only
                break;
        }
    }

    private void checkMacroParameters(MacroDefinition macro) {
        if (macro != null && macro.parameterCount() > maxMacroParameters) {
            log.debug("Macro '{}' in {} declares {} parameters", macro.name(), record.getUnitName(),
                    macro.parameterCount());
            record.addIssue(Issue.excessMacroParameters(macro.name(), macro.parameterCount(), maxMacroParameters));
        }
    }
}
