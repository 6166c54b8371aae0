package org.carball.sascan.model.construct;

public enum ConstructKind {
    CONDITIONAL,
    LOOP_OPEN,
    BLOCK_CLOSE,

    // Structural step families
    DATA_STEP,
    PROC_STEP,

    MACRO_DEFINITION,
    MACRO_CALL,

    // Data operations
    DATA_MERGE,
    QUERY_BLOCK
}
