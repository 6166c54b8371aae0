package org.carball.sascan.model.analysis;

public record Issue(IssueKind kind, String message) {

    public static Issue excessMacroParameters(String macroName, int parameterCount, int limit) {
        return new Issue(IssueKind.EXCESS_MACRO_PARAMETERS,
                String.format("Macro '%s' declares %d parameters (limit %d)", macroName, parameterCount, limit));
    }

    public static Issue highComplexity(int score, int threshold) {
        return new Issue(IssueKind.HIGH_COMPLEXITY,
                String.format("Cyclomatic complexity %d exceeds threshold %d", score, threshold));
    }
}
