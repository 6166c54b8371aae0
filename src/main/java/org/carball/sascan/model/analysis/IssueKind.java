package org.carball.sascan.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum IssueKind {
    EXCESS_MACRO_PARAMETERS("excess-macro-parameters", "Excess macro parameters"),
    HIGH_COMPLEXITY("high-complexity", "High complexity");

    private final String code;
    private final String displayName;

    IssueKind(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
