package org.dxworks.plcframe.validation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiagnosticKind {
    UNRESOLVED_REFERENCE("unresolved_reference"),
    AMBIGUOUS_STATE_VARIABLE("ambiguous_state_variable"),
    MISSING_OVERLAY("missing_overlay"),
    STRUCTURAL_GAP("structural_gap");

    private final String name;

    DiagnosticKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
