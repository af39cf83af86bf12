package org.dxworks.plcframe.cfg;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowType {
    SUCCESSOR("successor"),
    TRUE("true"),
    FALSE("false"),
    CASE_VALUE("case-value");

    private final String name;

    FlowType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
