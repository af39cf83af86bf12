package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StateClassification {
    INITIAL("initial"),
    TERMINAL("terminal"),
    INTERMEDIATE("intermediate");

    private final String name;

    StateClassification(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
