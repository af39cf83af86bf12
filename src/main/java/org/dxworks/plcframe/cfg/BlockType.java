package org.dxworks.plcframe.cfg;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockType {
    /** Straight-line run of assignments, calls, timers and raw statements. */
    INSTRUCTION("instruction"),
    /** Head of a Conditional or Case. */
    BRANCH("branch"),
    /** Loop guard, or the synthetic exit block. */
    CONTROL("control");

    private final String name;

    BlockType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
