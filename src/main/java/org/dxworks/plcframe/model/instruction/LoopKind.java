package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LoopKind {
    WHILE("while"),
    REPEAT("repeat"),
    FOR("for");

    private final String name;

    LoopKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static LoopKind fromName(String name) {
        for (LoopKind kind : values()) {
            if (kind.name.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown loop kind: " + name);
    }
}
