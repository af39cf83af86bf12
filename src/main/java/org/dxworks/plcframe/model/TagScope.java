package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TagScope {
    CONTROLLER("controller"),
    PROGRAM("program");

    private final String name;

    TagScope(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static TagScope fromName(String name) {
        for (TagScope scope : values()) {
            if (scope.name.equalsIgnoreCase(name)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown tag scope: " + name);
    }
}
