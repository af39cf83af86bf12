package org.dxworks.plcframe.project;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictKind {
    NAME_COLLISION("name_collision"),
    TYPE_MISMATCH("type_mismatch");

    private final String name;

    ConflictKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
