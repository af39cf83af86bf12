package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DataType {
    BIT("bit"),
    INTEGER("integer"),
    REAL("real"),
    STRUCT("struct"),
    ARRAY("array"),
    UDT("udt");

    private final String name;

    DataType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static DataType fromName(String name) {
        for (DataType type : values()) {
            if (type.name.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + name);
    }
}
