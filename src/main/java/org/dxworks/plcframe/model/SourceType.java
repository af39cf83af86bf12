package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Front end that produced a controller's IR. Only used for reporting and for
 * deciding which controllers expect an overlay; analysis never branches on it.
 */
public enum SourceType {
    ROCKWELL("rockwell", true),
    OPENPLC("openplc", false),
    SIEMENS("siemens", false),
    SIEMENS_LAD("siemens_lad", false),
    FISCHERTECHNIK_TXT("fischertechnik_txt", false);

    private final String name;
    private final boolean expectsOverlay;

    SourceType(String name, boolean expectsOverlay) {
        this.name = name;
        this.expectsOverlay = expectsOverlay;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public boolean expectsOverlay() {
        return expectsOverlay;
    }

    @JsonCreator
    public static SourceType fromName(String name) {
        for (SourceType type : values()) {
            if (type.name.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + name);
    }
}
