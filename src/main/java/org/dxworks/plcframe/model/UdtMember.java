package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class UdtMember {
    private final String name;
    private final String typeName;

    @JsonCreator
    public UdtMember(@JsonProperty("name") String name,
                     @JsonProperty("type_name") String typeName) {
        this.name = Objects.requireNonNull(name, "member name");
        this.typeName = typeName;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type_name")
    public String getTypeName() {
        return typeName;
    }
}
