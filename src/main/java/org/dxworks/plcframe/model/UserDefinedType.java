package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public final class UserDefinedType {
    private final String name;
    private final List<UdtMember> members;

    @JsonCreator
    public UserDefinedType(@JsonProperty("name") String name,
                           @JsonProperty("members") List<UdtMember> members) {
        this.name = Objects.requireNonNull(name, "UDT name");
        this.members = members != null ? List.copyOf(members) : List.of();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("members")
    public List<UdtMember> getMembers() {
        return members;
    }
}
