package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A named addressable memory location. Identity is (scope, name), case-sensitive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "data_type", "type_name", "scope", "initial_value", "address", "description"})
public final class Tag {
    private final String name;
    private final DataType dataType;
    private final String typeName;
    private final TagScope scope;
    private final String initialValue;
    private final String address;
    private final String description;

    @JsonCreator
    public Tag(@JsonProperty("name") String name,
               @JsonProperty("data_type") DataType dataType,
               @JsonProperty("type_name") String typeName,
               @JsonProperty("scope") TagScope scope,
               @JsonProperty("initial_value") String initialValue,
               @JsonProperty("address") String address,
               @JsonProperty("description") String description) {
        this.name = Objects.requireNonNull(name, "tag name");
        this.dataType = Objects.requireNonNull(dataType, "data type of " + name);
        this.typeName = typeName;
        this.scope = scope != null ? scope : TagScope.CONTROLLER;
        this.initialValue = initialValue;
        this.address = address;
        this.description = description;
    }

    public static Tag global(String name, DataType dataType) {
        return new Tag(name, dataType, null, TagScope.CONTROLLER, null, null, null);
    }

    public static Tag local(String name, DataType dataType) {
        return new Tag(name, dataType, null, TagScope.PROGRAM, null, null, null);
    }

    public Tag withInitialValue(String value) {
        return new Tag(name, dataType, typeName, scope, value, address, description);
    }

    public Tag withTypeName(String declaredType) {
        return new Tag(name, dataType, declaredType, scope, initialValue, address, description);
    }

    public Tag withScope(TagScope newScope) {
        return new Tag(name, dataType, typeName, newScope, initialValue, address, description);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("data_type")
    public DataType getDataType() {
        return dataType;
    }

    @JsonProperty("type_name")
    public String getTypeName() {
        return typeName;
    }

    @JsonProperty("scope")
    public TagScope getScope() {
        return scope;
    }

    @JsonProperty("initial_value")
    public String getInitialValue() {
        return initialValue;
    }

    @JsonProperty("address")
    public String getAddress() {
        return address;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    /**
     * Declared types agree when the coarse data type matches and, where both sides
     * name a vendor type, the names match ignoring case.
     */
    public boolean sameDeclaredType(Tag other) {
        if (dataType != other.dataType) {
            return false;
        }
        if (typeName == null || other.typeName == null) {
            return true;
        }
        return typeName.equalsIgnoreCase(other.typeName);
    }

    public String declaredType() {
        return typeName != null ? typeName : dataType.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tag tag)) return false;
        return name.equals(tag.name) && scope == tag.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scope);
    }

    @Override
    public String toString() {
        return scope.getName() + ":" + name;
    }
}
