package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name", "classification"})
public final class FsmState {
    private final String name;
    private final String value;
    private final StateClassification classification;

    public FsmState(String name, String value, StateClassification classification) {
        this.name = Objects.requireNonNull(name, "state name");
        this.value = Objects.requireNonNull(value, "state value");
        this.classification = Objects.requireNonNull(classification, "classification");
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    /** Normalized literal the state stands for. */
    @JsonIgnore
    public String getValue() {
        return value;
    }

    @JsonProperty("classification")
    public StateClassification getClassification() {
        return classification;
    }

    @Override
    public String toString() {
        return name + " (" + classification.getName() + ")";
    }
}
