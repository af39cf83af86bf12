package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.instruction.Instruction;

import java.util.List;
import java.util.Objects;

public final class Routine {
    private final String name;
    private final List<Instruction> instructions;

    @JsonCreator
    public Routine(@JsonProperty("name") String name,
                   @JsonProperty("instructions") List<Instruction> instructions) {
        this.name = Objects.requireNonNull(name, "routine name");
        this.instructions = instructions != null ? List.copyOf(instructions) : List.of();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("instructions")
    public List<Instruction> getInstructions() {
        return instructions;
    }
}
