package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.Expression;

import java.util.List;
import java.util.Objects;

/**
 * IF/THEN/ELSE. ELSIF chains are lowered by front ends into a nested Conditional in the
 * else body; a ladder rung becomes a Conditional over its input conditions.
 */
public final class Conditional implements Instruction {
    private final Expression guard;
    private final List<Instruction> thenBody;
    private final List<Instruction> elseBody;

    @JsonCreator
    public Conditional(@JsonProperty("guard") Expression guard,
                       @JsonProperty("then") List<Instruction> thenBody,
                       @JsonProperty("else") List<Instruction> elseBody) {
        this.guard = Objects.requireNonNull(guard, "conditional guard");
        this.thenBody = thenBody != null ? List.copyOf(thenBody) : List.of();
        this.elseBody = elseBody != null ? List.copyOf(elseBody) : List.of();
    }

    @JsonProperty("guard")
    public Expression getGuard() {
        return guard;
    }

    @JsonProperty("then")
    public List<Instruction> getThenBody() {
        return thenBody;
    }

    @JsonProperty("else")
    public List<Instruction> getElseBody() {
        return elseBody;
    }

    @Override
    public boolean opensBlock() {
        return true;
    }
}
