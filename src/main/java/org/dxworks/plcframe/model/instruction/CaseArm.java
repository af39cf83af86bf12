package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.Literal;

import java.util.List;
import java.util.stream.Collectors;

/** One labeled arm of a CASE; {@code 1, 2:} carries two values. */
public final class CaseArm {
    private final List<Literal> values;
    private final List<Instruction> body;

    @JsonCreator
    public CaseArm(@JsonProperty("values") List<Literal> values,
                   @JsonProperty("body") List<Instruction> body) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("A case arm needs at least one value");
        }
        this.values = List.copyOf(values);
        this.body = body != null ? List.copyOf(body) : List.of();
    }

    @JsonProperty("values")
    public List<Literal> getValues() {
        return values;
    }

    @JsonProperty("body")
    public List<Instruction> getBody() {
        return body;
    }

    public String label() {
        return values.stream().map(Literal::displayName).collect(Collectors.joining(","));
    }
}
