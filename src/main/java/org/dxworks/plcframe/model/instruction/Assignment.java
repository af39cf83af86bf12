package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.Expression;
import org.dxworks.plcframe.model.expr.TagRef;

import java.util.Objects;

public final class Assignment implements Instruction {
    private final TagRef target;
    private final Expression value;

    @JsonCreator
    public Assignment(@JsonProperty("target") TagRef target,
                      @JsonProperty("value") Expression value) {
        this.target = Objects.requireNonNull(target, "assignment target");
        this.value = Objects.requireNonNull(value, "assigned value of " + target);
    }

    @JsonProperty("target")
    public TagRef getTarget() {
        return target;
    }

    @JsonProperty("value")
    public Expression getValue() {
        return value;
    }
}
