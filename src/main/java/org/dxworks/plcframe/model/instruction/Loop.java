package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.Expression;

import java.util.List;
import java.util.Objects;

/** WHILE, REPEAT and FOR share one shape: the guard decides whether the body runs again. */
public final class Loop implements Instruction {
    private final LoopKind loopKind;
    private final Expression guard;
    private final List<Instruction> body;

    @JsonCreator
    public Loop(@JsonProperty("loop_kind") LoopKind loopKind,
                @JsonProperty("guard") Expression guard,
                @JsonProperty("body") List<Instruction> body) {
        this.loopKind = loopKind != null ? loopKind : LoopKind.WHILE;
        this.guard = Objects.requireNonNull(guard, "loop guard");
        this.body = body != null ? List.copyOf(body) : List.of();
    }

    @JsonProperty("loop_kind")
    public LoopKind getLoopKind() {
        return loopKind;
    }

    @JsonProperty("guard")
    public Expression getGuard() {
        return guard;
    }

    @JsonProperty("body")
    public List<Instruction> getBody() {
        return body;
    }

    @Override
    public boolean opensBlock() {
        return true;
    }
}
