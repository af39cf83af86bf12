package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.Expression;
import org.dxworks.plcframe.model.expr.TagRef;

import java.util.List;
import java.util.Objects;

/**
 * Timer or counter instruction (TON, TOF, RTO, CTU ...). The timer structure is
 * written; the inputs (enable rung, preset) are read.
 */
public final class TimerOp implements Instruction {
    private final String timerKind;
    private final TagRef timer;
    private final List<Expression> inputs;

    @JsonCreator
    public TimerOp(@JsonProperty("timer_kind") String timerKind,
                   @JsonProperty("timer") TagRef timer,
                   @JsonProperty("inputs") List<Expression> inputs) {
        this.timerKind = timerKind != null ? timerKind : "TON";
        this.timer = Objects.requireNonNull(timer, "timer tag");
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
    }

    @JsonProperty("timer_kind")
    public String getTimerKind() {
        return timerKind;
    }

    @JsonProperty("timer")
    public TagRef getTimer() {
        return timer;
    }

    @JsonProperty("inputs")
    public List<Expression> getInputs() {
        return inputs;
    }
}
