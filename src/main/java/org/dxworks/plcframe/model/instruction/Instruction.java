package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One statement of a routine. Control instructions own their nested bodies; there are
 * no back-references from a body to the instruction that owns it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Assignment.class, name = "assignment"),
        @JsonSubTypes.Type(value = Conditional.class, name = "if"),
        @JsonSubTypes.Type(value = CaseStatement.class, name = "case"),
        @JsonSubTypes.Type(value = Loop.class, name = "loop"),
        @JsonSubTypes.Type(value = Call.class, name = "call"),
        @JsonSubTypes.Type(value = TimerOp.class, name = "timer"),
        @JsonSubTypes.Type(value = RawFallback.class, name = "raw")
})
public interface Instruction {

    /** Conditional, Case and Loop open their own basic block. */
    default boolean opensBlock() {
        return false;
    }
}
