package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.Expression;

import java.util.List;
import java.util.Objects;

/**
 * CASE selector OF arms [ELSE default] END_CASE. A null default means no ELSE was
 * written: unmatched selector values fall through.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CaseStatement implements Instruction {
    private final Expression selector;
    private final List<CaseArm> arms;
    private final List<Instruction> defaultBody;

    @JsonCreator
    public CaseStatement(@JsonProperty("selector") Expression selector,
                         @JsonProperty("arms") List<CaseArm> arms,
                         @JsonProperty("default") List<Instruction> defaultBody) {
        this.selector = Objects.requireNonNull(selector, "case selector");
        this.arms = arms != null ? List.copyOf(arms) : List.of();
        this.defaultBody = defaultBody != null ? List.copyOf(defaultBody) : null;
    }

    @JsonProperty("selector")
    public Expression getSelector() {
        return selector;
    }

    @JsonProperty("arms")
    public List<CaseArm> getArms() {
        return arms;
    }

    @JsonProperty("default")
    public List<Instruction> getDefaultBody() {
        return defaultBody;
    }

    public boolean hasExplicitDefault() {
        return defaultBody != null;
    }

    @Override
    public boolean opensBlock() {
        return true;
    }
}
