package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.Expression;

import java.util.List;
import java.util.Objects;

/** Subroutine, function-block or vendor instruction call (JSR, FB instance call, MOV ...). */
public final class Call implements Instruction {
    private final String name;
    private final List<Expression> args;

    @JsonCreator
    public Call(@JsonProperty("name") String name,
                @JsonProperty("args") List<Expression> args) {
        this.name = Objects.requireNonNull(name, "call name");
        this.args = args != null ? List.copyOf(args) : List.of();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("args")
    public List<Expression> getArgs() {
        return args;
    }
}
