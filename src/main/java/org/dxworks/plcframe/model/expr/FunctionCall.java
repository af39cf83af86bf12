package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Function invoked inside an expression, e.g. {@code ABS(x)} or {@code LIMIT(0, v, 100)}. */
public final class FunctionCall implements Expression {
    private final String name;
    private final List<Expression> args;

    @JsonCreator
    public FunctionCall(@JsonProperty("name") String name,
                        @JsonProperty("args") List<Expression> args) {
        this.name = Objects.requireNonNull(name, "function name");
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
