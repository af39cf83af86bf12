package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class UnaryOp implements Expression {
    private final Operator op;
    private final Expression operand;

    @JsonCreator
    public UnaryOp(@JsonProperty("op") Operator op,
                   @JsonProperty("operand") Expression operand) {
        this.op = Objects.requireNonNull(op, "unary operator");
        this.operand = Objects.requireNonNull(operand, "unary operand");
    }

    public static UnaryOp not(Expression operand) {
        return new UnaryOp(Operator.NOT, operand);
    }

    @JsonProperty("op")
    public Operator getOp() {
        return op;
    }

    @JsonProperty("operand")
    public Expression getOperand() {
        return operand;
    }
}
