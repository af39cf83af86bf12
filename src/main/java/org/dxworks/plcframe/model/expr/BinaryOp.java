package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class BinaryOp implements Expression {
    private final Operator op;
    private final Expression left;
    private final Expression right;

    @JsonCreator
    public BinaryOp(@JsonProperty("op") Operator op,
                    @JsonProperty("left") Expression left,
                    @JsonProperty("right") Expression right) {
        this.op = Objects.requireNonNull(op, "binary operator");
        this.left = Objects.requireNonNull(left, "left operand");
        this.right = Objects.requireNonNull(right, "right operand");
    }

    public static BinaryOp eq(Expression left, Expression right) {
        return new BinaryOp(Operator.EQ, left, right);
    }

    public static BinaryOp and(Expression left, Expression right) {
        return new BinaryOp(Operator.AND, left, right);
    }

    @JsonProperty("op")
    public Operator getOp() {
        return op;
    }

    @JsonProperty("left")
    public Expression getLeft() {
        return left;
    }

    @JsonProperty("right")
    public Expression getRight() {
        return right;
    }
}
