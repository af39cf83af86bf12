package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Operator {
    AND("AND"),
    OR("OR"),
    XOR("XOR"),
    NOT("NOT"),
    NEG("-"),
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("MOD");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Operator fromName(String name) {
        for (Operator op : values()) {
            if (op.name().equalsIgnoreCase(name)) {
                return op;
            }
        }
        // Accept the vendor-neutral symbols as well; "-" resolves to binary SUB.
        for (Operator op : values()) {
            if (op != NEG && op.symbol.equals(name)) {
                return op;
            }
        }
        if ("==".equals(name)) return EQ;
        if ("!=".equals(name)) return NE;
        if ("&&".equals(name)) return AND;
        if ("||".equals(name)) return OR;
        if ("!".equals(name)) return NOT;
        throw new IllegalArgumentException("Unknown operator: " + name);
    }
}
