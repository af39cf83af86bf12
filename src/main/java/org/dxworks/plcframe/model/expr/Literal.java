package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * A constant. {@code label} keeps the symbolic name a front end resolved the value
 * from (an enum member or a named constant), when it had one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Literal implements Expression {
    private final String value;
    private final LiteralType type;
    private final String label;

    @JsonCreator
    public Literal(@JsonProperty("value") String value,
                   @JsonProperty("type") LiteralType type,
                   @JsonProperty("label") String label) {
        this.value = Objects.requireNonNull(value, "literal value");
        this.type = type != null ? type : LiteralType.SYMBOL;
        this.label = label;
    }

    public static Literal of(long value) {
        return new Literal(Long.toString(value), LiteralType.INTEGER, null);
    }

    public static Literal of(boolean value) {
        return new Literal(value ? "TRUE" : "FALSE", LiteralType.BOOLEAN, null);
    }

    public static Literal labeled(long value, String label) {
        return new Literal(Long.toString(value), LiteralType.INTEGER, label);
    }

    public static Literal symbol(String name) {
        return new Literal(name, LiteralType.SYMBOL, null);
    }

    @JsonProperty("value")
    public String getValue() {
        return value;
    }

    @JsonProperty("type")
    public LiteralType getType() {
        return type;
    }

    @JsonProperty("label")
    public String getLabel() {
        return label;
    }

    /**
     * Normalized value used to decide whether two literals denote the same constant:
     * {@code +1}, {@code 01} and {@code 1} coincide, as do {@code true} and {@code TRUE}.
     */
    public String key() {
        switch (type) {
            case INTEGER:
                try {
                    return Long.toString(Long.parseLong(value.trim().replace("_", "")));
                } catch (NumberFormatException e) {
                    return value.trim();
                }
            case BOOLEAN:
                String b = value.trim().toUpperCase(Locale.ROOT);
                return "1".equals(b) ? "TRUE" : "0".equals(b) ? "FALSE" : b;
            default:
                return value;
        }
    }

    /** Preferred display name: the symbolic label if the IR kept one, else the value. */
    public String displayName() {
        return label != null ? label : value;
    }

    @JsonIgnore
    public boolean isBoolean() {
        return type == LiteralType.BOOLEAN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal literal)) return false;
        return type == literal.type && key().equals(literal.key());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, key());
    }

    @Override
    public String toString() {
        return displayName();
    }
}
