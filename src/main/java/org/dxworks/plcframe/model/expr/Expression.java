package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Right-hand side, guard or argument of an instruction. Front ends lower every
 * dialect's expression syntax into this small tree.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Literal.class, name = "literal"),
        @JsonSubTypes.Type(value = TagRef.class, name = "tag"),
        @JsonSubTypes.Type(value = UnaryOp.class, name = "unary"),
        @JsonSubTypes.Type(value = BinaryOp.class, name = "binary"),
        @JsonSubTypes.Type(value = FunctionCall.class, name = "call"),
        @JsonSubTypes.Type(value = RawExpression.class, name = "raw")
})
public interface Expression {
}
