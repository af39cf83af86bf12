package org.dxworks.plcframe.model.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class Expressions {

    private Expressions() {
    }

    /**
     * Every tag read by the expression, in left-to-right order, duplicates kept.
     */
    public static List<TagRef> tagRefs(Expression expression) {
        List<TagRef> refs = new ArrayList<>();
        collect(expression, refs);
        return refs;
    }

    private static void collect(Expression expression, List<TagRef> out) {
        if (expression == null) {
            return;
        }
        if (expression instanceof TagRef ref) {
            out.add(ref);
        } else if (expression instanceof UnaryOp unary) {
            collect(unary.getOperand(), out);
        } else if (expression instanceof BinaryOp binary) {
            collect(binary.getLeft(), out);
            collect(binary.getRight(), out);
        } else if (expression instanceof FunctionCall call) {
            for (Expression arg : call.getArgs()) {
                collect(arg, out);
            }
        } else if (expression instanceof RawExpression raw) {
            out.addAll(raw.getRefs());
        }
    }

    /**
     * Vendor-neutral, structured-text-like rendering. Nested binary operands are
     * parenthesized so the rendering is unambiguous without precedence rules.
     */
    public static String render(Expression expression) {
        if (expression == null) {
            return "";
        }
        if (expression instanceof Literal literal) {
            if (literal.getType() == LiteralType.STRING) {
                return "'" + literal.getValue() + "'";
            }
            return literal.displayName();
        }
        if (expression instanceof TagRef ref) {
            return ref.identity();
        }
        if (expression instanceof UnaryOp unary) {
            String operand = renderOperand(unary.getOperand());
            return unary.getOp() == Operator.NOT ? "NOT " + operand : unary.getOp().getSymbol() + operand;
        }
        if (expression instanceof BinaryOp binary) {
            return renderOperand(binary.getLeft()) + " " + binary.getOp().getSymbol() + " "
                    + renderOperand(binary.getRight());
        }
        if (expression instanceof FunctionCall call) {
            return call.getName() + "(" + call.getArgs().stream()
                    .map(Expressions::render)
                    .collect(Collectors.joining(", ")) + ")";
        }
        if (expression instanceof RawExpression raw) {
            return raw.getText();
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression.getClass().getName());
    }

    private static String renderOperand(Expression operand) {
        String text = render(operand);
        return operand instanceof BinaryOp ? "(" + text + ")" : text;
    }

    /**
     * Splits a guard into its top-level AND conjuncts.
     */
    public static List<Expression> conjuncts(Expression guard) {
        List<Expression> out = new ArrayList<>();
        splitAnd(guard, out);
        return out;
    }

    private static void splitAnd(Expression expression, List<Expression> out) {
        if (expression instanceof BinaryOp binary && binary.getOp() == Operator.AND) {
            splitAnd(binary.getLeft(), out);
            splitAnd(binary.getRight(), out);
        } else if (expression != null) {
            out.add(expression);
        }
    }

    public static boolean containsRaw(Expression expression) {
        if (expression instanceof RawExpression) {
            return true;
        }
        if (expression instanceof UnaryOp unary) {
            return containsRaw(unary.getOperand());
        }
        if (expression instanceof BinaryOp binary) {
            return containsRaw(binary.getLeft()) || containsRaw(binary.getRight());
        }
        if (expression instanceof FunctionCall call) {
            return call.getArgs().stream().anyMatch(Expressions::containsRaw);
        }
        return false;
    }
}
