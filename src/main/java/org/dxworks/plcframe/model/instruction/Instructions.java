package org.dxworks.plcframe.model.instruction;

import org.dxworks.plcframe.model.expr.Expression;
import org.dxworks.plcframe.model.expr.Expressions;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

public final class Instructions {

    private Instructions() {
    }

    /**
     * Pre-order walk over a body and every nested body, in source order.
     */
    public static void walk(List<Instruction> body, Consumer<Instruction> visitor) {
        for (Instruction instruction : body) {
            visitor.accept(instruction);
            if (instruction instanceof Conditional conditional) {
                walk(conditional.getThenBody(), visitor);
                walk(conditional.getElseBody(), visitor);
            } else if (instruction instanceof CaseStatement caseStatement) {
                for (CaseArm arm : caseStatement.getArms()) {
                    walk(arm.getBody(), visitor);
                }
                if (caseStatement.hasExplicitDefault()) {
                    walk(caseStatement.getDefaultBody(), visitor);
                }
            } else if (instruction instanceof Loop loop) {
                walk(loop.getBody(), visitor);
            }
        }
    }

    /**
     * One-line rendering of the instruction itself. Control instructions render their
     * header only (guard or selector), never their nested bodies.
     */
    public static String render(Instruction instruction) {
        if (instruction instanceof Assignment assignment) {
            return assignment.getTarget().identity() + " := " + Expressions.render(assignment.getValue());
        }
        if (instruction instanceof Conditional conditional) {
            return "IF " + Expressions.render(conditional.getGuard());
        }
        if (instruction instanceof CaseStatement caseStatement) {
            return "CASE " + Expressions.render(caseStatement.getSelector());
        }
        if (instruction instanceof Loop loop) {
            return switch (loop.getLoopKind()) {
                case WHILE -> "WHILE " + Expressions.render(loop.getGuard());
                case REPEAT -> "REPEAT UNTIL " + Expressions.render(loop.getGuard());
                case FOR -> "FOR " + Expressions.render(loop.getGuard());
            };
        }
        if (instruction instanceof Call call) {
            return call.getName() + "(" + renderArgs(call.getArgs()) + ")";
        }
        if (instruction instanceof TimerOp timer) {
            String inputs = renderArgs(timer.getInputs());
            return timer.getTimerKind() + "(" + timer.getTimer().identity()
                    + (inputs.isEmpty() ? "" : ", " + inputs) + ")";
        }
        if (instruction instanceof RawFallback raw) {
            return raw.getText();
        }
        throw new IllegalArgumentException("Unsupported instruction: " + instruction.getClass().getName());
    }

    private static String renderArgs(List<Expression> args) {
        return args.stream().map(Expressions::render).collect(Collectors.joining(", "));
    }
}
