package org.dxworks.plcframe.validation;

import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.Program;
import org.dxworks.plcframe.model.Routine;
import org.dxworks.plcframe.model.expr.Expression;
import org.dxworks.plcframe.model.expr.Expressions;
import org.dxworks.plcframe.model.expr.TagRef;
import org.dxworks.plcframe.model.instruction.Assignment;
import org.dxworks.plcframe.model.instruction.Call;
import org.dxworks.plcframe.model.instruction.CaseStatement;
import org.dxworks.plcframe.model.instruction.Conditional;
import org.dxworks.plcframe.model.instruction.Instruction;
import org.dxworks.plcframe.model.instruction.Instructions;
import org.dxworks.plcframe.model.instruction.Loop;
import org.dxworks.plcframe.model.instruction.RawFallback;
import org.dxworks.plcframe.model.instruction.TimerOp;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that every tag reference resolves in its enclosing scope and records the
 * statements the IR could only keep as raw text.
 */
public final class IrValidator {

    private IrValidator() {
    }

    public static List<Diagnostic> validate(Controller controller) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Program program : controller.getPrograms()) {
            for (Routine routine : program.getRoutines()) {
                diagnostics.addAll(validate(controller, program, routine));
            }
        }
        return diagnostics;
    }

    public static List<Diagnostic> validate(Controller controller, Program program, Routine routine) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> reported = new LinkedHashSet<>();
        Instructions.walk(routine.getInstructions(), instruction -> {
            for (TagRef ref : references(instruction)) {
                if (controller.resolve(program, ref.getBase()).isEmpty() && reported.add(ref.getBase())) {
                    diagnostics.add(new Diagnostic(DiagnosticKind.UNRESOLVED_REFERENCE,
                            controller.getName(), routine.getName(),
                            "Tag '" + ref.getBase() + "' referenced as '" + ref.identity()
                                    + "' is declared neither in program " + program.getName() + " nor globally"));
                }
            }
            if (instruction instanceof RawFallback raw) {
                diagnostics.add(new Diagnostic(DiagnosticKind.STRUCTURAL_GAP,
                        controller.getName(), routine.getName(),
                        "Statement kept as raw text: " + raw.getText()));
            }
            for (Expression expression : expressions(instruction)) {
                if (Expressions.containsRaw(expression)) {
                    diagnostics.add(new Diagnostic(DiagnosticKind.STRUCTURAL_GAP,
                            controller.getName(), routine.getName(),
                            "Expression kept as raw text in: " + Instructions.render(instruction)));
                    break;
                }
            }
        });
        return diagnostics;
    }

    public static boolean hasUnresolvedReferences(Controller controller) {
        return validate(controller).stream().anyMatch(d -> d.getKind() == DiagnosticKind.UNRESOLVED_REFERENCE);
    }

    // Every tag the instruction itself touches, written or read.
    private static List<TagRef> references(Instruction instruction) {
        List<TagRef> refs = new ArrayList<>();
        if (instruction instanceof Assignment assignment) {
            refs.add(assignment.getTarget());
        } else if (instruction instanceof TimerOp timer) {
            refs.add(timer.getTimer());
        } else if (instruction instanceof RawFallback raw) {
            refs.addAll(raw.getRefs());
        }
        for (Expression expression : expressions(instruction)) {
            refs.addAll(Expressions.tagRefs(expression));
        }
        return refs;
    }

    private static List<Expression> expressions(Instruction instruction) {
        if (instruction instanceof Assignment assignment) {
            return List.of(assignment.getValue());
        }
        if (instruction instanceof Conditional conditional) {
            return List.of(conditional.getGuard());
        }
        if (instruction instanceof CaseStatement caseStatement) {
            return List.of(caseStatement.getSelector());
        }
        if (instruction instanceof Loop loop) {
            return List.of(loop.getGuard());
        }
        if (instruction instanceof Call call) {
            return call.getArgs();
        }
        if (instruction instanceof TimerOp timer) {
            return timer.getInputs();
        }
        return List.of();
    }
}
