package org.dxworks.plcframe.dataflow;

import org.dxworks.plcframe.cfg.BasicBlock;
import org.dxworks.plcframe.cfg.CfgBuilder;
import org.dxworks.plcframe.cfg.ControlFlowGraph;
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
import org.dxworks.plcframe.model.instruction.Loop;
import org.dxworks.plcframe.model.instruction.RawFallback;
import org.dxworks.plcframe.model.instruction.TimerOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Lexical, flow-insensitive def/use summary per block, and the cross-routine
 * dependencies derived from it.
 *
 * <p>This is a conservative approximation, not reaching definitions: a tag written
 * anywhere in a block is a def of the block, a tag read anywhere is a use, regardless
 * of order or of which path actually executes. No loop-aware fixpoint is computed.
 */
public final class DataFlowAnalyzer {

    private DataFlowAnalyzer() {
    }

    /**
     * Returns a copy of {@code cfg} whose blocks carry defs and uses. The input graph
     * is not modified.
     */
    public static ControlFlowGraph annotate(ControlFlowGraph cfg) {
        List<BasicBlock> annotated = new ArrayList<>();
        for (BasicBlock block : cfg.getBlocks()) {
            SortedSet<String> defs = new TreeSet<>();
            SortedSet<String> uses = new TreeSet<>();
            for (Instruction instruction : block.getInstructions()) {
                defs.addAll(defs(instruction));
                uses.addAll(uses(instruction));
            }
            annotated.add(block.withDefsAndUses(defs, uses));
        }
        return cfg.withBlocks(annotated);
    }

    public static ControlFlowGraph buildAnnotated(Routine routine) {
        return annotate(CfgBuilder.build(routine));
    }

    /**
     * Tags written by the instruction itself. Control instructions define nothing; the
     * instructions of their bodies live in other blocks.
     */
    public static Set<String> defs(Instruction instruction) {
        Set<String> out = new TreeSet<>();
        if (instruction instanceof Assignment assignment) {
            out.add(assignment.getTarget().identity());
        } else if (instruction instanceof TimerOp timer) {
            out.add(timer.getTimer().identity());
        }
        return out;
    }

    /**
     * Tags read by the instruction itself: the guard or selector of a control
     * instruction, the right-hand side of an assignment, call arguments, timer inputs,
     * and the best-effort references of a raw statement.
     */
    public static Set<String> uses(Instruction instruction) {
        Set<String> out = new TreeSet<>();
        if (instruction instanceof Assignment assignment) {
            addReads(assignment.getValue(), out);
        } else if (instruction instanceof Conditional conditional) {
            addReads(conditional.getGuard(), out);
        } else if (instruction instanceof CaseStatement caseStatement) {
            addReads(caseStatement.getSelector(), out);
        } else if (instruction instanceof Loop loop) {
            addReads(loop.getGuard(), out);
        } else if (instruction instanceof Call call) {
            call.getArgs().forEach(arg -> addReads(arg, out));
        } else if (instruction instanceof TimerOp timer) {
            timer.getInputs().forEach(input -> addReads(input, out));
        } else if (instruction instanceof RawFallback raw) {
            raw.getRefs().forEach(ref -> out.add(ref.identity()));
        }
        return out;
    }

    private static void addReads(Expression expression, Set<String> out) {
        for (TagRef ref : Expressions.tagRefs(expression)) {
            out.add(ref.identity());
        }
    }

    /**
     * Builds and annotates the CFG of every routine of the controller, in program then
     * routine declaration order.
     */
    public static List<RoutineFacts> summarize(Controller controller) {
        List<RoutineFacts> facts = new ArrayList<>();
        for (Program program : controller.getPrograms()) {
            for (Routine routine : program.getRoutines()) {
                RoutineRef ref = new RoutineRef(controller.getName(), program.getName(), routine.getName());
                facts.add(new RoutineFacts(ref, buildAnnotated(routine)));
            }
        }
        return facts;
    }

    public static List<RoutineFacts> summarize(List<Controller> controllers) {
        List<RoutineFacts> facts = new ArrayList<>();
        for (Controller controller : controllers) {
            facts.addAll(summarize(controller));
        }
        return facts;
    }

    /**
     * For every routine A and tag T defined in A, the routines B != A that use T, across
     * programs and controllers. Order: writer routine in controller/program/routine
     * declaration order, then tag name; readers in declaration order.
     */
    public static List<CrossDependency> crossRoutineFlows(List<Controller> controllers) {
        return crossRoutineFlowsOf(summarize(controllers));
    }

    public static List<CrossDependency> crossRoutineFlowsOf(List<RoutineFacts> facts) {
        List<CrossDependency> dependencies = new ArrayList<>();
        for (RoutineFacts writer : facts) {
            for (String tag : writer.getDefs()) {
                List<String> readers = new ArrayList<>();
                for (RoutineFacts reader : facts) {
                    if (!reader.getRef().equals(writer.getRef()) && reader.getUses().contains(tag)) {
                        readers.add(reader.getRef().qualifiedName());
                    }
                }
                if (!readers.isEmpty()) {
                    dependencies.add(new CrossDependency(tag, writer.getRef().qualifiedName(), readers));
                }
            }
        }
        return dependencies;
    }
}
