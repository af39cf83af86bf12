package org.dxworks.plcframe.dataflow;

import org.dxworks.plcframe.cfg.BasicBlock;
import org.dxworks.plcframe.cfg.CfgBuilder;
import org.dxworks.plcframe.cfg.ControlFlowGraph;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.expr.BinaryOp;
import org.dxworks.plcframe.model.expr.FunctionCall;
import org.dxworks.plcframe.model.expr.Operator;
import org.dxworks.plcframe.model.expr.TagRef;
import org.dxworks.plcframe.model.instruction.Call;
import org.dxworks.plcframe.model.instruction.Instruction;
import org.dxworks.plcframe.model.instruction.RawFallback;
import org.dxworks.plcframe.model.instruction.TimerOp;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.dxworks.plcframe.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class DataFlowAnalyzerTest {

    @Test
    void assignmentDefinesTargetAndUsesRightHandSide() {
        Instruction insn = assign("Motor.Speed", new BinaryOp(Operator.MUL, tag("SETPOINT"), tag("Scale[2]")));

        assertEquals(Set.of("Motor.Speed"), DataFlowAnalyzer.defs(insn));
        assertEquals(Set.of("SETPOINT", "Scale[2]"), DataFlowAnalyzer.uses(insn));
    }

    @Test
    void timerDefinesTimerAndUsesInputs() {
        TimerOp timer = new TimerOp("TON", tag("T1"), List.of(tag("START"), tag("PRESET")));

        assertEquals(Set.of("T1"), DataFlowAnalyzer.defs(timer));
        assertEquals(Set.of("START", "PRESET"), DataFlowAnalyzer.uses(timer));
    }

    @Test
    void callArgumentsAndRawReferencesAreReadsOnly() {
        Call call = new Call("LOG", List.of(new FunctionCall("ABS", List.of(tag("ERR")))));
        RawFallback raw = new RawFallback("MOV SRC DST", List.of(TagRef.of("SRC"), TagRef.of("DST")));

        assertTrue(DataFlowAnalyzer.defs(call).isEmpty());
        assertEquals(Set.of("ERR"), DataFlowAnalyzer.uses(call));
        assertTrue(DataFlowAnalyzer.defs(raw).isEmpty());
        assertEquals(Set.of("DST", "SRC"), DataFlowAnalyzer.uses(raw));
    }

    @Test
    void everyDefAndUseHasAnInstructionInItsBlock() {
        ControlFlowGraph cfg = DataFlowAnalyzer.buildAnnotated(routine("R",
                assign("A", tag("B")),
                when(eq("MODE", 2), assign("C", tag("D")), new TimerOp("TON", tag("T1"), List.of(tag("C")))),
                assign("E", 0)));

        for (BasicBlock block : cfg.getBlocks()) {
            for (String def : block.getDefs()) {
                assertTrue(block.getInstructions().stream().anyMatch(i -> DataFlowAnalyzer.defs(i).contains(def)),
                        def + " in block " + block.getId());
            }
            for (String use : block.getUses()) {
                assertTrue(block.getInstructions().stream().anyMatch(i -> DataFlowAnalyzer.uses(i).contains(use)),
                        use + " in block " + block.getId());
            }
        }
        assertEquals(Set.of("MODE"), cfg.block(1).getUses());
        assertEquals(Set.of("C", "T1"), cfg.block(2).getDefs());
    }

    @Test
    void annotateDoesNotModifyItsInput() {
        ControlFlowGraph plain = CfgBuilder.build(routine("R", assign("A", 1)));
        ControlFlowGraph annotated = DataFlowAnalyzer.annotate(plain);

        assertTrue(plain.getEntry().getDefs().isEmpty());
        assertEquals(Set.of("A"), annotated.getEntry().getDefs());
    }

    @Test
    void crossRoutineFlowListsReadersButNotTheWriterItself() {
        Controller controller = controller("PLC1", List.of(integer("COUNT"), bit("ALARM")),
                routine("Count", assign("COUNT", tag("COUNT"))),
                routine("Alarm", when(gt("COUNT", 10), assign("ALARM", true))),
                routine("Hmi", assign("DISPLAY", tag("COUNT"))));

        List<CrossDependency> flows = DataFlowAnalyzer.crossRoutineFlows(List.of(controller));

        assertEquals(1, flows.size());
        CrossDependency count = flows.get(0);
        assertEquals("COUNT", count.getTag());
        assertEquals("PLC1/MainProgram/Count", count.getWriter());
        assertEquals(List.of("PLC1/MainProgram/Alarm", "PLC1/MainProgram/Hmi"), count.getReaders());
    }

    @Test
    void summarizeVisitsRoutinesInDeclarationOrder() {
        Controller controller = controller("PLC1", List.of(),
                routine("Second", assign("X", 1)), routine("First", assign("Y", tag("X"))));

        List<RoutineFacts> facts = DataFlowAnalyzer.summarize(controller);

        assertEquals(List.of("Second", "First"), facts.stream().map(f -> f.getRef().getRoutine()).toList());
        assertEquals(Set.of("X"), facts.get(1).getUses());
    }
}
