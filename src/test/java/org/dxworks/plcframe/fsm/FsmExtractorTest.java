package org.dxworks.plcframe.fsm;

import org.approvaltests.Approvals;
import org.dxworks.plcframe.TestUtils;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.DataType;
import org.dxworks.plcframe.model.Tag;
import org.dxworks.plcframe.model.expr.BinaryOp;
import org.dxworks.plcframe.model.expr.Literal;
import org.dxworks.plcframe.model.instruction.Assignment;
import org.dxworks.plcframe.model.instruction.CaseArm;
import org.dxworks.plcframe.model.instruction.Instruction;
import org.dxworks.plcframe.validation.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.plcframe.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class FsmExtractorTest {

    private static Controller hmiSequence() {
        return controller("Line1",
                List.of(Tag.global("HMI_P1_STATE", DataType.INTEGER).withInitialValue("0"),
                        bit("START_PB"), real("LEVEL"), bit("DRAINED"), bit("PUMP")),
                routine("Sequence", caseOf("HMI_P1_STATE",
                        arm(0, when(tag("START_PB"), assign("HMI_P1_STATE", 1), assign("PUMP", true))),
                        arm(1, when(gt("LEVEL", 80), assign("HMI_P1_STATE", 2))),
                        arm(2, when(tag("DRAINED"), assign("HMI_P1_STATE", 3), assign("PUMP", false))),
                        arm(3))));
    }

    @Test
    void caseSelectorWithFourValuesYieldsFourStates() {
        FsmModel fsm = FsmExtractor.extract(hmiSequence());

        assertEquals("HMI_P1_STATE", fsm.getStateVariable());
        assertEquals(List.of("0", "1", "2", "3"), fsm.getStates().stream().map(FsmState::getName).toList());
        assertEquals(StateClassification.INITIAL, fsm.findState("0").orElseThrow().getClassification());
        assertEquals(StateClassification.TERMINAL, fsm.findState("3").orElseThrow().getClassification());
        assertEquals(3, fsm.getTransitions().size());
        assertTrue(fsm.getDiagnostics().isEmpty());
    }

    @Test
    void extractsHmiStateMachine() throws Exception {
        Approvals.verify(TestUtils.approvalJson(FsmExtractor.extract(hmiSequence())));
    }

    @Test
    void noMultiValuedTagGivesEmptyModelWithReason() {
        Controller controller = controller("C", List.of(bit("START"), bit("MOTOR")),
                routine("R", when(tag("START"), assign("MOTOR", true))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertTrue(fsm.isEmpty());
        assertTrue(fsm.getStates().isEmpty());
        assertTrue(fsm.getTransitions().isEmpty());
        assertEquals(FsmExtractor.NO_CANDIDATE_REASON, fsm.getReason());
    }

    @Test
    void configuredStateVariableAlwaysWins() {
        Controller controller = controller("C", List.of(integer("STEP"), integer("MODE")),
                routine("R",
                        caseOf("STEP", arm(0, assign("STEP", 1)), arm(1, assign("STEP", 2)), arm(2, assign("STEP", 0))),
                        when(tag("AUTO"), assign("MODE", 1)),
                        when(tag("MANUAL"), assign("MODE", 2))));

        assertEquals("STEP", FsmExtractor.extract(controller).getStateVariable());
        assertEquals("MODE", FsmExtractor.extract(controller, FsmConfig.forStateVariable("MODE")).getStateVariable());
    }

    @Test
    void configuredStateVariableThatNeverTakesALiteralGivesEmptyModel() {
        Controller controller = controller("C", List.of(integer("STEP")),
                routine("R", caseOf("STEP", arm(0, assign("STEP", 1)), arm(1, assign("STEP", 0)))));

        FsmModel fsm = FsmExtractor.extract(controller, FsmConfig.forStateVariable("MISSING"));

        assertTrue(fsm.isEmpty());
        assertTrue(fsm.getReason().contains("MISSING"));
    }

    @Test
    void tiedCandidatesResolveByDeclarationOrder() {
        Controller controller = controller("C", List.of(integer("B_STATE"), integer("A_STATE")),
                routine("R",
                        when(tag("X"), assign("A_STATE", 1)),
                        when(tag("Y"), assign("A_STATE", 2)),
                        when(tag("X"), assign("B_STATE", 1)),
                        when(tag("Y"), assign("B_STATE", 2))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertEquals("B_STATE", fsm.getStateVariable());
        assertEquals(1, fsm.getDiagnostics().size());
        assertEquals(DiagnosticKind.AMBIGUOUS_STATE_VARIABLE, fsm.getDiagnostics().get(0).getKind());
    }

    @Test
    void equalityConjunctPinsTheSourceState() {
        Controller controller = controller("C", List.of(integer("STATE")),
                routine("R",
                        when(BinaryOp.and(eq("STATE", 1), tag("START")), assign("STATE", 2)),
                        when(tag("RESET"), assign("STATE", 0))));

        FsmModel fsm = FsmExtractor.extract(controller);
        FsmTransition start = fsm.getTransitions().get(0);
        FsmTransition reset = fsm.getTransitions().get(1);

        assertEquals("1", start.getFrom());
        assertEquals("2", start.getTo());
        assertEquals("(STATE = 1) AND START", start.getGuard());
        assertEquals(FsmTransition.ANY, reset.getFrom());
        assertEquals("RESET", reset.getGuard());
        assertEquals(StateClassification.INITIAL, fsm.findState("1").orElseThrow().getClassification());
        assertEquals(StateClassification.INTERMEDIATE, fsm.findState("2").orElseThrow().getClassification());
        assertEquals(StateClassification.TERMINAL, fsm.findState("0").orElseThrow().getClassification());
    }

    @Test
    void multiValueArmLeavesEveryListedState() {
        Controller controller = controller("C", List.of(integer("ST"), bit("GO")),
                routine("R", caseOf("ST",
                        arm(0, when(tag("GO"), assign("ST", 1))),
                        new CaseArm(List.of(Literal.of(1), Literal.of(2)), List.of(when(tag("GO"), assign("ST", 3)))),
                        arm(3, when(tag("GO"), assign("ST", 0))))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertEquals(List.of("0 -> 1", "1 -> 3", "2 -> 3", "3 -> 0"),
                fsm.getTransitions().stream().map(t -> t.getFrom() + " -> " + t.getTo()).toList());
        assertEquals(StateClassification.INTERMEDIATE, fsm.findState("1").orElseThrow().getClassification());
        assertEquals(StateClassification.INTERMEDIATE, fsm.findState("2").orElseThrow().getClassification());
        assertEquals(StateClassification.INTERMEDIATE, fsm.findState("3").orElseThrow().getClassification());
    }

    @Test
    void defaultArmLeavesStatesNoArmLists() {
        Controller controller = controller("C", List.of(integer("ST"), bit("GO"), bit("FAULT")),
                routine("R", caseOf("ST",
                        List.of(arm(0, when(tag("GO"), assign("ST", 1))), arm(1, when(tag("GO"), assign("ST", 2)))),
                        List.of(when(tag("FAULT"), assign("ST", 0))))));

        FsmModel fsm = FsmExtractor.extract(controller);

        FsmTransition recover = fsm.getTransitions().get(2);
        assertEquals("2", recover.getFrom());
        assertEquals("0", recover.getTo());
        assertEquals(StateClassification.INTERMEDIATE, fsm.findState("2").orElseThrow().getClassification());
    }

    @Test
    void unconditionalResetLeavesEveryOtherState() {
        Controller controller = controller("C", List.of(integer("ST"), bit("GO"), bit("ESTOP")),
                routine("R",
                        when(tag("ESTOP"), assign("ST", 0)),
                        caseOf("ST",
                                arm(0, when(tag("GO"), assign("ST", 1))),
                                arm(1, when(tag("GO"), assign("ST", 2))),
                                arm(2))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertEquals(FsmTransition.ANY, fsm.getTransitions().get(0).getFrom());
        assertEquals(StateClassification.INITIAL, fsm.findState("0").orElseThrow().getClassification());
        assertEquals(StateClassification.INTERMEDIATE, fsm.findState("1").orElseThrow().getClassification());
        assertEquals(StateClassification.INTERMEDIATE, fsm.findState("2").orElseThrow().getClassification());
    }

    @Test
    void physicalHintsAreCheckedAgainstTagsAndStates() {
        FsmConfig hints = new FsmConfig(null, null, null, List.of("LEVEL", "position"),
                Map.of("1", "level' = inflow", "HEATING", "temperature' = rate"), null);

        HintCoverage coverage = FsmExtractor.extract(hmiSequence(), hints).getHintCoverage();

        assertTrue(coverage.isValid());
        assertEquals(List.of("position"), coverage.getUnknownPhysicalVars());
        assertEquals(List.of("HEATING"), coverage.getUnmatchedPlantDynamics());
        assertTrue(coverage.getMissingStates().isEmpty());
    }

    @Test
    void elseBranchGuardIsNegated() {
        Controller controller = controller("C", List.of(integer("STATE")),
                routine("R", ifElse(gt("LEVEL", 80), List.of(assign("STATE", 1)), List.of(assign("STATE", 0)))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertEquals("LEVEL > 80", fsm.getTransitions().get(0).getGuard());
        assertEquals("NOT (LEVEL > 80)", fsm.getTransitions().get(1).getGuard());
    }

    @Test
    void selfAssignmentIsNotATransition() {
        Controller controller = controller("C", List.of(integer("S")),
                routine("R", caseOf("S", arm(1, assign("S", 1)), arm(2, assign("S", 1)))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertEquals(1, fsm.getTransitions().size());
        assertEquals("2", fsm.getTransitions().get(0).getFrom());
        assertEquals("1", fsm.getTransitions().get(0).getTo());
    }

    @Test
    void symbolicLabelsNameTheStates() {
        Instruction toRunning = new Assignment(tag("MODE"), Literal.labeled(1, "RUNNING"));
        Instruction toIdle = new Assignment(tag("MODE"), Literal.labeled(0, "IDLE"));
        Controller controller = controller("C", List.of(integer("MODE")),
                routine("R", caseOf("MODE",
                        new CaseArm(List.of(Literal.labeled(0, "IDLE")), List.of(when(tag("GO"), toRunning))),
                        new CaseArm(List.of(Literal.labeled(1, "RUNNING")), List.of(when(tag("STOP"), toIdle))))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertEquals(List.of("IDLE", "RUNNING"), fsm.getStates().stream().map(FsmState::getName).toList());
        assertEquals("IDLE", fsm.getTransitions().get(0).getFrom());
        assertEquals("RUNNING", fsm.getTransitions().get(0).getTo());
    }

    @Test
    void booleanStateVariableIsImplicit() {
        Controller controller = controller("C", List.of(bit("RUNNING")),
                routine("R", when(tag("START"), assign("RUNNING", true)), when(tag("STOP"), assign("RUNNING", false))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertTrue(fsm.isImplicit());
        assertEquals("FSM_RUNNING", fsm.getName());
    }

    @Test
    void selectorReassignedOutsideBranchesIsFlaggedAmbiguous() {
        Controller controller = controller("C", List.of(integer("S")),
                routine("R", assign("S", 0), caseOf("S", arm(0, assign("S", 1)), arm(1, assign("S", 0)))));

        FsmModel fsm = FsmExtractor.extract(controller);

        assertEquals("S", fsm.getStateVariable());
        assertTrue(fsm.getDiagnostics().stream()
                .anyMatch(d -> d.getKind() == DiagnosticKind.AMBIGUOUS_STATE_VARIABLE));
    }

    @Test
    void hintsAreCheckedWithoutChangingTheModel() {
        Controller controller = controller("C", List.of(integer("MODE")),
                routine("R", caseOf("MODE",
                        new CaseArm(List.of(Literal.symbol("IDLE")), List.of(when(tag("GO"),
                                new Assignment(tag("MODE"), Literal.symbol("RUNNING"))))),
                        new CaseArm(List.of(Literal.symbol("RUNNING")), List.of(when(tag("END"),
                                new Assignment(tag("MODE"), Literal.symbol("DONE"))))))));
        FsmConfig hints = FsmConfig.EMPTY
                .withExplicitStates(List.of("IDLE", "RUNNING", "FAULT"))
                .withTransitionHints(Map.of("RUNNING", List.of("start_pressed"), "FAULT", List.of("estop")));

        FsmModel plain = FsmExtractor.extract(controller);
        FsmModel hinted = FsmExtractor.extract(controller, hints);

        assertEquals(plain.getStates().size(), hinted.getStates().size());
        assertNull(plain.getHintCoverage());
        HintCoverage coverage = hinted.getHintCoverage();
        assertFalse(coverage.isValid());
        assertEquals(List.of("FAULT"), coverage.getMissingStates());
        assertEquals(List.of("DONE"), coverage.getExtraStates());
        assertEquals(List.of("FAULT"), coverage.getUnmatchedTransitionHints());
    }
}
