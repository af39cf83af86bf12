package org.dxworks.plcframe.validation;

import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.DataType;
import org.dxworks.plcframe.model.SourceType;
import org.dxworks.plcframe.model.Tag;
import org.dxworks.plcframe.model.expr.RawExpression;
import org.dxworks.plcframe.model.expr.TagRef;
import org.dxworks.plcframe.model.instruction.RawFallback;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.plcframe.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class IrValidatorTest {

    @Test
    void declaredTagsProduceNoDiagnostics() {
        Controller controller = controller("C", List.of(bit("START"), bit("MOTOR")),
                routine("R", when(tag("START"), assign("MOTOR", true))));

        assertTrue(IrValidator.validate(controller).isEmpty());
        assertFalse(IrValidator.hasUnresolvedReferences(controller));
    }

    @Test
    void undeclaredBaseIsReportedOncePerRoutine() {
        Controller controller = controller("C", List.of(bit("MOTOR")),
                routine("R", assign("MOTOR", tag("Pump.Running")), assign("MOTOR", tag("Pump.Fault"))));

        List<Diagnostic> diagnostics = IrValidator.validate(controller);

        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.UNRESOLVED_REFERENCE, diagnostics.get(0).getKind());
        assertEquals("R", diagnostics.get(0).getRoutine());
        assertTrue(diagnostics.get(0).getMessage().contains("Pump"));
    }

    @Test
    void programLocalsResolveInsideTheirProgramOnly() {
        Controller controller = new Controller("C", SourceType.SIEMENS,
                List.of(program("Tank", List.of(Tag.local("LEVEL", DataType.REAL)), routine("Fill", assign("LEVEL", 1))),
                        program("Hmi", List.of(), routine("Show", assign("OUT", tag("LEVEL"))))),
                List.of(real("OUT")));

        List<Diagnostic> diagnostics = IrValidator.validate(controller);

        assertEquals(1, diagnostics.size());
        assertEquals("Show", diagnostics.get(0).getRoutine());
    }

    @Test
    void rawTextIsAStructuralGap() {
        Controller controller = controller("C", List.of(real("A"), real("B")),
                routine("R",
                        new RawFallback("COP(A, B, 1)", List.of(TagRef.of("A"), TagRef.of("B"))),
                        assign("A", new RawExpression("B ** 2", List.of(TagRef.of("B"))))));

        List<Diagnostic> diagnostics = IrValidator.validate(controller);

        assertEquals(2, diagnostics.size());
        assertTrue(diagnostics.stream().allMatch(d -> d.getKind() == DiagnosticKind.STRUCTURAL_GAP));
    }
}
