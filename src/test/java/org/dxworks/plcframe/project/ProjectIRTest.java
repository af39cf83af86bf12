package org.dxworks.plcframe.project;

import org.dxworks.plcframe.dataflow.CrossDependency;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.ControllerOverlay;
import org.dxworks.plcframe.model.DataType;
import org.dxworks.plcframe.model.Tag;
import org.dxworks.plcframe.validation.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.plcframe.TestIr.*;
import static org.junit.jupiter.api.Assertions.*;

public class ProjectIRTest {

    @Test
    void writerInOneControllerAndReaderInAnotherIsADependency() {
        Controller a = controller("A", List.of(real("LEVEL")), routine("R1", assign("LEVEL", 42)));
        Controller b = controller("B", List.of(real("LEVEL"), bit("HIGH")),
                routine("R2", when(gt("LEVEL", 80), assign("HIGH", true))));

        ProjectIR project = ProjectIR.of(List.of(a, b));

        assertEquals(List.of(new CrossDependency("LEVEL", "A", List.of("B"), "real")),
                project.findCrossPlcDependencies());
        assertTrue(project.detectConflictingTags().isEmpty());
    }

    @Test
    void differingTypesWithoutReferencesAreOnlyAConflict() {
        Controller a = controller("A", List.of(bit("MODE")));
        Controller b = controller("B", List.of(integer("MODE")));

        ProjectIR project = ProjectIR.of(List.of(a, b));

        assertTrue(project.findCrossPlcDependencies().isEmpty());
        List<Conflict> conflicts = project.detectConflictingTags();
        assertEquals(1, conflicts.size());
        assertEquals("MODE", conflicts.get(0).getTag());
        assertEquals(ConflictKind.TYPE_MISMATCH, conflicts.get(0).getKind());
        assertEquals(List.of("A", "B"), conflicts.get(0).getControllers());
        assertEquals(Map.of("A", "bit", "B", "integer"), conflicts.get(0).getDetails());
    }

    @Test
    void sameNameWithSameTypeIsNotAConflict() {
        ProjectIR sameType = ProjectIR.of(List.of(
                controller("P1", List.of(real("LIT301"))),
                controller("P2", List.of(real("LIT301")))));
        ProjectIR otherType = ProjectIR.of(List.of(
                controller("P1", List.of(real("LIT301"))),
                controller("P2", List.of(integer("LIT301")))));

        assertTrue(sameType.detectConflictingTags().isEmpty());
        assertEquals(1, otherType.detectConflictingTags().size());
        assertEquals(ConflictKind.TYPE_MISMATCH, otherType.detectConflictingTags().get(0).getKind());
    }

    @Test
    void vendorTypeNamesCompareIgnoringCase() {
        Tag upper = Tag.global("TT101", DataType.REAL).withTypeName("REAL");
        Tag lower = Tag.global("TT101", DataType.REAL).withTypeName("Real");
        Tag dint = Tag.global("TT101", DataType.INTEGER).withTypeName("DINT");

        assertTrue(ProjectIR.of(List.of(controller("A", List.of(upper)), controller("B", List.of(lower))))
                .detectConflictingTags().isEmpty());
        Conflict conflict = ProjectIR.of(List.of(controller("A", List.of(upper)), controller("B", List.of(dint))))
                .detectConflictingTags().get(0);
        assertEquals(Map.of("A", "REAL", "B", "DINT"), conflict.getDetails());
    }

    @Test
    void disjointMemberUsageOfSameTypedTagIsANameCollision() {
        Tag valve = Tag.global("Valve", DataType.UDT).withTypeName("VALVE_T");
        Controller a = controller("A", List.of(valve), routine("R", assign("Valve.Open", true)));
        Controller b = controller("B", List.of(valve), routine("R", assign("OUT", tag("Valve.Position"))));

        List<Conflict> conflicts = ProjectIR.of(List.of(a, b)).detectConflictingTags();

        assertEquals(1, conflicts.size());
        assertEquals(ConflictKind.NAME_COLLISION, conflicts.get(0).getKind());
        assertEquals(Map.of("A", ".Open", "B", ".Position"), conflicts.get(0).getDetails());
    }

    @Test
    void overlappingMemberUsageIsIntentionalSharing() {
        Tag valve = Tag.global("Valve", DataType.UDT).withTypeName("VALVE_T");
        Controller a = controller("A", List.of(valve), routine("R", assign("Valve.Open", true)));
        Controller b = controller("B", List.of(valve),
                routine("R", when(tag("Valve.Open"), assign("Valve.Position", 100))));

        ProjectIR project = ProjectIR.of(List.of(a, b));

        assertTrue(project.detectConflictingTags().isEmpty());
        assertEquals(List.of("Valve"), project.sharedTagCandidates());
        assertEquals("Valve.Open", project.findCrossPlcDependencies().get(0).getTag());
    }

    @Test
    void controllerReadingItsOwnWriteIsNotADependency() {
        Controller a = controller("A", List.of(integer("COUNT")),
                routine("Inc", assign("COUNT", 1)), routine("Use", assign("OUT", tag("COUNT"))));
        Controller b = controller("B", List.of());

        ProjectIR project = ProjectIR.of(List.of(a, b));

        assertTrue(project.findCrossPlcDependencies().isEmpty());
        assertEquals(1, project.crossRoutineFlows().size());
    }

    @Test
    void dependenciesAreSortedByTagThenWriterOrder() {
        Controller a = controller("A", List.of(), routine("R", assign("ZETA", 1), assign("ALPHA", 1)));
        Controller b = controller("B", List.of(), routine("R", assign("ALPHA", 2)));
        Controller c = controller("C", List.of(), routine("R", assign("X", tag("ALPHA")), assign("Y", tag("ZETA"))));

        List<CrossDependency> deps = ProjectIR.of(List.of(a, b, c)).findCrossPlcDependencies();

        assertEquals(List.of("ALPHA", "ALPHA", "ZETA"), deps.stream().map(CrossDependency::getTag).toList());
        assertEquals(List.of("A", "B", "A"), deps.stream().map(CrossDependency::getWriter).toList());
        assertNull(deps.get(0).getDataType());
    }

    @Test
    void strictModeReportsRockwellControllersWithoutOverlay() {
        Controller rockwell = rockwell("L1", List.of());
        Controller openplc = controller("O1", List.of());

        AggregationResult strict = ProjectIR.fromControllers(List.of(rockwell, openplc), Map.of(), true);
        AggregationResult lenient = ProjectIR.fromControllers(List.of(rockwell, openplc), Map.of(), false);

        assertEquals(List.of("L1"), strict.getMissingOverlays());
        assertEquals(1, strict.getProject().getDiagnostics().size());
        assertEquals(DiagnosticKind.MISSING_OVERLAY, strict.getProject().getDiagnostics().get(0).getKind());
        assertTrue(lenient.getMissingOverlays().isEmpty());
        assertEquals(2, strict.getProject().getControllers().size());
    }

    @Test
    void overlayAddsUndeclaredTagsOnly() {
        Controller rockwell = rockwell("L1", List.of(integer("SPEED")));
        ControllerOverlay overlay = new ControllerOverlay("L1",
                List.of(real("SPEED"), bit("ESTOP")), "tag database");

        AggregationResult result = ProjectIR.fromControllers(List.of(rockwell), Map.of("L1", overlay), true);
        Controller merged = result.getProject().getControllers().get(0);

        assertTrue(result.getMissingOverlays().isEmpty());
        assertTrue(merged.hasOverlay());
        assertEquals(DataType.INTEGER, merged.findGlobalTag("SPEED").orElseThrow().getDataType());
        assertTrue(merged.findGlobalTag("ESTOP").isPresent());
    }

    @Test
    void duplicateControllerNamesAreRejected() {
        List<Controller> controllers = List.of(controller("A", List.of()), controller("A", List.of()));

        assertThrows(IllegalArgumentException.class, () -> ProjectIR.of(controllers));
    }

    @Test
    void tagIndexKeepsEveryDeclarationUnderTheBareName() {
        Controller a = controller("A", List.of(real("LEVEL")));
        Controller b = new Controller("B", a.getSourceType(),
                List.of(program("Tank", List.of(Tag.local("LEVEL", DataType.REAL)))), List.of());

        ProjectIR project = ProjectIR.of(List.of(a, b));
        List<TagDeclaration> declarations = project.getTagIndex().get("LEVEL");

        assertEquals(2, declarations.size());
        assertNull(declarations.get(0).getProgram());
        assertEquals("Tank", declarations.get(1).getProgram());
        assertEquals(List.of("LEVEL"), project.sharedTagCandidates());
    }
}
