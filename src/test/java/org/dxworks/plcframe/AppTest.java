package org.dxworks.plcframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.plcframe.export.ControllerReport;
import org.dxworks.plcframe.export.DependencyRecord;
import org.dxworks.plcframe.export.ProjectReport;
import org.dxworks.plcframe.export.ReportRecord;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.ControllerOverlay;
import org.dxworks.plcframe.validation.DiagnosticKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Path resource(String name) throws Exception {
        return Paths.get(AppTest.class.getResource("/ir/" + name).toURI());
    }

    private static List<ReportRecord> analyzeFixtures(PlcframeConfig config) throws Exception {
        List<Controller> controllers = List.of(App.readController(resource("line1.json")),
                App.readController(resource("line2.json")));
        ControllerOverlay overlay = App.readOverlay(resource("line2.overlay.json"));
        return App.analyze(controllers, Map.of("Line2", overlay), config, FsmConfigLoader.empty());
    }

    @Test
    void oneRecordPerControllerThenProject() throws Exception {
        List<ReportRecord> records = analyzeFixtures(PlcframeConfig.with(false, null, false));

        assertEquals(List.of("controller", "controller", "project"),
                records.stream().map(ReportRecord::getKind).toList());
        ControllerReport line1 = (ControllerReport) records.get(0);
        assertEquals("Line1", line1.name);
        assertEquals(7, line1.tags);
        assertEquals(2, line1.routines);
        assertEquals("HMI_P1_STATE", line1.fsm.getStateVariable());
        assertEquals("IDLE", line1.fsm.getInitialState().orElseThrow().getName());
        assertTrue(line1.graphs.isEmpty());
        assertTrue(line1.diagnostics.stream().anyMatch(d -> d.getKind() == DiagnosticKind.UNRESOLVED_REFERENCE
                && d.getMessage().contains("Conveyor")));

        ControllerReport line2 = (ControllerReport) records.get(1);
        assertTrue(line2.hasOverlay);
        assertEquals(4, line2.tags);
        assertEquals("CONVEYOR", line2.fsm.getStateVariable());
        assertTrue(line2.diagnostics.stream().anyMatch(d -> d.getKind() == DiagnosticKind.STRUCTURAL_GAP));
    }

    @Test
    void projectRecordCarriesDependenciesAndConflicts() throws Exception {
        ProjectReport project = (ProjectReport) analyzeFixtures(PlcframeConfig.with(true, null, false)).get(2);

        assertEquals(List.of("Line1", "Line2"), project.controllers);
        assertEquals(List.of("LEVEL", "LINE_READY"), project.sharedTags);
        assertTrue(project.missingOverlays.isEmpty());

        assertEquals(1, project.crossPlcDependencies.size());
        DependencyRecord dependency = project.crossPlcDependencies.get(0);
        assertEquals("LINE_READY", dependency.tag);
        assertEquals("Line1", dependency.writer);
        assertEquals(List.of("Line2"), dependency.readers);
        assertEquals("BOOL", dependency.dataType);

        assertEquals(1, project.conflicts.size());
        assertEquals("LEVEL", project.conflicts.get(0).tag);
        assertEquals("type_mismatch", project.conflicts.get(0).conflictType);
        assertEquals(Map.of("Line1", "REAL", "Line2", "DINT"), project.conflicts.get(0).details);
        assertTrue(project.linkedTransitions.isEmpty());
    }

    @Test
    void strictModeReportsControllerWithoutOverlay() throws Exception {
        List<Controller> controllers = List.of(App.readController(resource("line2.json")));

        ProjectReport project = (ProjectReport) App.analyze(controllers, Map.of(),
                PlcframeConfig.with(true, null, false), FsmConfigLoader.empty()).get(1);

        assertEquals(List.of("Line2"), project.missingOverlays);
        assertEquals(DiagnosticKind.MISSING_OVERLAY, project.diagnostics.get(0).getKind());
    }

    @Test
    void graphsAreExportedWhenConfigured() throws Exception {
        ControllerReport line1 = (ControllerReport) analyzeFixtures(PlcframeConfig.with(false, null, true)).get(0);

        assertEquals(List.of("Sequence", "Status"), line1.graphs.stream().map(g -> g.routine).toList());
    }

    @Test
    void runWritesJsonlAndCountsUnreadableFiles(@TempDir Path dir) throws Exception {
        Path input = Files.createDirectories(dir.resolve("input"));
        for (String name : List.of("line1.json", "line2.json", "line2.overlay.json")) {
            Files.copy(resource(name), input.resolve(name));
        }
        Files.copy(resource("line1.json"), input.resolve("zz-line1.json"));
        Files.writeString(input.resolve("broken.json"), "{ \"name\": ");
        Files.writeString(input.resolve("notes.txt"), "ignored");
        Path output = dir.resolve("out/report.jsonl");
        Files.createDirectories(output.getParent());

        int errors = App.run(input, output, PlcframeConfig.with(false, null, false));

        assertEquals(2, errors);
        List<String> kinds = new ArrayList<>();
        List<JsonNode> lines = new ArrayList<>();
        for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
            JsonNode node = MAPPER.readTree(line);
            lines.add(node);
            kinds.add(node.get("kind").asText());
        }
        assertEquals(List.of("run", "error", "error", "controller", "controller", "project", "done"), kinds);
        assertEquals(4, lines.get(0).get("total_files").asInt());
        assertTrue(lines.get(2).get("error").asText().contains("Duplicate controller name Line1"));
        assertTrue(lines.get(3).get("file").asText().endsWith("line1.json"));
        assertEquals(2, lines.get(6).get("files_with_errors").asInt());
    }
}
