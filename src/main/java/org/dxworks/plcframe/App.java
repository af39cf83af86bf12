package org.dxworks.plcframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.plcframe.export.ControllerReport;
import org.dxworks.plcframe.export.Exporter;
import org.dxworks.plcframe.export.ReportRecord;
import org.dxworks.plcframe.fsm.CompositeFsm;
import org.dxworks.plcframe.fsm.CompositeFsmExtractor;
import org.dxworks.plcframe.fsm.FsmModel;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.ControllerOverlay;
import org.dxworks.plcframe.project.AggregationResult;
import org.dxworks.plcframe.project.ProjectIR;
import org.dxworks.plcframe.validation.Diagnostic;
import org.dxworks.plcframe.validation.IrValidator;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    static final String OVERLAY_SUFFIX = ".overlay.json";
    static final String IR_SUFFIX = ".json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar plcframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Controller IR JSON files; *" + OVERLAY_SUFFIX + " files are overlays");
            System.err.println("  <output-file>:  Path to output JSONL report");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting PLC analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        PlcframeConfig config = PlcframeConfig.load();
        int errors = run(input, jsonlOutput, config);
        System.exit(errors > 0 ? 1 : 0);
    }

    /**
     * Reads every IR and overlay file under {@code input}, analyzes them as one project
     * and writes the JSONL report. Returns the number of files that could not be read.
     */
    public static int run(Path input, Path jsonlOutput, PlcframeConfig config) throws IOException {
        List<Path> irFiles = new ArrayList<>();
        List<Path> overlayFiles = new ArrayList<>();
        collectInputFiles(input, irFiles, overlayFiles);
        System.out.println("Found " + irFiles.size() + " controller IR files and " + overlayFiles.size() + " overlays");

        FsmConfigLoader hints = loadHints(config);
        Instant startTime = Instant.now();
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", irFiles.size());
            runInfo.put("strict_overlays", config.isStrictOverlays());
            writeLine(writer, runInfo);

            Map<Path, Controller> loaded = new ConcurrentHashMap<>();
            irFiles.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + irFiles.size() + "] Reading " + file.getFileName());
                }
                try {
                    loaded.put(file, readController(file));
                } catch (Exception e) {
                    errorCount.incrementAndGet();
                    writeError(writer, file, e);
                }
            });

            Map<String, ControllerOverlay> overlays = new HashMap<>();
            for (Path file : overlayFiles) {
                try {
                    ControllerOverlay overlay = readOverlay(file);
                    overlays.put(overlay.getController(), overlay);
                } catch (Exception e) {
                    errorCount.incrementAndGet();
                    writeError(writer, file, e);
                }
            }

            // Joined by controller name so the report does not depend on thread scheduling.
            List<Map.Entry<Path, Controller>> ordered = new ArrayList<>(loaded.entrySet());
            ordered.sort(Comparator.comparing((Map.Entry<Path, Controller> e) -> e.getValue().getName())
                    .thenComparing(e -> e.getKey().toString()));
            List<Controller> controllers = new ArrayList<>();
            Map<String, Path> sources = new HashMap<>();
            for (Map.Entry<Path, Controller> entry : ordered) {
                String name = entry.getValue().getName();
                if (sources.containsKey(name)) {
                    errorCount.incrementAndGet();
                    writeError(writer, entry.getKey(),
                            new IllegalArgumentException("Duplicate controller name " + name + ", first read from "
                                    + sources.get(name).getFileName()));
                    continue;
                }
                sources.put(name, entry.getKey());
                controllers.add(entry.getValue());
            }

            System.out.println("Aggregating " + controllers.size() + " controllers");
            for (ReportRecord record : analyze(controllers, overlays, config, hints)) {
                if (record instanceof ControllerReport controllerReport) {
                    Path source = sources.get(controllerReport.name);
                    controllerReport.file = source != null ? source.toString() : null;
                }
                writeLine(writer, record);
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("controllers_analyzed", controllers.size());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeLine(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
        return errorCount.get();
    }

    /**
     * One {@code controller} record per controller in project order, then the
     * {@code project} record.
     */
    public static List<ReportRecord> analyze(List<Controller> controllers, Map<String, ControllerOverlay> overlays,
                                             PlcframeConfig config, FsmConfigLoader hints) {
        AggregationResult aggregation = ProjectIR.fromControllers(controllers, overlays, config.isStrictOverlays());
        ProjectIR project = aggregation.getProject();
        for (String missing : aggregation.getMissingOverlays()) {
            System.err.println("[App] No overlay for " + missing + "; tag context may be incomplete");
        }

        CompositeFsm composite = CompositeFsmExtractor.extract(project, hints);
        List<ReportRecord> records = new ArrayList<>();
        List<Controller> merged = project.getControllers();
        for (int i = 0; i < merged.size(); i++) {
            Controller controller = merged.get(i);
            List<Diagnostic> diagnostics = new ArrayList<>(IrValidator.validate(controller));
            project.getDiagnostics().stream()
                    .filter(d -> controller.getName().equals(d.getController()))
                    .forEach(diagnostics::add);
            FsmModel fsm = composite.getFsms().get(i);
            records.add(Exporter.controller(controller, fsm, diagnostics, project.getRoutineFacts(),
                    config.isIncludeCfgs()));
        }
        records.add(Exporter.project(aggregation, composite));
        return records;
    }

    public static Controller readController(Path file) throws IOException {
        return MAPPER.readValue(file.toFile(), Controller.class);
    }

    public static ControllerOverlay readOverlay(Path file) throws IOException {
        return MAPPER.readValue(file.toFile(), ControllerOverlay.class);
    }

    private static FsmConfigLoader loadHints(PlcframeConfig config) {
        if (config.getFsmConfigPath() == null) {
            return FsmConfigLoader.empty();
        }
        try {
            return FsmConfigLoader.load(Paths.get(config.getFsmConfigPath()));
        } catch (IOException e) {
            System.err.println("[App] Ignoring FSM hints from " + config.getFsmConfigPath() + ": " + e.getMessage());
            return FsmConfigLoader.empty();
        }
    }

    private static void collectInputFiles(Path input, List<Path> irFiles, List<Path> overlayFiles) throws IOException {
        List<Path> candidates = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile).sorted().forEach(candidates::add);
            }
        } else if (Files.isRegularFile(input)) {
            candidates.add(input);
        }
        for (Path path : candidates) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (name.endsWith(OVERLAY_SUFFIX)) {
                overlayFiles.add(path);
            } else if (name.endsWith(IR_SUFFIX)) {
                irFiles.add(path);
            }
        }
    }

    private static void writeError(BufferedWriter writer, Path file, Exception e) {
        Map<String, String> error = new HashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("error", e.getMessage());
        try {
            writeLine(writer, error);
        } catch (IOException ioException) {
            System.err.println("[App] Failed to write error for " + file + ": " + ioException.getMessage());
        }
        synchronized (System.err) {
            System.err.println("[App] Error reading " + file.getFileName() + ": " + e.getMessage());
        }
    }

    private static void writeLine(BufferedWriter writer, Object record) throws IOException {
        synchronized (writer) {
            writer.write(MAPPER.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        }
    }
}
