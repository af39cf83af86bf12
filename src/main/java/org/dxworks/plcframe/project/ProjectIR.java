package org.dxworks.plcframe.project;

import org.dxworks.plcframe.dataflow.CrossDependency;
import org.dxworks.plcframe.dataflow.DataFlowAnalyzer;
import org.dxworks.plcframe.dataflow.RoutineFacts;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.ControllerOverlay;
import org.dxworks.plcframe.model.Program;
import org.dxworks.plcframe.model.Tag;
import org.dxworks.plcframe.model.expr.TagRef;
import org.dxworks.plcframe.validation.Diagnostic;
import org.dxworks.plcframe.validation.DiagnosticKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only union of N controller IRs, rebuilt for every analysis run. Controllers keep
 * their own namespaces: identical bare tag names are indexed together for conflict
 * analysis but never merged.
 */
public final class ProjectIR {

    private final List<Controller> controllers;
    private final List<Diagnostic> diagnostics;
    private final Map<String, List<TagDeclaration>> tagIndex;
    private final List<RoutineFacts> routineFacts;

    private ProjectIR(List<Controller> controllers, List<Diagnostic> diagnostics) {
        this.controllers = List.copyOf(controllers);
        this.diagnostics = List.copyOf(diagnostics);
        this.tagIndex = indexTags(this.controllers);
        this.routineFacts = DataFlowAnalyzer.summarize(this.controllers);
    }

    public static ProjectIR of(List<Controller> controllers) {
        return fromControllers(controllers, Map.of(), false).getProject();
    }

    /**
     * Aggregates controllers in the given order, merging each controller's overlay when
     * one is supplied. Under strict mode a controller whose source type expects an
     * overlay and has none is reported in {@code missingOverlays}; analysis proceeds
     * with the reduced context either way.
     *
     * @throws IllegalArgumentException if two controllers share a name
     */
    public static AggregationResult fromControllers(List<Controller> controllers,
                                                    Map<String, ControllerOverlay> overlays,
                                                    boolean strict) {
        Set<String> names = new HashSet<>();
        List<Controller> merged = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Controller controller : controllers) {
            if (!names.add(controller.getName())) {
                throw new IllegalArgumentException("Duplicate controller name: " + controller.getName());
            }
            ControllerOverlay overlay = overlays.get(controller.getName());
            if (overlay != null) {
                merged.add(controller.withOverlay(overlay));
                continue;
            }
            merged.add(controller);
            if (strict && controller.getSourceType().expectsOverlay() && !controller.hasOverlay()) {
                missing.add(controller.getName());
                diagnostics.add(new Diagnostic(DiagnosticKind.MISSING_OVERLAY, controller.getName(), null,
                        "Overlay not provided for " + controller.getName()
                                + "; tag and task context may be incomplete"));
            }
        }
        return new AggregationResult(new ProjectIR(merged, diagnostics), missing);
    }

    private static Map<String, List<TagDeclaration>> indexTags(List<Controller> controllers) {
        Map<String, List<TagDeclaration>> index = new TreeMap<>();
        for (Controller controller : controllers) {
            for (Tag tag : controller.getTags()) {
                index.computeIfAbsent(tag.getName(), k -> new ArrayList<>())
                        .add(new TagDeclaration(controller.getName(), null, tag));
            }
            for (Program program : controller.getPrograms()) {
                for (Tag tag : program.getTags()) {
                    index.computeIfAbsent(tag.getName(), k -> new ArrayList<>())
                            .add(new TagDeclaration(controller.getName(), program.getName(), tag));
                }
            }
        }
        Map<String, List<TagDeclaration>> frozen = new TreeMap<>();
        index.forEach((name, decls) -> frozen.put(name, List.copyOf(decls)));
        return Collections.unmodifiableMap(frozen);
    }

    public List<Controller> getControllers() {
        return controllers;
    }

    public Optional<Controller> getController(String name) {
        return controllers.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public List<String> getControllerNames() {
        return controllers.stream().map(Controller::getName).toList();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** Declarations by bare tag name, ignoring controller qualification. Sorted by name. */
    public Map<String, List<TagDeclaration>> getTagIndex() {
        return tagIndex;
    }

    public List<RoutineFacts> getRoutineFacts() {
        return routineFacts;
    }

    /** Bare names declared by at least two controllers. */
    public List<String> sharedTagCandidates() {
        List<String> shared = new ArrayList<>();
        tagIndex.forEach((name, decls) -> {
            if (controllersOf(decls).size() >= 2) {
                shared.add(name);
            }
        });
        return shared;
    }

    /** Routine-scope flows across every program and controller of the project. */
    public List<CrossDependency> crossRoutineFlows() {
        return DataFlowAnalyzer.crossRoutineFlowsOf(routineFacts);
    }

    /**
     * Tags written by one controller and read by others. Sorted by tag name, then by
     * writer in controller declaration order; readers in declaration order.
     */
    public List<CrossDependency> findCrossPlcDependencies() {
        Map<String, SortedSet<String>> defsByController = new LinkedHashMap<>();
        Map<String, SortedSet<String>> usesByController = new LinkedHashMap<>();
        for (Controller controller : controllers) {
            defsByController.put(controller.getName(), new TreeSet<>());
            usesByController.put(controller.getName(), new TreeSet<>());
        }
        for (RoutineFacts facts : routineFacts) {
            defsByController.get(facts.getRef().getController()).addAll(facts.getDefs());
            usesByController.get(facts.getRef().getController()).addAll(facts.getUses());
        }

        SortedSet<String> written = new TreeSet<>();
        defsByController.values().forEach(written::addAll);

        List<CrossDependency> dependencies = new ArrayList<>();
        for (String tag : written) {
            for (Controller writer : controllers) {
                if (!defsByController.get(writer.getName()).contains(tag)) {
                    continue;
                }
                List<String> readers = new ArrayList<>();
                for (Controller reader : controllers) {
                    if (reader != writer && usesByController.get(reader.getName()).contains(tag)) {
                        readers.add(reader.getName());
                    }
                }
                if (!readers.isEmpty()) {
                    String dataType = declaration(writer, TagRef.parse(tag).getBase())
                            .map(Tag::declaredType)
                            .orElse(null);
                    dependencies.add(new CrossDependency(tag, writer.getName(), readers, dataType));
                }
            }
        }
        return dependencies;
    }

    /**
     * For each bare name declared in two or more controllers: differing declared types
     * are a type mismatch; equal types used through disjoint member shapes are a name
     * collision; equal types with compatible usage are an intentionally shared tag.
     * Sorted by tag name.
     */
    public List<Conflict> detectConflictingTags() {
        List<Conflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<TagDeclaration>> entry : tagIndex.entrySet()) {
            String name = entry.getKey();
            Map<String, Tag> firstByController = new LinkedHashMap<>();
            for (TagDeclaration decl : entry.getValue()) {
                firstByController.putIfAbsent(decl.getController(), decl.getTag());
            }
            if (firstByController.size() < 2) {
                continue;
            }
            List<String> involved = new ArrayList<>(firstByController.keySet());

            if (hasTypeMismatch(firstByController.values())) {
                Map<String, String> details = new LinkedHashMap<>();
                firstByController.forEach((controller, tag) -> details.put(controller, tag.declaredType()));
                conflicts.add(new Conflict(name, ConflictKind.TYPE_MISMATCH, involved, details));
                continue;
            }

            Map<String, SortedSet<String>> shapes = new LinkedHashMap<>();
            for (String controller : involved) {
                SortedSet<String> shape = memberShape(controller, name);
                if (!shape.isEmpty()) {
                    shapes.put(controller, shape);
                }
            }
            if (hasDisjointShapes(shapes)) {
                Map<String, String> details = new LinkedHashMap<>();
                shapes.forEach((controller, shape) -> details.put(controller, String.join(",", shape)));
                conflicts.add(new Conflict(name, ConflictKind.NAME_COLLISION, new ArrayList<>(shapes.keySet()), details));
            }
        }
        return conflicts;
    }

    private static boolean hasTypeMismatch(Iterable<Tag> tags) {
        Tag first = null;
        for (Tag tag : tags) {
            if (first == null) {
                first = tag;
            } else if (!first.sameDeclaredType(tag)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasDisjointShapes(Map<String, SortedSet<String>> shapes) {
        List<SortedSet<String>> all = new ArrayList<>(shapes.values());
        for (int i = 0; i < all.size(); i++) {
            for (int j = i + 1; j < all.size(); j++) {
                if (Collections.disjoint(all.get(i), all.get(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    // Member suffixes through which a controller's routines reach the given base tag.
    private SortedSet<String> memberShape(String controller, String base) {
        SortedSet<String> shape = new TreeSet<>();
        for (RoutineFacts facts : routineFacts) {
            if (!facts.getRef().getController().equals(controller)) {
                continue;
            }
            Set<String> touched = new LinkedHashSet<>(facts.getDefs());
            touched.addAll(facts.getUses());
            for (String identity : touched) {
                TagRef ref = TagRef.parse(identity);
                if (ref.getBase().equals(base) && ref.hasMember()) {
                    shape.add(ref.getMember());
                }
            }
        }
        return shape;
    }

    private static Optional<Tag> declaration(Controller controller, String base) {
        Optional<Tag> global = controller.findGlobalTag(base);
        if (global.isPresent()) {
            return global;
        }
        return controller.getPrograms().stream()
                .map(p -> p.findTag(base))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Set<String> controllersOf(List<TagDeclaration> decls) {
        Set<String> out = new LinkedHashSet<>();
        decls.forEach(d -> out.add(d.getController()));
        return out;
    }
}
