package org.dxworks.plcframe.query;

import org.dxworks.plcframe.cfg.BasicBlock;
import org.dxworks.plcframe.cfg.ControlFlowGraph;
import org.dxworks.plcframe.dataflow.DataFlowAnalyzer;
import org.dxworks.plcframe.dataflow.RoutineFacts;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.DataType;
import org.dxworks.plcframe.model.Program;
import org.dxworks.plcframe.model.Routine;
import org.dxworks.plcframe.model.Tag;
import org.dxworks.plcframe.model.TagScope;
import org.dxworks.plcframe.model.expr.TagRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Indexed lookups over one controller. Indexes are built once; the controller is
 * immutable so they never go stale.
 */
public final class IrQuery {

    private final Controller controller;
    private final Map<String, Tag> tagIndex = new LinkedHashMap<>();
    private final Map<String, List<Tag>> tagsByPrefix = new LinkedHashMap<>();
    private final Map<String, Routine> routineIndex = new LinkedHashMap<>();
    private final Map<String, String> programOfRoutine = new LinkedHashMap<>();
    private List<RoutineFacts> facts;

    public IrQuery(Controller controller) {
        this.controller = controller;
        for (Tag tag : controller.allTags()) {
            tagIndex.putIfAbsent(tag.getName(), tag);
            for (String prefix : prefixes(tag.getName())) {
                tagsByPrefix.computeIfAbsent(prefix.toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(tag);
            }
        }
        for (Program program : controller.getPrograms()) {
            for (Routine routine : program.getRoutines()) {
                routineIndex.put(program.getName() + "." + routine.getName(), routine);
                routineIndex.putIfAbsent(routine.getName(), routine);
                programOfRoutine.putIfAbsent(routine.getName(), program.getName());
            }
        }
    }

    public Controller getController() {
        return controller;
    }

    /** Globals shadow program tags of the same name here; use {@link Controller#resolve} for scoped lookup. */
    public Optional<Tag> getTag(String name) {
        return Optional.ofNullable(tagIndex.get(name));
    }

    /**
     * Tags with an underscore-delimited prefix starting with {@code prefix}, ignoring
     * case. {@code HMI_P1} matches {@code HMI_P1_STATE} and {@code HMI_P10}.
     */
    public List<Tag> findTagsByPrefix(String prefix) {
        String wanted = prefix.toLowerCase(Locale.ROOT);
        Set<Tag> matches = new LinkedHashSet<>();
        tagsByPrefix.forEach((tagPrefix, tags) -> {
            if (tagPrefix.startsWith(wanted)) {
                matches.addAll(tags);
            }
        });
        return dedupeByName(matches);
    }

    public List<Tag> findTagsByType(DataType dataType) {
        return tagIndex.values().stream().filter(t -> t.getDataType() == dataType).toList();
    }

    /** Matches the vendor type name or the coarse data type, ignoring case. */
    public List<Tag> findTagsByType(String typeName) {
        return tagIndex.values().stream()
                .filter(t -> t.declaredType().equalsIgnoreCase(typeName)
                        || t.getDataType().getName().equalsIgnoreCase(typeName))
                .toList();
    }

    public List<Tag> findTagsByScope(TagScope scope) {
        return controller.allTags().stream().filter(t -> t.getScope() == scope).toList();
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if {@code regex} is not a valid pattern
     */
    public List<Tag> searchTags(String regex, boolean caseSensitive) {
        Pattern pattern = caseSensitive ? Pattern.compile(regex) : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return tagIndex.values().stream().filter(t -> pattern.matcher(t.getName()).find()).toList();
    }

    public Optional<Routine> getRoutine(String name) {
        return Optional.ofNullable(routineIndex.get(name));
    }

    public Optional<Routine> getRoutine(String name, String program) {
        if (program == null) {
            return getRoutine(name);
        }
        return Optional.ofNullable(routineIndex.get(program + "." + name));
    }

    public Optional<ControlFlowGraph> getControlFlow(String routine, String program) {
        return getRoutine(routine, program).map(DataFlowAnalyzer::buildAnnotated);
    }

    /**
     * Routines that read or write the tag, through any member access. A routine that
     * both reads and writes is listed in both.
     */
    public TagUsage getTagUsage(String tagName) {
        List<String> readers = new ArrayList<>();
        List<String> writers = new ArrayList<>();
        Set<String> programs = new LinkedHashSet<>();
        for (RoutineFacts routineFacts : facts()) {
            String name = routineFacts.getRef().getProgram() + "/" + routineFacts.getRef().getRoutine();
            boolean reads = touches(routineFacts.getUses(), tagName);
            boolean writes = touches(routineFacts.getDefs(), tagName);
            if (reads) {
                readers.add(name);
            }
            if (writes) {
                writers.add(name);
            }
            if (reads || writes) {
                programs.add(routineFacts.getRef().getProgram());
            }
        }
        return new TagUsage(tagName, readers, writers, new ArrayList<>(programs));
    }

    /** Counts by scope, by type and by first underscore segment, keys sorted. */
    public Map<String, Map<String, Integer>> getTagStatistics() {
        Map<String, Integer> byScope = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> byPrefix = new TreeMap<>();
        for (Tag tag : tagIndex.values()) {
            byScope.merge(tag.getScope().getName(), 1, Integer::sum);
            byType.merge(tag.declaredType(), 1, Integer::sum);
            byPrefix.merge(tag.getName().split("_", 2)[0], 1, Integer::sum);
        }
        Map<String, Map<String, Integer>> stats = new LinkedHashMap<>();
        stats.put("by_scope", byScope);
        stats.put("by_type", byType);
        stats.put("by_prefix", byPrefix);
        return stats;
    }

    /** Blocks of the routine's CFG whose defs or uses mention the tag. */
    public List<BasicBlock> blocksTouching(String routine, String program, String tagName) {
        return getControlFlow(routine, program)
                .map(cfg -> cfg.getBlocks().stream()
                        .filter(b -> touches(b.getDefs(), tagName) || touches(b.getUses(), tagName))
                        .toList())
                .orElse(List.of());
    }

    private List<RoutineFacts> facts() {
        if (facts == null) {
            facts = DataFlowAnalyzer.summarize(controller);
        }
        return facts;
    }

    private static boolean touches(Set<String> identities, String tagName) {
        return identities.stream().anyMatch(id -> id.equals(tagName) || TagRef.parse(id).getBase().equals(tagName));
    }

    private static List<String> prefixes(String tagName) {
        String[] parts = tagName.split("_");
        List<String> prefixes = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                current.append('_');
            }
            current.append(parts[i]);
            prefixes.add(current.toString());
        }
        return prefixes;
    }

    private static List<Tag> dedupeByName(Set<Tag> tags) {
        Map<String, Tag> byName = new LinkedHashMap<>();
        tags.forEach(t -> byName.putIfAbsent(t.getName(), t));
        return new ArrayList<>(byName.values());
    }
}
