package org.dxworks.plcframe.dataflow;

import org.dxworks.plcframe.cfg.ControlFlowGraph;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Annotated CFG of one routine plus the union of its blocks' defs and uses.
 */
public final class RoutineFacts {
    private final RoutineRef ref;
    private final ControlFlowGraph cfg;
    private final SortedSet<String> defs;
    private final SortedSet<String> uses;

    public RoutineFacts(RoutineRef ref, ControlFlowGraph cfg) {
        this.ref = ref;
        this.cfg = cfg;
        SortedSet<String> allDefs = new TreeSet<>();
        SortedSet<String> allUses = new TreeSet<>();
        cfg.getBlocks().forEach(block -> {
            allDefs.addAll(block.getDefs());
            allUses.addAll(block.getUses());
        });
        this.defs = Collections.unmodifiableSortedSet(allDefs);
        this.uses = Collections.unmodifiableSortedSet(allUses);
    }

    public RoutineRef getRef() {
        return ref;
    }

    public ControlFlowGraph getCfg() {
        return cfg;
    }

    public SortedSet<String> getDefs() {
        return defs;
    }

    public SortedSet<String> getUses() {
        return uses;
    }
}
