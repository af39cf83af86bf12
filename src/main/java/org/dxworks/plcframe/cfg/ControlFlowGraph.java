package org.dxworks.plcframe.cfg;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Per-routine block graph. Block ids are list positions; block 0 is the entry.
 */
public final class ControlFlowGraph {
    private final String routine;
    private final List<BasicBlock> blocks;
    private final List<CfgEdge> edges;

    public ControlFlowGraph(String routine, List<BasicBlock> blocks, List<CfgEdge> edges) {
        this.routine = Objects.requireNonNull(routine, "routine name");
        this.blocks = List.copyOf(blocks);
        this.edges = List.copyOf(edges);
        for (int i = 0; i < this.blocks.size(); i++) {
            if (this.blocks.get(i).getId() != i) {
                throw new IllegalArgumentException("Block " + this.blocks.get(i).getId() + " stored at position " + i);
            }
        }
    }

    public String getRoutine() {
        return routine;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public List<CfgEdge> getEdges() {
        return edges;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    public BasicBlock block(int id) {
        return blocks.get(id);
    }

    public List<CfgEdge> outgoing(int blockId) {
        return edges.stream().filter(e -> e.getSource() == blockId).collect(Collectors.toList());
    }

    public List<CfgEdge> incoming(int blockId) {
        return edges.stream().filter(e -> e.getTarget() == blockId).collect(Collectors.toList());
    }

    public ControlFlowGraph withBlocks(List<BasicBlock> newBlocks) {
        return new ControlFlowGraph(routine, newBlocks, edges);
    }
}
