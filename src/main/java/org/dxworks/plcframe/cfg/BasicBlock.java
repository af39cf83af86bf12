package org.dxworks.plcframe.cfg;

import org.dxworks.plcframe.model.instruction.Instruction;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Maximal straight-line run with a single entry. A branch or control block holds
 * exactly the one control instruction whose header it represents.
 */
public final class BasicBlock {
    private final int id;
    private final BlockType type;
    private final String label;
    private final List<Instruction> instructions;
    private final SortedSet<String> defs;
    private final SortedSet<String> uses;

    public BasicBlock(int id, BlockType type, String label, List<Instruction> instructions) {
        this(id, type, label, instructions, new TreeSet<>(), new TreeSet<>());
    }

    private BasicBlock(int id, BlockType type, String label, List<Instruction> instructions,
                       SortedSet<String> defs, SortedSet<String> uses) {
        this.id = id;
        this.type = Objects.requireNonNull(type, "block type");
        this.label = label;
        this.instructions = List.copyOf(instructions);
        this.defs = Collections.unmodifiableSortedSet(new TreeSet<>(defs));
        this.uses = Collections.unmodifiableSortedSet(new TreeSet<>(uses));
    }

    public BasicBlock withDefsAndUses(SortedSet<String> newDefs, SortedSet<String> newUses) {
        return new BasicBlock(id, type, label, instructions, newDefs, newUses);
    }

    public int getId() {
        return id;
    }

    public BlockType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public SortedSet<String> getDefs() {
        return defs;
    }

    public SortedSet<String> getUses() {
        return uses;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    @Override
    public String toString() {
        return "B" + id + "[" + type.getName() + "] " + label;
    }
}
