package org.dxworks.plcframe.cfg;

import org.dxworks.plcframe.model.Routine;
import org.dxworks.plcframe.model.instruction.CaseArm;
import org.dxworks.plcframe.model.instruction.CaseStatement;
import org.dxworks.plcframe.model.instruction.Conditional;
import org.dxworks.plcframe.model.instruction.Instruction;
import org.dxworks.plcframe.model.instruction.Instructions;
import org.dxworks.plcframe.model.instruction.Loop;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Partitions one routine into basic blocks.
 *
 * <p>Conditional, Case and Loop always open their own block, so every branch has
 * exactly one source block. Block 0 is the entry and exists even for an empty routine.
 * The exit is implicit; a synthetic {@code EXIT} block is added only when several
 * edges, or a labeled edge, would otherwise dangle at the end of the routine.
 * Defs and uses are left empty here, see {@code DataFlowAnalyzer#annotate}.
 */
public final class CfgBuilder {

    public static final String ENTRY_LABEL = "ENTRY";
    public static final String EXIT_LABEL = "EXIT";

    private CfgBuilder() {
    }

    public static ControlFlowGraph build(Routine routine) {
        return new Builder(routine).build();
    }

    // An edge whose source is known but whose target is the next block to be created.
    private record Endpoint(int source, FlowType flowType, String value) {
    }

    private static final class Draft {
        final int id;
        final BlockType type;
        final List<Instruction> instructions = new ArrayList<>();

        Draft(int id, BlockType type) {
            this.id = id;
            this.type = type;
        }
    }

    private static final class Builder {
        private final Routine routine;
        private final List<Draft> drafts = new ArrayList<>();
        private final List<CfgEdge> edges = new ArrayList<>();

        Builder(Routine routine) {
            this.routine = routine;
        }

        ControlFlowGraph build() {
            Draft entry = newBlock(BlockType.INSTRUCTION);
            List<Endpoint> exits = processSequence(routine.getInstructions(), List.of(), entry);

            boolean implicitExit = exits.isEmpty()
                    || (exits.size() == 1 && exits.get(0).flowType() == FlowType.SUCCESSOR);
            if (!implicitExit) {
                Draft exit = newBlock(BlockType.CONTROL);
                link(exits, exit.id, false);
            }

            List<BasicBlock> blocks = new ArrayList<>();
            for (Draft draft : drafts) {
                blocks.add(new BasicBlock(draft.id, draft.type, label(draft, implicitExit), draft.instructions));
            }
            return new ControlFlowGraph(routine.getName(), blocks, edges);
        }

        /**
         * Lowers a body. {@code current} is an open straight-line block that is already
         * wired (only the entry block is passed in this way), otherwise null.
         * Returns the endpoints that flow into whatever follows the body.
         */
        private List<Endpoint> processSequence(List<Instruction> body, List<Endpoint> incoming, Draft current) {
            List<Endpoint> pending = incoming;
            for (Instruction instruction : body) {
                if (!instruction.opensBlock()) {
                    if (current == null) {
                        current = newBlock(BlockType.INSTRUCTION);
                        link(pending, current.id, false);
                        pending = List.of();
                    }
                    current.instructions.add(instruction);
                    continue;
                }
                if (current != null) {
                    pending = List.of(new Endpoint(current.id, FlowType.SUCCESSOR, null));
                    current = null;
                }
                pending = handleControl(instruction, pending);
            }
            if (current != null) {
                return List.of(new Endpoint(current.id, FlowType.SUCCESSOR, null));
            }
            return pending;
        }

        private List<Endpoint> handleControl(Instruction instruction, List<Endpoint> incoming) {
            if (instruction instanceof Conditional conditional) {
                return handleConditional(conditional, incoming);
            }
            if (instruction instanceof CaseStatement caseStatement) {
                return handleCase(caseStatement, incoming);
            }
            if (instruction instanceof Loop loop) {
                return handleLoop(loop, incoming);
            }
            throw new IllegalArgumentException("Not a control instruction: " + instruction.getClass().getName());
        }

        private List<Endpoint> handleConditional(Conditional conditional, List<Endpoint> incoming) {
            Draft head = newBlock(BlockType.BRANCH);
            head.instructions.add(conditional);
            link(incoming, head.id, false);

            List<Endpoint> thenExits = processSequence(conditional.getThenBody(),
                    List.of(new Endpoint(head.id, FlowType.TRUE, null)), null);
            List<Endpoint> elseExits = processSequence(conditional.getElseBody(),
                    List.of(new Endpoint(head.id, FlowType.FALSE, null)), null);

            List<Endpoint> combined = new ArrayList<>(thenExits);
            combined.addAll(elseExits);
            return combined;
        }

        private List<Endpoint> handleCase(CaseStatement caseStatement, List<Endpoint> incoming) {
            Draft head = newBlock(BlockType.BRANCH);
            head.instructions.add(caseStatement);
            link(incoming, head.id, false);

            List<Endpoint> combined = new ArrayList<>();
            for (CaseArm arm : caseStatement.getArms()) {
                combined.addAll(processSequence(arm.getBody(),
                        List.of(new Endpoint(head.id, FlowType.CASE_VALUE, arm.label())), null));
            }
            if (caseStatement.hasExplicitDefault()) {
                combined.addAll(processSequence(caseStatement.getDefaultBody(),
                        List.of(new Endpoint(head.id, FlowType.CASE_VALUE, CfgEdge.DEFAULT_ARM)), null));
            } else {
                // Unmatched selector values fall through to the next instruction.
                combined.add(new Endpoint(head.id, FlowType.CASE_VALUE, CfgEdge.FALLTHROUGH_ARM));
            }
            return combined;
        }

        private List<Endpoint> handleLoop(Loop loop, List<Endpoint> incoming) {
            Draft guard = newBlock(BlockType.CONTROL);
            guard.instructions.add(loop);
            link(incoming, guard.id, false);

            List<Endpoint> bodyExits = processSequence(loop.getBody(),
                    List.of(new Endpoint(guard.id, FlowType.TRUE, null)), null);
            link(bodyExits, guard.id, true);
            return List.of(new Endpoint(guard.id, FlowType.FALSE, null));
        }

        private Draft newBlock(BlockType type) {
            Draft draft = new Draft(drafts.size(), type);
            drafts.add(draft);
            return draft;
        }

        private void link(List<Endpoint> endpoints, int target, boolean backEdge) {
            for (Endpoint endpoint : endpoints) {
                edges.add(new CfgEdge(endpoint.source(), target, endpoint.flowType(), endpoint.value(), backEdge));
            }
        }

        private String label(Draft draft, boolean implicitExit) {
            if (draft.instructions.isEmpty()) {
                if (draft.id == 0) {
                    return ENTRY_LABEL;
                }
                if (!implicitExit && draft.id == drafts.size() - 1 && draft.type == BlockType.CONTROL) {
                    return EXIT_LABEL;
                }
                return "";
            }
            return draft.instructions.stream()
                    .map(Instructions::render)
                    .collect(Collectors.joining("; "));
        }
    }
}
