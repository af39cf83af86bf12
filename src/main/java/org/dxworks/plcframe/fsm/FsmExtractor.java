package org.dxworks.plcframe.fsm;

import org.dxworks.plcframe.dataflow.DataFlowAnalyzer;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.model.Program;
import org.dxworks.plcframe.model.Routine;
import org.dxworks.plcframe.model.Tag;
import org.dxworks.plcframe.model.expr.BinaryOp;
import org.dxworks.plcframe.model.expr.Expression;
import org.dxworks.plcframe.model.expr.Expressions;
import org.dxworks.plcframe.model.expr.Literal;
import org.dxworks.plcframe.model.expr.Operator;
import org.dxworks.plcframe.model.expr.TagRef;
import org.dxworks.plcframe.model.expr.UnaryOp;
import org.dxworks.plcframe.model.instruction.Assignment;
import org.dxworks.plcframe.model.instruction.Call;
import org.dxworks.plcframe.model.instruction.CaseArm;
import org.dxworks.plcframe.model.instruction.CaseStatement;
import org.dxworks.plcframe.model.instruction.Conditional;
import org.dxworks.plcframe.model.instruction.Instruction;
import org.dxworks.plcframe.model.instruction.Instructions;
import org.dxworks.plcframe.model.instruction.Loop;
import org.dxworks.plcframe.model.instruction.TimerOp;
import org.dxworks.plcframe.validation.Diagnostic;
import org.dxworks.plcframe.validation.DiagnosticKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Infers a state machine from the shape of a controller's logic, without any
 * vendor keyword matching.
 *
 * <p>A tag is a state-variable candidate when it is a CASE selector, is compared for
 * (in)equality against literals in IF guards, or is assigned literal values; it
 * qualifies with at least two distinct literals. Candidates rank by distinct-value
 * count, ties go to declaration order. A configured {@code state_var} always wins.
 */
public final class FsmExtractor {

    static final int MIN_DISTINCT_VALUES = 2;
    static final String NO_CANDIDATE_REASON =
            "No tag is a CASE selector, compared in a guard or assigned with at least "
                    + MIN_DISTINCT_VALUES + " distinct literal values";

    private FsmExtractor() {
    }

    public static FsmModel extract(Controller controller) {
        return extract(controller, FsmConfig.EMPTY);
    }

    public static FsmModel extract(Controller controller, FsmConfig config) {
        FsmConfig hints = config != null ? config : FsmConfig.EMPTY;
        Map<String, Candidate> candidates = collectCandidates(controller);
        List<Diagnostic> diagnostics = new ArrayList<>();

        Candidate chosen;
        if (hints.getStateVar() != null) {
            chosen = candidates.get(hints.getStateVar());
            if (chosen == null || chosen.values.isEmpty()) {
                return FsmModel.empty(controller.getName(), controller.getSourceType(),
                        "Configured state variable '" + hints.getStateVar()
                                + "' is never compared against or assigned a literal", diagnostics);
            }
        } else {
            List<Candidate> ranked = rank(controller, candidates);
            if (ranked.isEmpty()) {
                return FsmModel.empty(controller.getName(), controller.getSourceType(), NO_CANDIDATE_REASON, diagnostics);
            }
            chosen = ranked.get(0);
            List<String> tied = ranked.stream()
                    .filter(c -> c.values.size() == ranked.get(0).values.size())
                    .map(c -> c.variable)
                    .toList();
            if (tied.size() > 1) {
                diagnostics.add(new Diagnostic(DiagnosticKind.AMBIGUOUS_STATE_VARIABLE, controller.getName(), null,
                        "Candidates " + tied + " share " + chosen.values.size()
                                + " distinct values; chose " + chosen.variable + " by declaration order"));
            }
        }
        if (chosen.selector && chosen.assignedOutsideBranch) {
            diagnostics.add(new Diagnostic(DiagnosticKind.AMBIGUOUS_STATE_VARIABLE, controller.getName(), null,
                    chosen.variable + " is a CASE selector and is also assigned outside any branch"));
        }

        Map<String, String> names = new LinkedHashMap<>();
        chosen.values.forEach((key, literal) -> names.put(key, literal.displayName()));

        List<FsmTransition> transitions = new ArrayList<>();
        for (Program program : controller.getPrograms()) {
            for (Routine routine : program.getRoutines()) {
                new TransitionCollector(chosen.variable, names, routine.getName(), transitions)
                        .visit(routine.getInstructions(), Scope.TOP);
            }
        }

        String initial = initialState(controller, chosen);
        List<FsmState> states = new ArrayList<>();
        for (Map.Entry<String, String> entry : names.entrySet()) {
            states.add(new FsmState(entry.getValue(), entry.getKey(),
                    classify(entry.getKey(), entry.getValue(), initial, transitions)));
        }
        boolean implicit = chosen.values.values().stream().allMatch(Literal::isBoolean);

        HintCoverage coverage = hints.hasHints()
                ? coverage(hints, controller, chosen.variable, states, transitions)
                : null;
        return new FsmModel(controller.getName(), controller.getSourceType(), chosen.variable,
                states, transitions, diagnostics, implicit, coverage);
    }

    // ---- candidate detection ----

    private static final class Candidate {
        final String variable;
        final Map<String, Literal> values = new LinkedHashMap<>();
        boolean selector;
        boolean assignedOutsideBranch;

        Candidate(String variable) {
            this.variable = variable;
        }

        void add(Literal literal) {
            Literal known = values.get(literal.key());
            if (known == null || (known.getLabel() == null && literal.getLabel() != null)) {
                values.put(literal.key(), literal);
            }
        }
    }

    private static Map<String, Candidate> collectCandidates(Controller controller) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (Program program : controller.getPrograms()) {
            for (Routine routine : program.getRoutines()) {
                scan(routine.getInstructions(), false, candidates);
            }
        }
        return candidates;
    }

    private static void scan(List<Instruction> body, boolean inBranch, Map<String, Candidate> candidates) {
        for (Instruction instruction : body) {
            if (instruction instanceof Assignment assignment) {
                if (assignment.getValue() instanceof Literal literal) {
                    Candidate candidate = candidate(candidates, assignment.getTarget().identity());
                    candidate.add(literal);
                    if (!inBranch) {
                        candidate.assignedOutsideBranch = true;
                    }
                }
            } else if (instruction instanceof Conditional conditional) {
                scanGuard(conditional.getGuard(), candidates);
                scan(conditional.getThenBody(), true, candidates);
                scan(conditional.getElseBody(), true, candidates);
            } else if (instruction instanceof CaseStatement caseStatement) {
                if (caseStatement.getSelector() instanceof TagRef ref) {
                    Candidate candidate = candidate(candidates, ref.identity());
                    candidate.selector = true;
                    caseStatement.getArms().forEach(arm -> arm.getValues().forEach(candidate::add));
                }
                for (CaseArm arm : caseStatement.getArms()) {
                    scan(arm.getBody(), true, candidates);
                }
                if (caseStatement.hasExplicitDefault()) {
                    scan(caseStatement.getDefaultBody(), true, candidates);
                }
            } else if (instruction instanceof Loop loop) {
                scan(loop.getBody(), inBranch, candidates);
            }
        }
    }

    // (In)equality against literals anywhere under AND/OR/XOR/NOT.
    private static void scanGuard(Expression guard, Map<String, Candidate> candidates) {
        if (guard instanceof UnaryOp unary && unary.getOp() == Operator.NOT) {
            scanGuard(unary.getOperand(), candidates);
        } else if (guard instanceof BinaryOp binary) {
            if (binary.getOp().isEquality()) {
                comparison(binary).ifPresent(c -> candidate(candidates, c.variable()).add(c.literal()));
            } else if (binary.getOp() == Operator.AND || binary.getOp() == Operator.OR || binary.getOp() == Operator.XOR) {
                scanGuard(binary.getLeft(), candidates);
                scanGuard(binary.getRight(), candidates);
            }
        }
    }

    private record Comparison(String variable, Literal literal) {
    }

    private static Optional<Comparison> comparison(BinaryOp binary) {
        if (binary.getLeft() instanceof TagRef ref && binary.getRight() instanceof Literal literal) {
            return Optional.of(new Comparison(ref.identity(), literal));
        }
        if (binary.getRight() instanceof TagRef ref && binary.getLeft() instanceof Literal literal) {
            return Optional.of(new Comparison(ref.identity(), literal));
        }
        return Optional.empty();
    }

    private static Candidate candidate(Map<String, Candidate> candidates, String variable) {
        return candidates.computeIfAbsent(variable, Candidate::new);
    }

    private static List<Candidate> rank(Controller controller, Map<String, Candidate> candidates) {
        List<String> declared = controller.allTags().stream().map(Tag::getName).toList();
        List<String> encountered = new ArrayList<>(candidates.keySet());
        Comparator<Candidate> byDeclaration = Comparator.comparingInt(c -> {
            int index = declared.indexOf(c.variable);
            if (index < 0) {
                index = declared.indexOf(TagRef.parse(c.variable).getBase());
            }
            return index >= 0 ? index : declared.size() + encountered.indexOf(c.variable);
        });
        return candidates.values().stream()
                .filter(c -> c.values.size() >= MIN_DISTINCT_VALUES)
                .sorted(Comparator.<Candidate>comparingInt(c -> c.values.size()).reversed().thenComparing(byDeclaration))
                .toList();
    }

    // ---- transitions ----

    private record Scope(String fromKey, Expression guard, boolean inBranch) {
        static final Scope TOP = new Scope(null, null, false);
    }

    private static final class TransitionCollector {
        private final String variable;
        private final Map<String, String> names;
        private final String routine;
        private final List<FsmTransition> out;

        TransitionCollector(String variable, Map<String, String> names, String routine, List<FsmTransition> out) {
            this.variable = variable;
            this.names = names;
            this.routine = routine;
            this.out = out;
        }

        void visit(List<Instruction> body, Scope scope) {
            for (Instruction instruction : body) {
                if (instruction instanceof Assignment assignment && scope.inBranch() && isStateWrite(assignment)) {
                    emit(assignment, body, scope);
                } else if (instruction instanceof Conditional conditional) {
                    Expression guard = conditional.getGuard();
                    visit(conditional.getThenBody(), new Scope(enclosingState(guard, scope.fromKey()), guard, true));
                    visit(conditional.getElseBody(), new Scope(scope.fromKey(), UnaryOp.not(guard), true));
                } else if (instruction instanceof CaseStatement caseStatement) {
                    visitCase(caseStatement, scope);
                } else if (instruction instanceof Loop loop) {
                    visit(loop.getBody(), scope);
                }
            }
        }

        private void visitCase(CaseStatement caseStatement, Scope scope) {
            Expression selector = caseStatement.getSelector();
            boolean onStateVariable = selector instanceof TagRef ref && ref.identity().equals(variable);
            List<Literal> allValues = new ArrayList<>();
            for (CaseArm arm : caseStatement.getArms()) {
                allValues.addAll(arm.getValues());
                Expression guard = anyOf(selector, arm.getValues());
                if (onStateVariable && !arm.getValues().isEmpty()) {
                    // One transition per listed value: each of them is left by the arm.
                    for (Literal value : arm.getValues()) {
                        visit(arm.getBody(), new Scope(value.key(), guard, true));
                    }
                } else {
                    visit(arm.getBody(), new Scope(scope.fromKey(), guard, true));
                }
            }
            if (caseStatement.hasExplicitDefault()) {
                Expression guard = allValues.isEmpty() ? null : UnaryOp.not(anyOf(selector, allValues));
                List<String> unlisted = onStateVariable ? unlistedStates(allValues) : List.of();
                if (unlisted.isEmpty()) {
                    visit(caseStatement.getDefaultBody(), new Scope(scope.fromKey(), guard, true));
                } else {
                    for (String key : unlisted) {
                        visit(caseStatement.getDefaultBody(), new Scope(key, guard, true));
                    }
                }
            }
        }

        // States the default arm runs in: those no arm lists.
        private List<String> unlistedStates(List<Literal> listed) {
            Set<String> keys = listed.stream().map(Literal::key).collect(Collectors.toSet());
            return names.keySet().stream().filter(key -> !keys.contains(key)).toList();
        }

        private boolean isStateWrite(Assignment assignment) {
            return assignment.getTarget().identity().equals(variable) && assignment.getValue() instanceof Literal;
        }

        private void emit(Assignment assignment, List<Instruction> body, Scope scope) {
            String toKey = ((Literal) assignment.getValue()).key();
            if (toKey.equals(scope.fromKey())) {
                return;
            }
            List<String> actions = new ArrayList<>();
            SortedSet<String> written = new TreeSet<>();
            written.add(variable);
            for (Instruction other : body) {
                if (other == assignment) {
                    continue;
                }
                boolean action = other instanceof Call || other instanceof TimerOp
                        || (other instanceof Assignment a && !a.getTarget().identity().equals(variable));
                if (action) {
                    actions.add(Instructions.render(other));
                    written.addAll(DataFlowAnalyzer.defs(other));
                }
            }
            SortedSet<String> guardTags = Expressions.tagRefs(scope.guard()).stream()
                    .map(TagRef::identity)
                    .collect(Collectors.toCollection(TreeSet::new));
            String from = scope.fromKey() != null ? names.getOrDefault(scope.fromKey(), scope.fromKey()) : FsmTransition.ANY;
            out.add(new FsmTransition(from, names.get(toKey), Expressions.render(scope.guard()),
                    actions, routine, guardTags, written));
        }

        // A "var = literal" conjunct pins the state the then-branch runs in.
        private String enclosingState(Expression guard, String outer) {
            for (Expression conjunct : Expressions.conjuncts(guard)) {
                if (conjunct instanceof BinaryOp binary && binary.getOp() == Operator.EQ) {
                    Optional<Comparison> comparison = comparison(binary);
                    if (comparison.isPresent() && comparison.get().variable().equals(variable)
                            && names.containsKey(comparison.get().literal().key())) {
                        return comparison.get().literal().key();
                    }
                }
            }
            return outer;
        }

        private static Expression anyOf(Expression selector, List<Literal> values) {
            Expression guard = null;
            for (Literal value : values) {
                Expression test = BinaryOp.eq(selector, value);
                guard = guard == null ? test : new BinaryOp(Operator.OR, guard, test);
            }
            return guard;
        }
    }

    // ---- classification and hints ----

    private static String initialState(Controller controller, Candidate chosen) {
        TagRef ref = TagRef.parse(chosen.variable);
        if (!ref.hasMember()) {
            for (Tag tag : controller.allTags()) {
                if (tag.getName().equals(ref.getBase()) && tag.getInitialValue() != null) {
                    for (Literal literal : chosen.values.values()) {
                        Literal declared = new Literal(tag.getInitialValue(), literal.getType(), null);
                        if (declared.key().equals(literal.key())
                                || tag.getInitialValue().trim().equals(literal.getLabel())) {
                            return literal.key();
                        }
                    }
                    break;
                }
            }
        }
        return chosen.values.keySet().iterator().next();
    }

    private static StateClassification classify(String key, String name, String initialKey,
                                                List<FsmTransition> transitions) {
        if (key.equals(initialKey)) {
            return StateClassification.INITIAL;
        }
        boolean leaves = transitions.stream()
                .filter(t -> !t.getTo().equals(name))
                .anyMatch(t -> t.getFrom().equals(name) || !t.hasKnownSource());
        return leaves ? StateClassification.INTERMEDIATE : StateClassification.TERMINAL;
    }

    private static HintCoverage coverage(FsmConfig hints, Controller controller, String variable,
                                         List<FsmState> states, List<FsmTransition> transitions) {
        List<String> inferred = states.stream().map(FsmState::getName).toList();
        List<String> expected = hints.expectedStatesFor(variable);

        List<String> missing = expected.stream().filter(s -> !inferred.contains(s)).toList();
        List<String> extra = expected.isEmpty()
                ? List.of()
                : inferred.stream().filter(s -> !expected.contains(s)).toList();

        Set<String> reached = new HashSet<>();
        transitions.forEach(t -> reached.add(t.getTo()));
        List<String> unmatched = hints.getTransitionHints().keySet().stream()
                .filter(target -> !reached.contains(target))
                .sorted()
                .toList();
        Set<String> declared = new HashSet<>();
        controller.allTags().forEach(t -> declared.add(t.getName()));
        List<String> unknownPhysical = hints.getPhysicalVars().stream()
                .filter(v -> !declared.contains(TagRef.parse(v).getBase()))
                .toList();
        List<String> unmatchedDynamics = hints.getPlantDynamics().keySet().stream()
                .filter(state -> !inferred.contains(state))
                .sorted()
                .toList();
        return new HintCoverage(missing, extra, unmatched, unknownPhysical, unmatchedDynamics);
    }
}
