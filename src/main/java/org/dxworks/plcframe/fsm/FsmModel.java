package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.plcframe.model.SourceType;
import org.dxworks.plcframe.validation.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * A structurally inferred state machine. An empty model carries a {@code reason}
 * instead of a state variable; it is a result, not an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "controller", "source_type", "state_variable", "states", "transitions",
        "reason", "diagnostics", "implicit", "hint_coverage"})
public final class FsmModel {
    private final String name;
    private final String controller;
    private final SourceType sourceType;
    private final String stateVariable;
    private final List<FsmState> states;
    private final List<FsmTransition> transitions;
    private final String reason;
    private final List<Diagnostic> diagnostics;
    private final boolean implicit;
    private final HintCoverage hintCoverage;

    public FsmModel(String controller, SourceType sourceType, String stateVariable,
                    List<FsmState> states, List<FsmTransition> transitions, List<Diagnostic> diagnostics,
                    boolean implicit, HintCoverage hintCoverage) {
        this.name = "FSM_" + stateVariable;
        this.controller = controller;
        this.sourceType = sourceType;
        this.stateVariable = stateVariable;
        this.states = List.copyOf(states);
        this.transitions = List.copyOf(transitions);
        this.reason = null;
        this.diagnostics = List.copyOf(diagnostics);
        this.implicit = implicit;
        this.hintCoverage = hintCoverage;
    }

    private FsmModel(String controller, SourceType sourceType, String reason, List<Diagnostic> diagnostics) {
        this.name = null;
        this.controller = controller;
        this.sourceType = sourceType;
        this.stateVariable = null;
        this.states = List.of();
        this.transitions = List.of();
        this.reason = reason;
        this.diagnostics = List.copyOf(diagnostics);
        this.implicit = false;
        this.hintCoverage = null;
    }

    public static FsmModel empty(String controller, SourceType sourceType, String reason, List<Diagnostic> diagnostics) {
        return new FsmModel(controller, sourceType, reason, diagnostics);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("controller")
    public String getController() {
        return controller;
    }

    @JsonProperty("source_type")
    public SourceType getSourceType() {
        return sourceType;
    }

    @JsonProperty("state_variable")
    public String getStateVariable() {
        return stateVariable;
    }

    @JsonProperty("states")
    public List<FsmState> getStates() {
        return states;
    }

    @JsonProperty("transitions")
    public List<FsmTransition> getTransitions() {
        return transitions;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    @JsonProperty("diagnostics")
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @JsonProperty("implicit")
    public boolean isImplicit() {
        return implicit;
    }

    @JsonProperty("hint_coverage")
    public HintCoverage getHintCoverage() {
        return hintCoverage;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return stateVariable == null;
    }

    public Optional<FsmState> findState(String stateName) {
        return states.stream().filter(s -> s.getName().equals(stateName)).findFirst();
    }

    @JsonIgnore
    public Optional<FsmState> getInitialState() {
        return states.stream().filter(s -> s.getClassification() == StateClassification.INITIAL).findFirst();
    }
}
