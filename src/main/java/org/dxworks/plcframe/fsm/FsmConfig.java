package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Hints for FSM extraction, one per controller. Only {@code state_var} changes what is
 * extracted; the remaining fields are checked against the result and never alter it.
 * Physical variables are checked against the declared tags, plant dynamics against the
 * inferred states.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FsmConfig {

    public static final FsmConfig EMPTY = new FsmConfig(null, null, null, null, null, null);

    private final String stateVar;
    private final List<String> explicitStates;
    private final Map<String, List<String>> transitionHints;
    private final List<String> physicalVars;
    private final Map<String, String> plantDynamics;
    private final Map<String, List<String>> expectedStates;

    @JsonCreator
    public FsmConfig(@JsonProperty("state_var") String stateVar,
                     @JsonProperty("explicit_states") List<String> explicitStates,
                     @JsonProperty("transition_hints") Map<String, List<String>> transitionHints,
                     @JsonProperty("physical_vars") List<String> physicalVars,
                     @JsonProperty("plant_dynamics") Map<String, String> plantDynamics,
                     @JsonProperty("expected_states") Map<String, List<String>> expectedStates) {
        this.stateVar = stateVar == null || stateVar.isBlank() ? null : stateVar.trim();
        this.explicitStates = explicitStates != null ? List.copyOf(explicitStates) : List.of();
        this.transitionHints = transitionHints != null ? Map.copyOf(transitionHints) : Map.of();
        this.physicalVars = physicalVars != null ? List.copyOf(physicalVars) : List.of();
        this.plantDynamics = plantDynamics != null ? Map.copyOf(plantDynamics) : Map.of();
        this.expectedStates = expectedStates != null ? Map.copyOf(expectedStates) : Map.of();
    }

    public static FsmConfig forStateVariable(String stateVar) {
        return new FsmConfig(stateVar, null, null, null, null, null);
    }

    public FsmConfig withExplicitStates(List<String> states) {
        return new FsmConfig(stateVar, states, transitionHints, physicalVars, plantDynamics, expectedStates);
    }

    public FsmConfig withTransitionHints(Map<String, List<String>> hints) {
        return new FsmConfig(stateVar, explicitStates, hints, physicalVars, plantDynamics, expectedStates);
    }

    public String getStateVar() {
        return stateVar;
    }

    public List<String> getExplicitStates() {
        return explicitStates;
    }

    public Map<String, List<String>> getTransitionHints() {
        return transitionHints;
    }

    public List<String> getPhysicalVars() {
        return physicalVars;
    }

    public Map<String, String> getPlantDynamics() {
        return plantDynamics;
    }

    public Map<String, List<String>> getExpectedStates() {
        return expectedStates;
    }

    /**
     * States the hints expect for the given variable: {@code explicit_states} when
     * present, otherwise the {@code expected_states} entry for that variable.
     */
    public List<String> expectedStatesFor(String variable) {
        if (!explicitStates.isEmpty()) {
            return explicitStates;
        }
        return expectedStates.getOrDefault(variable, List.of());
    }

    public boolean hasHints() {
        return !explicitStates.isEmpty() || !transitionHints.isEmpty() || !expectedStates.isEmpty()
                || !physicalVars.isEmpty() || !plantDynamics.isEmpty();
    }
}
