package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * How an inferred model compares with the configured hints. Advisory only.
 */
@JsonPropertyOrder({"valid", "missing_states", "extra_states", "unmatched_transition_hints",
        "unknown_physical_vars", "unmatched_plant_dynamics"})
public final class HintCoverage {
    private final List<String> missingStates;
    private final List<String> extraStates;
    private final List<String> unmatchedTransitionHints;
    private final List<String> unknownPhysicalVars;
    private final List<String> unmatchedPlantDynamics;

    public HintCoverage(List<String> missingStates, List<String> extraStates, List<String> unmatchedTransitionHints,
                        List<String> unknownPhysicalVars, List<String> unmatchedPlantDynamics) {
        this.missingStates = List.copyOf(missingStates);
        this.extraStates = List.copyOf(extraStates);
        this.unmatchedTransitionHints = List.copyOf(unmatchedTransitionHints);
        this.unknownPhysicalVars = List.copyOf(unknownPhysicalVars);
        this.unmatchedPlantDynamics = List.copyOf(unmatchedPlantDynamics);
    }

    /** True when every hinted state was inferred. */
    @JsonProperty("valid")
    public boolean isValid() {
        return missingStates.isEmpty();
    }

    @JsonProperty("missing_states")
    public List<String> getMissingStates() {
        return missingStates;
    }

    @JsonProperty("extra_states")
    public List<String> getExtraStates() {
        return extraStates;
    }

    /** Hinted target states that no inferred transition leads to. */
    @JsonProperty("unmatched_transition_hints")
    public List<String> getUnmatchedTransitionHints() {
        return unmatchedTransitionHints;
    }

    /** Hinted physical variables the controller does not declare. */
    @JsonProperty("unknown_physical_vars")
    public List<String> getUnknownPhysicalVars() {
        return unknownPhysicalVars;
    }

    /** States with plant dynamics that were not inferred. */
    @JsonProperty("unmatched_plant_dynamics")
    public List<String> getUnmatchedPlantDynamics() {
        return unmatchedPlantDynamics;
    }
}
