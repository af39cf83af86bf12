package org.dxworks.plcframe.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.plcframe.fsm.LinkedTransition;
import org.dxworks.plcframe.validation.Diagnostic;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"kind", "controllers", "shared_tags", "missing_overlays", "cross_plc_dependencies",
        "cross_routine_flows", "conflicts", "linked_transitions", "diagnostics"})
public class ProjectReport implements ReportRecord {
    public List<String> controllers = new ArrayList<>();
    @JsonProperty("shared_tags")
    public List<String> sharedTags = new ArrayList<>();
    @JsonProperty("missing_overlays")
    public List<String> missingOverlays = new ArrayList<>();
    @JsonProperty("cross_plc_dependencies")
    public List<DependencyRecord> crossPlcDependencies = new ArrayList<>();
    @JsonProperty("cross_routine_flows")
    public List<DependencyRecord> crossRoutineFlows = new ArrayList<>();
    public List<ConflictRecord> conflicts = new ArrayList<>();
    @JsonProperty("linked_transitions")
    public List<LinkedTransition> linkedTransitions = new ArrayList<>();
    public List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    @JsonProperty("kind")
    public String getKind() {
        return "project";
    }
}
