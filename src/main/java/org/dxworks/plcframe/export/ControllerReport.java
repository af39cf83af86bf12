package org.dxworks.plcframe.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.plcframe.fsm.FsmModel;
import org.dxworks.plcframe.validation.Diagnostic;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"kind", "name", "source_type", "file", "valid", "has_overlay", "programs", "routines",
        "tags", "udts", "diagnostics", "fsm", "graphs"})
public class ControllerReport implements ReportRecord {
    public String name;
    @JsonProperty("source_type")
    public String sourceType;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String file;
    public boolean valid;
    @JsonProperty("has_overlay")
    public boolean hasOverlay;
    public int programs;
    public int routines;
    public int tags;
    public int udts;
    public List<Diagnostic> diagnostics = new ArrayList<>();
    public FsmModel fsm;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<RoutineGraph> graphs = new ArrayList<>();

    @Override
    @JsonProperty("kind")
    public String getKind() {
        return "controller";
    }
}
