package org.dxworks.plcframe.project;

import java.util.List;

public final class AggregationResult {
    private final ProjectIR project;
    private final List<String> missingOverlays;

    public AggregationResult(ProjectIR project, List<String> missingOverlays) {
        this.project = project;
        this.missingOverlays = List.copyOf(missingOverlays);
    }

    public ProjectIR getProject() {
        return project;
    }

    /** Controllers that expected an overlay under strict mode and were analyzed without one. */
    public List<String> getMissingOverlays() {
        return missingOverlays;
    }
}
