package org.dxworks.plcframe.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"source", "target", "flow_type", "value"})
public class GraphEdge {
    public int source;
    public int target;
    @JsonProperty("flow_type")
    public String flowType;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String value;
}
