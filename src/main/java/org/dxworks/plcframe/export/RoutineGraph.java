package org.dxworks.plcframe.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"controller", "program", "routine", "nodes", "edges"})
public class RoutineGraph {
    public String controller;
    public String program;
    public String routine;
    public List<GraphNode> nodes = new ArrayList<>();
    public List<GraphEdge> edges = new ArrayList<>();
}
