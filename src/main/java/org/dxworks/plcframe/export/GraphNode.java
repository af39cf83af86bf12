package org.dxworks.plcframe.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"id", "label", "type", "routine", "defs", "uses"})
public class GraphNode {
    public int id;
    public String label;
    public String type;
    public String routine;
    public List<String> defs = new ArrayList<>();
    public List<String> uses = new ArrayList<>();
}
