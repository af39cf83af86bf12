package org.dxworks.plcframe.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"tag", "conflict_type", "controllers", "details"})
public class ConflictRecord {
    public String tag;
    @JsonProperty("conflict_type")
    public String conflictType;
    public List<String> controllers = new ArrayList<>();
    public Map<String, String> details = new LinkedHashMap<>();
}
