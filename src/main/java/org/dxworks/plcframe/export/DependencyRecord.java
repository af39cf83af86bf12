package org.dxworks.plcframe.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"tag", "writer", "readers", "data_type"})
public class DependencyRecord {
    public String tag;
    public String writer;
    public List<String> readers = new ArrayList<>();
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("data_type")
    public String dataType;
}
