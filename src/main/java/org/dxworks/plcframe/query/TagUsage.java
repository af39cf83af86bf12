package org.dxworks.plcframe.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Routines reading and writing one tag, as {@code Program/Routine} names in
 * declaration order.
 */
@JsonPropertyOrder({"tag", "readers", "writers", "programs"})
public final class TagUsage {
    private final String tag;
    private final List<String> readers;
    private final List<String> writers;
    private final List<String> programs;

    public TagUsage(String tag, List<String> readers, List<String> writers, List<String> programs) {
        this.tag = tag;
        this.readers = List.copyOf(readers);
        this.writers = List.copyOf(writers);
        this.programs = List.copyOf(programs);
    }

    @JsonProperty("tag")
    public String getTag() {
        return tag;
    }

    @JsonProperty("readers")
    public List<String> getReaders() {
        return readers;
    }

    @JsonProperty("writers")
    public List<String> getWriters() {
        return writers;
    }

    @JsonProperty("programs")
    public List<String> getPrograms() {
        return programs;
    }

    @JsonIgnore
    public boolean isUnused() {
        return readers.isEmpty() && writers.isEmpty();
    }
}
