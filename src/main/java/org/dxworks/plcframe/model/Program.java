package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class Program {
    private final String name;
    private final List<Routine> routines;
    private final List<Tag> tags;

    @JsonCreator
    public Program(@JsonProperty("name") String name,
                   @JsonProperty("routines") List<Routine> routines,
                   @JsonProperty("tags") List<Tag> tags) {
        this.name = Objects.requireNonNull(name, "program name");
        this.routines = routines != null ? List.copyOf(routines) : List.of();
        this.tags = tags != null
                ? tags.stream().map(t -> t.withScope(TagScope.PROGRAM)).toList()
                : List.of();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("routines")
    public List<Routine> getRoutines() {
        return routines;
    }

    @JsonProperty("tags")
    public List<Tag> getTags() {
        return tags;
    }

    public Optional<Tag> findTag(String tagName) {
        return tags.stream().filter(t -> t.getName().equals(tagName)).findFirst();
    }
}
