package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Supplementary project metadata for one controller, e.g. the tag database exported
 * next to a Rockwell L5X in an L5K file.
 */
public final class ControllerOverlay {
    private final String controller;
    private final List<Tag> tags;
    private final String description;

    @JsonCreator
    public ControllerOverlay(@JsonProperty("controller") String controller,
                             @JsonProperty("tags") List<Tag> tags,
                             @JsonProperty("description") String description) {
        this.controller = Objects.requireNonNull(controller, "overlay controller name");
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.description = description;
    }

    @JsonProperty("controller")
    public String getController() {
        return controller;
    }

    @JsonProperty("tags")
    public List<Tag> getTags() {
        return tags;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }
}
