package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"name", "controllers", "fsms", "linked_transitions", "shared_tags"})
public final class CompositeFsm {

    public static final String NAME = "Composite_FSM";

    private final List<String> controllers;
    private final List<FsmModel> fsms;
    private final List<LinkedTransition> linkedTransitions;
    private final List<String> sharedTags;

    public CompositeFsm(List<String> controllers, List<FsmModel> fsms,
                        List<LinkedTransition> linkedTransitions, List<String> sharedTags) {
        this.controllers = List.copyOf(controllers);
        this.fsms = List.copyOf(fsms);
        this.linkedTransitions = List.copyOf(linkedTransitions);
        this.sharedTags = List.copyOf(sharedTags);
    }

    @JsonProperty("name")
    public String getName() {
        return NAME;
    }

    @JsonProperty("controllers")
    public List<String> getControllers() {
        return controllers;
    }

    @JsonProperty("fsms")
    public List<FsmModel> getFsms() {
        return fsms;
    }

    @JsonProperty("linked_transitions")
    public List<LinkedTransition> getLinkedTransitions() {
        return linkedTransitions;
    }

    /** Tags taking part in at least one link, sorted. */
    @JsonProperty("shared_tags")
    public List<String> getSharedTags() {
        return sharedTags;
    }
}
