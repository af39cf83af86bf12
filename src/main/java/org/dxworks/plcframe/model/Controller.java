package org.dxworks.plcframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One PLC project / source unit as emitted by a front end. Immutable; overlays produce
 * a new instance through {@link #withOverlay(ControllerOverlay)}.
 */
@JsonPropertyOrder({"name", "source_type", "valid", "has_overlay", "tags", "udts", "programs"})
public final class Controller {
    private final String name;
    private final SourceType sourceType;
    private final List<Program> programs;
    private final List<Tag> tags;
    private final List<UserDefinedType> udts;
    private final boolean valid;
    private final boolean hasOverlay;

    @JsonCreator
    public Controller(@JsonProperty("name") String name,
                      @JsonProperty("source_type") SourceType sourceType,
                      @JsonProperty("programs") List<Program> programs,
                      @JsonProperty("tags") List<Tag> tags,
                      @JsonProperty("udts") List<UserDefinedType> udts,
                      @JsonProperty("valid") Boolean valid,
                      @JsonProperty("has_overlay") Boolean hasOverlay) {
        this.name = Objects.requireNonNull(name, "controller name");
        this.sourceType = Objects.requireNonNull(sourceType, "source type of controller " + name);
        this.programs = programs != null ? List.copyOf(programs) : List.of();
        this.tags = tags != null
                ? tags.stream().map(t -> t.withScope(TagScope.CONTROLLER)).toList()
                : List.of();
        this.udts = udts != null ? List.copyOf(udts) : List.of();
        this.valid = valid == null || valid;
        this.hasOverlay = hasOverlay != null && hasOverlay;
    }

    public Controller(String name, SourceType sourceType, List<Program> programs, List<Tag> tags) {
        this(name, sourceType, programs, tags, List.of(), true, false);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("source_type")
    public SourceType getSourceType() {
        return sourceType;
    }

    @JsonProperty("programs")
    public List<Program> getPrograms() {
        return programs;
    }

    @JsonProperty("tags")
    public List<Tag> getTags() {
        return tags;
    }

    @JsonProperty("udts")
    public List<UserDefinedType> getUdts() {
        return udts;
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return valid;
    }

    @JsonProperty("has_overlay")
    public boolean hasOverlay() {
        return hasOverlay;
    }

    public Optional<Tag> findGlobalTag(String tagName) {
        return tags.stream().filter(t -> t.getName().equals(tagName)).findFirst();
    }

    public Optional<Program> findProgram(String programName) {
        return programs.stream().filter(p -> p.getName().equals(programName)).findFirst();
    }

    /**
     * Every declared tag, globals first then program locals in program order.
     * This is the declaration order FSM tie-breaking relies on.
     */
    public List<Tag> allTags() {
        List<Tag> all = new ArrayList<>(tags);
        for (Program program : programs) {
            all.addAll(program.getTags());
        }
        return all;
    }

    /**
     * Resolves a bare tag name from inside {@code program}: program locals shadow globals.
     */
    public Optional<Tag> resolve(Program program, String tagName) {
        if (program != null) {
            Optional<Tag> local = program.findTag(tagName);
            if (local.isPresent()) {
                return local;
            }
        }
        return findGlobalTag(tagName);
    }

    /**
     * Merges overlay tags that are not already declared globally. Existing declarations
     * win: the overlay supplies context, it never redefines.
     */
    public Controller withOverlay(ControllerOverlay overlay) {
        if (!overlay.getController().equals(name)) {
            throw new IllegalArgumentException("Overlay for " + overlay.getController() + " applied to " + name);
        }
        List<Tag> merged = new ArrayList<>(tags);
        for (Tag extra : overlay.getTags()) {
            if (findGlobalTag(extra.getName()).isEmpty()) {
                merged.add(extra);
            }
        }
        return new Controller(name, sourceType, programs, merged, udts, valid, true);
    }
}
