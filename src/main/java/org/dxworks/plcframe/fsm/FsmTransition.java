package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A guarded change of the state variable. {@code from} is {@link #ANY} when the
 * enclosing state is not statically known.
 */
@JsonPropertyOrder({"from", "to", "guard", "actions"})
public final class FsmTransition {

    public static final String ANY = "any";

    private final String from;
    private final String to;
    private final String guard;
    private final List<String> actions;
    private final String routine;
    private final SortedSet<String> guardTags;
    private final SortedSet<String> writtenTags;

    public FsmTransition(String from, String to, String guard, List<String> actions,
                         String routine, SortedSet<String> guardTags, SortedSet<String> writtenTags) {
        this.from = Objects.requireNonNull(from, "from state");
        this.to = Objects.requireNonNull(to, "to state");
        this.guard = guard != null ? guard : "";
        this.actions = List.copyOf(actions);
        this.routine = routine;
        this.guardTags = Collections.unmodifiableSortedSet(new TreeSet<>(guardTags));
        this.writtenTags = Collections.unmodifiableSortedSet(new TreeSet<>(writtenTags));
    }

    @JsonProperty("from")
    public String getFrom() {
        return from;
    }

    @JsonProperty("to")
    public String getTo() {
        return to;
    }

    @JsonProperty("guard")
    public String getGuard() {
        return guard;
    }

    @JsonProperty("actions")
    public List<String> getActions() {
        return actions;
    }

    @JsonIgnore
    public String getRoutine() {
        return routine;
    }

    /** Tags read by the guard. */
    @JsonIgnore
    public SortedSet<String> getGuardTags() {
        return guardTags;
    }

    /** Tags written when the transition fires, the state variable included. */
    @JsonIgnore
    public SortedSet<String> getWrittenTags() {
        return writtenTags;
    }

    @JsonIgnore
    public boolean hasKnownSource() {
        return !ANY.equals(from);
    }

    @Override
    public String toString() {
        return from + " -> " + to + (guard.isEmpty() ? "" : " [" + guard + "]");
    }
}
