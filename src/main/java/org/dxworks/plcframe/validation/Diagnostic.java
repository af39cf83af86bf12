package org.dxworks.plcframe.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A non-fatal finding about malformed-but-usable input. Diagnostics are collected and
 * reported together; none of them stops an analysis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "controller", "routine", "message"})
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final String controller;
    private final String routine;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String controller, String routine, String message) {
        this.kind = Objects.requireNonNull(kind, "diagnostic kind");
        this.controller = controller;
        this.routine = routine;
        this.message = Objects.requireNonNull(message, "diagnostic message");
    }

    @JsonProperty("kind")
    public DiagnosticKind getKind() {
        return kind;
    }

    @JsonProperty("controller")
    public String getController() {
        return controller;
    }

    @JsonProperty("routine")
    public String getRoutine() {
        return routine;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic that)) return false;
        return kind == that.kind && Objects.equals(controller, that.controller)
                && Objects.equals(routine, that.routine) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, controller, routine, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(kind.getName()).append("]");
        if (controller != null) {
            sb.append(' ').append(controller);
            if (routine != null) {
                sb.append('/').append(routine);
            }
        }
        return sb.append(": ").append(message).toString();
    }
}
