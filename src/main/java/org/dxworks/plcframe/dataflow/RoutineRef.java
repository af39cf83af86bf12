package org.dxworks.plcframe.dataflow;

import java.util.Objects;

/** Location of a routine: controller / program / routine. */
public final class RoutineRef {
    private final String controller;
    private final String program;
    private final String routine;

    public RoutineRef(String controller, String program, String routine) {
        this.controller = Objects.requireNonNull(controller, "controller of routine " + routine);
        this.program = Objects.requireNonNull(program, "owning program of routine " + routine);
        this.routine = Objects.requireNonNull(routine, "routine name");
    }

    public String getController() {
        return controller;
    }

    public String getProgram() {
        return program;
    }

    public String getRoutine() {
        return routine;
    }

    public String qualifiedName() {
        return controller + "/" + program + "/" + routine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoutineRef that)) return false;
        return controller.equals(that.controller) && program.equals(that.program) && routine.equals(that.routine);
    }

    @Override
    public int hashCode() {
        return Objects.hash(controller, program, routine);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
