package org.dxworks.plcframe.project;

import org.dxworks.plcframe.model.Tag;

/**
 * A tag as declared by one controller; {@code program} is null for globals.
 */
public final class TagDeclaration {
    private final String controller;
    private final String program;
    private final Tag tag;

    public TagDeclaration(String controller, String program, Tag tag) {
        this.controller = controller;
        this.program = program;
        this.tag = tag;
    }

    public String getController() {
        return controller;
    }

    public String getProgram() {
        return program;
    }

    public Tag getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return controller + (program != null ? "/" + program : "") + ":" + tag.getName();
    }
}
