package org.dxworks.plcframe.project;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A bare tag name declared by several controllers in a way that suggests the
 * declarations do not denote one intentionally shared tag.
 */
public final class Conflict {
    private final String tag;
    private final ConflictKind kind;
    private final List<String> controllers;
    private final Map<String, String> details;

    public Conflict(String tag, ConflictKind kind, List<String> controllers, Map<String, String> details) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.kind = Objects.requireNonNull(kind, "conflict kind");
        this.controllers = List.copyOf(controllers);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getTag() {
        return tag;
    }

    public ConflictKind getKind() {
        return kind;
    }

    public List<String> getControllers() {
        return controllers;
    }

    /** Per controller: the declared type (type mismatch) or the member shape (name collision). */
    public Map<String, String> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return tag + " " + kind.getName() + " " + controllers;
    }
}
