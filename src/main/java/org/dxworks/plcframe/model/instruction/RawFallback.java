package org.dxworks.plcframe.model.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.plcframe.model.expr.TagRef;

import java.util.List;
import java.util.Objects;

/**
 * A statement the IR cannot model precisely, kept as opaque text plus the tag
 * references a front end could extract. Keeps the CFG valid at the cost of def/use
 * precision for this one statement.
 */
public final class RawFallback implements Instruction {
    private final String text;
    private final List<TagRef> refs;

    @JsonCreator
    public RawFallback(@JsonProperty("text") String text,
                       @JsonProperty("refs") List<TagRef> refs) {
        this.text = Objects.requireNonNull(text, "raw text");
        this.refs = refs != null ? List.copyOf(refs) : List.of();
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("refs")
    public List<TagRef> getRefs() {
        return refs;
    }
}
