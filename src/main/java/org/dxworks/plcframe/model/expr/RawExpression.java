package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Expression text a front end could not lower, with the tag references it could
 * still pick out of it.
 */
public final class RawExpression implements Expression {
    private final String text;
    private final List<TagRef> refs;

    @JsonCreator
    public RawExpression(@JsonProperty("text") String text,
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
