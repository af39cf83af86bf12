package org.dxworks.plcframe.model.expr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to a tag, optionally through a member suffix ({@code .START}, {@code .5},
 * {@code [3].Speed}). Bit-in-word and struct-field access share this one shape.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class TagRef implements Expression {
    private final String base;
    private final String member;

    @JsonCreator
    public TagRef(@JsonProperty("base") String base,
                  @JsonProperty("member") String member) {
        this.base = Objects.requireNonNull(base, "base tag");
        this.member = member != null ? member : "";
    }

    public static TagRef of(String base) {
        return new TagRef(base, "");
    }

    /**
     * Splits a dotted/indexed reference at the first {@code .} or {@code [}.
     */
    public static TagRef parse(String reference) {
        String text = reference.trim();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == '[') {
                return new TagRef(text.substring(0, i), text.substring(i));
            }
        }
        return new TagRef(text, "");
    }

    @JsonProperty("base")
    public String getBase() {
        return base;
    }

    @JsonProperty("member")
    public String getMember() {
        return member;
    }

    public boolean hasMember() {
        return !member.isEmpty();
    }

    /** Exact-match identity used by def/use analysis: base plus member suffix. */
    public String identity() {
        return base + member;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagRef tagRef)) return false;
        return base.equals(tagRef.base) && member.equals(tagRef.member);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, member);
    }

    @Override
    public String toString() {
        return identity();
    }
}
