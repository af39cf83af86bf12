package org.dxworks.plcframe.dataflow;

import java.util.List;
import java.util.Objects;

/**
 * Tag written in one scope and read in others. The scope is a qualified routine name
 * for routine-level flows and a controller name for project-level flows.
 */
public final class CrossDependency {
    private final String tag;
    private final String writer;
    private final List<String> readers;
    private final String dataType;

    public CrossDependency(String tag, String writer, List<String> readers, String dataType) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.readers = List.copyOf(readers);
        this.dataType = dataType;
    }

    public CrossDependency(String tag, String writer, List<String> readers) {
        this(tag, writer, readers, null);
    }

    public String getTag() {
        return tag;
    }

    public String getWriter() {
        return writer;
    }

    public List<String> getReaders() {
        return readers;
    }

    /** Declared type at the writer, when the writer declares the tag. */
    public String getDataType() {
        return dataType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CrossDependency that)) return false;
        return tag.equals(that.tag) && writer.equals(that.writer) && readers.equals(that.readers)
                && Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, writer, readers, dataType);
    }

    @Override
    public String toString() {
        return tag + ": " + writer + " -> " + readers;
    }
}
