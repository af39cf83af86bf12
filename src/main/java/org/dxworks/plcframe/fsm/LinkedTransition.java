package org.dxworks.plcframe.fsm;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A transition in one controller that writes a tag read by the guard of a transition
 * in another controller.
 */
@JsonPropertyOrder({"writer", "writer_transition", "reader", "reader_transition", "tags"})
public final class LinkedTransition {
    private final String writer;
    private final String writerTransition;
    private final String reader;
    private final String readerTransition;
    private final List<String> tags;

    public LinkedTransition(String writer, FsmTransition writerTransition,
                            String reader, FsmTransition readerTransition, List<String> tags) {
        this.writer = writer;
        this.writerTransition = writerTransition.getFrom() + " -> " + writerTransition.getTo();
        this.reader = reader;
        this.readerTransition = readerTransition.getFrom() + " -> " + readerTransition.getTo();
        this.tags = List.copyOf(tags);
    }

    @JsonProperty("writer")
    public String getWriter() {
        return writer;
    }

    @JsonProperty("writer_transition")
    public String getWriterTransition() {
        return writerTransition;
    }

    @JsonProperty("reader")
    public String getReader() {
        return reader;
    }

    @JsonProperty("reader_transition")
    public String getReaderTransition() {
        return readerTransition;
    }

    @JsonProperty("tags")
    public List<String> getTags() {
        return tags;
    }
}
