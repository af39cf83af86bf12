package org.dxworks.plcframe.export;

/**
 * One line of the JSONL report. {@code kind} tells readers how to decode the rest.
 */
public interface ReportRecord {
    String getKind();
}
