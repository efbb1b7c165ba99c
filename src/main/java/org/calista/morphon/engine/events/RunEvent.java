package org.calista.morphon.engine.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One line of the run journal. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RunEvent {
    public String type;        // "RUN_START", "CLASSIFICATION_GAP", "HAZARD_SUMMARY", "CHECK", "RUN_DONE"
    public long tsEpochMs;
    public String runId;
    public String subject;     // record / assertion / token, when there is one
    public String text;

    public static RunEvent of(String type, String runId, String subject, String text, long tsEpochMs) {
        RunEvent e = new RunEvent();
        e.type = type;
        e.runId = runId;
        e.subject = subject;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
