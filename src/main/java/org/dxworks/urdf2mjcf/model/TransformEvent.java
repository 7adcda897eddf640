package org.dxworks.urdf2mjcf.model;

/**
 * One structured log record emitted while transforming a document.
 * Serialized as-is into the events report.
 */
public class TransformEvent {
    public enum Level { DEBUG, INFO, WARN }

    public enum Kind {
        MATCH,
        NO_MATCH,
        OPERATION_APPLIED,
        OPERATION_SKIPPED,
        UNPARSEABLE,
        ATTRIBUTE_MISSING,
        ELEMENT_CREATED,
        PRECONDITION,
        INFO
    }

    public Level level;
    public Kind kind;
    public String message;
    public String tag; // element tag the event refers to, if any
    public Integer count; // match count for MATCH events

    public TransformEvent() {
    }

    public TransformEvent(Level level, Kind kind, String message) {
        this.level = level;
        this.kind = kind;
        this.message = message;
    }

    public TransformEvent withTag(String tag) {
        this.tag = tag;
        return this;
    }

    public TransformEvent withCount(int count) {
        this.count = count;
        return this;
    }

    @Override
    public String toString() {
        return level + " " + kind + ": " + message;
    }
}
