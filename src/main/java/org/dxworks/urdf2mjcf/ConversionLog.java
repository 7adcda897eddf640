package org.dxworks.urdf2mjcf;

import org.dxworks.urdf2mjcf.model.TransformEvent;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;
import org.dxworks.urdf2mjcf.model.TransformEvent.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Event stream of one conversion run. Every event is kept in order for the
 * report and mirrored to the SLF4J logger at the matching level.
 */
public class ConversionLog {
    private static final Logger LOG = LoggerFactory.getLogger(ConversionLog.class);

    private final List<TransformEvent> events = new ArrayList<>();

    public TransformEvent debug(Kind kind, String message) {
        return record(new TransformEvent(Level.DEBUG, kind, message));
    }

    public TransformEvent info(Kind kind, String message) {
        return record(new TransformEvent(Level.INFO, kind, message));
    }

    public TransformEvent info(String message) {
        return info(Kind.INFO, message);
    }

    public TransformEvent warn(Kind kind, String message) {
        return record(new TransformEvent(Level.WARN, kind, message));
    }

    public TransformEvent record(TransformEvent event) {
        events.add(event);
        switch (event.level) {
            case DEBUG -> LOG.debug(event.message);
            case INFO -> LOG.info(event.message);
            case WARN -> LOG.warn(event.message);
        }
        return event;
    }

    public List<TransformEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<TransformEvent> eventsOf(Kind kind) {
        return events.stream().filter(e -> e.kind == kind).collect(Collectors.toList());
    }

    public List<TransformEvent> warnings() {
        return events.stream().filter(e -> e.level == Level.WARN).collect(Collectors.toList());
    }
}
