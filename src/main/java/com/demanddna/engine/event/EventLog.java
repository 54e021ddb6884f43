package com.demanddna.engine.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable event log. Every mutation returns a new log so a scenario can be
 * replaced atomically and prefixes can be evaluated concurrently.
 */
public final class EventLog {

    private static final EventLog EMPTY = new EventLog(List.of());

    private final List<SimulationEvent> events;

    private EventLog(List<SimulationEvent> events) {
        this.events = events;
    }

    public static EventLog empty() {
        return EMPTY;
    }

    public static EventLog of(List<? extends SimulationEvent> events) {
        return events.isEmpty() ? EMPTY : new EventLog(List.copyOf(events));
    }

    public EventLog append(SimulationEvent event) {
        List<SimulationEvent> next = new ArrayList<>(events);
        next.add(event);
        return new EventLog(Collections.unmodifiableList(next));
    }

    public EventLog removeAt(int index) {
        checkIndex(index);
        List<SimulationEvent> next = new ArrayList<>(events);
        next.remove(index);
        return of(next);
    }

    public EventLog replaceAt(int index, SimulationEvent event) {
        checkIndex(index);
        List<SimulationEvent> next = new ArrayList<>(events);
        next.set(index, event);
        return new EventLog(Collections.unmodifiableList(next));
    }

    /** First {@code length} events, in order. */
    public List<SimulationEvent> prefix(int length) {
        return events.subList(0, length);
    }

    public SimulationEvent get(int index) {
        checkIndex(index);
        return events.get(index);
    }

    public List<SimulationEvent> events() {
        return events;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= events.size()) {
            throw new IndexOutOfBoundsException("Event index " + index + " outside log of size " + events.size());
        }
    }
}
