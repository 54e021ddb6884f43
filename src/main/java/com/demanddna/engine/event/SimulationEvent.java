package com.demanddna.engine.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One entry of a scenario's event log. The variant set is closed; consumers branch on
 * the concrete type and ignore variants that do not concern them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ShockEvent.class, name = "shock"),
    @JsonSubTypes.Type(value = CustomDragEvent.class, name = "custom_drag"),
    @JsonSubTypes.Type(value = SwapEvent.class, name = "swap"),
    @JsonSubTypes.Type(value = ReappliedShockEvent.class, name = "reapplied_shock")
})
public interface SimulationEvent {

    EventType eventType();

    /**
     * Layer the event edits. Shocks and re-injections never touch the index layers and
     * report {@link EventScope#POST_TRIAL}.
     */
    EventScope effectiveScope();

    /** Human readable one-liner for logs and attribution rows. */
    String describe();
}
