package com.demanddna.engine.event;

public enum EventType {
    SHOCK,
    CUSTOM_DRAG,
    SWAP,
    REAPPLIED_SHOCK
}
