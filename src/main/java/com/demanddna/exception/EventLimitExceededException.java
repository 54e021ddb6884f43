package com.demanddna.exception;

public class EventLimitExceededException extends DemandDnaException {
    public EventLimitExceededException(int size, int max) {
        super("EVENT_LIMIT_EXCEEDED",
              "Event log size " + size + " would exceed the maximum allowed size of " + max + ".");
    }
}
