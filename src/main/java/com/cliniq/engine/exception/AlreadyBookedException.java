package com.cliniq.engine.exception;

public class AlreadyBookedException extends EngineException {

    private final Long slotId;

    public AlreadyBookedException(Long slotId) {
        super("ALREADY_BOOKED", "Slot " + slotId + " is no longer available.");
        this.slotId = slotId;
    }

    public Long getSlotId() {
        return slotId;
    }
}
