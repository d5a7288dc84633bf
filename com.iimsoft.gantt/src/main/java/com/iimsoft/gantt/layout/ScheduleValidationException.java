package com.iimsoft.gantt.layout;

/**
 * Thrown when a schedule cannot be laid out. No geometry is produced in that case.
 */
public class ScheduleValidationException extends IllegalArgumentException {

    public enum Reason {
        /** fewer than two items */
        INSUFFICIENT_INPUT,
        /** first item without a start date or without a resource */
        MISSING_ANCHOR,
        /** resource index outside the resource list */
        INVALID_REFERENCE,
        /** negative or overlong duration, or a chart spanning more months than can be drawn */
        OUT_OF_RANGE
    }

    private final Reason reason;
    private final int itemIndex;

    public ScheduleValidationException(Reason reason, int itemIndex, String message) {
        super(message);
        this.reason = reason;
        this.itemIndex = itemIndex;
    }

    public Reason getReason() {
        return reason;
    }

    /** index of the offending item, or -1 when the schedule as a whole is at fault */
    public int getItemIndex() {
        return itemIndex;
    }
}
