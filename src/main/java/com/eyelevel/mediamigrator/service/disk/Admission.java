package com.eyelevel.mediamigrator.service.disk;

/**
 * Decision of the {@link DiskBudgetGovernor}. A deferred caller must not start the operation.
 */
public record Admission(Decision decision, DiskReservation reservation, long availableBytes) {

    public enum Decision {
        ADMITTED,
        DEFERRED
    }

    static Admission admitted(DiskReservation reservation, long availableBytes) {
        return new Admission(Decision.ADMITTED, reservation, availableBytes);
    }

    static Admission deferred(long availableBytes) {
        return new Admission(Decision.DEFERRED, null, availableBytes);
    }

    public boolean isAdmitted() {
        return decision == Decision.ADMITTED;
    }
}
