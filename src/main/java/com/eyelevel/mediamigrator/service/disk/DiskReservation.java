package com.eyelevel.mediamigrator.service.disk;

/**
 * Bytes set aside for one admitted operation until it reports how much it actually wrote.
 */
public record DiskReservation(long id, long bytes, String purpose) {
}
