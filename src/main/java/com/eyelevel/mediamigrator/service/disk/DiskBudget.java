package com.eyelevel.mediamigrator.service.disk;

/**
 * Point-in-time view of the disk budget.
 *
 * @param ceilingBytes          configured ceiling, or -1 when bounded by the filesystem only
 * @param usedBytes             last measured usage plus bytes booked since
 * @param reservedBytes         sum of outstanding reservations
 * @param availableBytes        what the next admission may take
 * @param filesystemUsableBytes usable space on the filesystem at the last measurement
 */
public record DiskBudget(long ceilingBytes,
                         long usedBytes,
                         long reservedBytes,
                         long availableBytes,
                         long filesystemUsableBytes) {
}
