package com.eyelevel.mediamigrator.service.disk;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.DiskBudgetException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Admission gate for every operation that writes to the work directory.
 * <p>
 * An operation is admitted with its full estimate or deferred; there is no partial admission. Admitted estimates
 * are held as reservations until the operation reports how much it actually wrote, and those bytes are then
 * booked as usage until the next measurement of the work directory replaces the estimate with the real figure.
 * <p>
 * All state is guarded by the instance monitor. Admission decisions are cheap and never touch the disk except
 * when a periodic recomputation is due.
 */
@Slf4j
@Component
public class DiskBudgetGovernor {

    private final MigrationProperties.Disk config;
    private final Path workDir;
    private final DiskUsageProbe probe;
    private final Clock clock;

    private final Map<Long, DiskReservation> outstanding = new HashMap<>();
    private long nextReservationId;
    private long reservedBytes;
    private long measuredUsageBytes;
    private long filesystemUsableBytes;
    private long bookedSinceMeasurement;
    private long lastMeasurementMillis = Long.MIN_VALUE;

    public DiskBudgetGovernor(MigrationProperties properties, DiskUsageProbe probe, Clock clock) {
        this.config = properties.getDisk();
        this.workDir = Paths.get(properties.getWorkDir()).toAbsolutePath().normalize();
        this.probe = probe;
        this.clock = clock;
    }

    @PostConstruct
    void initialize() {
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new DiskBudgetException("Cannot create work directory " + workDir, e);
        }
        recompute();
        log.info("Disk budget initialised for '{}': ceiling={}, used={}, filesystem usable={}, min free={}.",
                 workDir, config.getCeilingBytes() < 0 ? "unlimited" : describe(config.getCeilingBytes()),
                 describe(measuredUsageBytes), describe(filesystemUsableBytes), describe(config.getMinFreeBytes()));
    }

    /**
     * Reserves {@code estimatedBytes} for {@code purpose} if the budget allows it.
     *
     * @throws DiskBudgetException if a due recomputation cannot measure the work directory.
     */
    public synchronized Admission admit(long estimatedBytes, String purpose) {
        if (estimatedBytes < 0) {
            throw new IllegalArgumentException("Estimated bytes must not be negative: " + estimatedBytes);
        }
        recomputeIfDue();
        long available = availableBytes();
        if (estimatedBytes > available) {
            log.warn("Deferring '{}': needs {}, only {} available ({} reserved).", purpose, describe(estimatedBytes),
                     describe(available), describe(reservedBytes));
            return Admission.deferred(available);
        }
        DiskReservation reservation = new DiskReservation(++nextReservationId, estimatedBytes, purpose);
        outstanding.put(reservation.id(), reservation);
        reservedBytes += estimatedBytes;
        log.debug("Admitted '{}' with {} (reservation #{}); {} left.", purpose, describe(estimatedBytes),
                  reservation.id(), describe(available - estimatedBytes));
        return Admission.admitted(reservation, available - estimatedBytes);
    }

    /**
     * Returns a reservation and books what the operation actually left on disk.
     */
    public synchronized void release(DiskReservation reservation, long actualBytesWritten) {
        if (reservation == null) {
            return;
        }
        if (outstanding.remove(reservation.id()) == null) {
            log.warn("Reservation #{} for '{}' was already released.", reservation.id(), reservation.purpose());
            return;
        }
        reservedBytes -= reservation.bytes();
        bookedSinceMeasurement += Math.max(0L, actualBytesWritten);
        log.debug("Released reservation #{} for '{}': reserved {}, wrote {}.", reservation.id(),
                  reservation.purpose(), describe(reservation.bytes()), describe(actualBytesWritten));
    }

    /**
     * Books bytes removed from the work directory by cleanup.
     */
    public synchronized void recordFreed(long bytes) {
        bookedSinceMeasurement -= Math.max(0L, bytes);
    }

    /**
     * Measures the work directory and the filesystem, replacing every estimate booked since the last measurement.
     *
     * @throws DiskBudgetException if the measurement fails.
     */
    public synchronized void recompute() {
        try {
            measuredUsageBytes = probe.measureUsedBytes(workDir);
            filesystemUsableBytes = probe.usableBytes(workDir);
        } catch (IOException | UncheckedIOException e) {
            log.error("CRITICAL: Unable to measure disk usage of '{}'.", workDir, e);
            throw new DiskBudgetException("Unable to measure disk usage of " + workDir, e);
        }
        bookedSinceMeasurement = 0L;
        lastMeasurementMillis = clock.millis();
        log.debug("Disk usage recomputed: used={}, filesystem usable={}, reserved={}.",
                  describe(measuredUsageBytes), describe(filesystemUsableBytes), describe(reservedBytes));
    }

    /**
     * @return {@code true} when available space has fallen below the configured cleanup threshold.
     */
    public synchronized boolean cleanupThresholdCrossed() {
        return availableBytes() < config.getCleanupThresholdBytes();
    }

    /**
     * @return {@code false} if {@code bytes} exceeds the whole budget, so waiting for space can never help.
     */
    public synchronized boolean canEverFit(long bytes) {
        long filesystemBound = filesystemUsableBytes + measuredUsageBytes - config.getMinFreeBytes();
        if (config.getCeilingBytes() < 0) {
            return bytes <= filesystemBound;
        }
        return bytes <= Math.min(config.getCeilingBytes(), filesystemBound);
    }

    public synchronized DiskBudget snapshot() {
        return new DiskBudget(config.getCeilingBytes(), measuredUsageBytes + bookedSinceMeasurement, reservedBytes,
                              availableBytes(), filesystemUsableBytes);
    }

    private void recomputeIfDue() {
        long now = clock.millis();
        if (lastMeasurementMillis == Long.MIN_VALUE || now - lastMeasurementMillis >= config.getRecomputeIntervalMs()) {
            recompute();
        }
    }

    private long availableBytes() {
        long usage = measuredUsageBytes + bookedSinceMeasurement;
        // Bytes booked since the last measurement are not yet reflected in the filesystem figure.
        long filesystemAvailable = filesystemUsableBytes - bookedSinceMeasurement - config.getMinFreeBytes();
        long ceilingAvailable = config.getCeilingBytes() < 0 ? Long.MAX_VALUE : config.getCeilingBytes() - usage;
        return Math.max(0L, Math.min(filesystemAvailable, ceilingAvailable) - reservedBytes);
    }

    private static String describe(long bytes) {
        return FileUtils.byteCountToDisplaySize(Math.max(0L, bytes));
    }
}
