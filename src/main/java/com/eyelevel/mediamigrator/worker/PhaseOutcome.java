package com.eyelevel.mediamigrator.worker;

/**
 * Result of processing one unit in a phase.
 *
 * @param output       what the phase produced; {@code null} on failure
 * @param bytesWritten bytes the phase left in the work directory
 * @param error        the failure, {@code null} on success
 */
public record PhaseOutcome<T>(T output, long bytesWritten, Throwable error) {

    public static <T> PhaseOutcome<T> success(T output, long bytesWritten) {
        return new PhaseOutcome<>(output, bytesWritten, null);
    }

    public static <T> PhaseOutcome<T> success(T output) {
        return success(output, 0L);
    }

    public static <T> PhaseOutcome<T> failure(Throwable error) {
        return new PhaseOutcome<>(null, 0L, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
