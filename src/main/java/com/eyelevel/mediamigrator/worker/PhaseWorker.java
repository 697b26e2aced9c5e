package com.eyelevel.mediamigrator.worker;

import com.eyelevel.mediamigrator.exception.DiskBudgetException;
import com.eyelevel.mediamigrator.exception.StateStoreException;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.disk.DiskReservation;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessException;

import java.util.List;

/**
 * A bounded pool of workers for one pipeline phase.
 * <p>
 * The orchestrator picks candidates, admits their disk estimate, moves each into the phase's in-flight state
 * with {@link #claim} and hands it to {@link #execute} on the phase's executor. The CAS in {@code claim} is what
 * keeps a unit from being processed twice. {@link #execute} never lets a per-unit failure escape: it is
 * classified and recorded on the unit. Only infrastructure faults are passed on, through the
 * {@link InfrastructureFaultLatch}.
 *
 * @param <U> unit type
 * @param <T> phase output
 */
@Slf4j
public abstract class PhaseWorker<U, T> {

    protected final DiskBudgetGovernor diskBudgetGovernor;
    private final InfrastructureFaultLatch faultLatch;

    protected PhaseWorker(DiskBudgetGovernor diskBudgetGovernor, InfrastructureFaultLatch faultLatch) {
        this.diskBudgetGovernor = diskBudgetGovernor;
        this.faultLatch = faultLatch;
    }

    public abstract String phaseName();

    public abstract String unitId(U unit);

    public abstract TaskExecutor executor();

    /**
     * Configured pool size.
     */
    public abstract int capacity();

    /**
     * Units currently held in this phase's in-flight state, according to the State Store.
     */
    public abstract long inFlightCount();

    /**
     * Units ready for this phase whose retry back-off has elapsed, ordered by id.
     */
    public abstract List<U> findCandidates(int limit);

    /**
     * Bytes the unit may write to the work directory; {@code 0} when the phase needs no admission.
     */
    public abstract long estimateBytes(U unit);

    /**
     * Moves the unit into the in-flight state.
     */
    public abstract TransitionResult claim(U unit);

    /**
     * Undoes {@link #claim} for a unit that was never started.
     */
    public abstract void releaseClaim(U unit);

    /**
     * Fails a unit whose estimate exceeds the whole disk budget.
     */
    public abstract void rejectOversized(U unit, long estimatedBytes);

    protected abstract PhaseOutcome<T> process(U unit);

    protected abstract void recordFailure(U unit, Throwable error);

    /**
     * Processes a claimed unit and returns its disk reservation.
     */
    public final PhaseOutcome<T> execute(U unit, DiskReservation reservation) {
        String unitId = unitId(unit);
        PhaseOutcome<T> outcome;
        try {
            outcome = process(unit);
        } catch (StateStoreException | DiskBudgetException | DataAccessException e) {
            diskBudgetGovernor.release(reservation, 0L);
            faultLatch.report(e);
            return PhaseOutcome.failure(e);
        } catch (RuntimeException e) {
            outcome = PhaseOutcome.failure(e);
        }

        diskBudgetGovernor.release(reservation, outcome.bytesWritten());
        if (outcome.isSuccess()) {
            log.debug("[{}] {} finished.", unitId, phaseName());
            return outcome;
        }
        try {
            recordFailure(unit, outcome.error());
        } catch (StateStoreException | DataAccessException e) {
            faultLatch.report(e);
        }
        return outcome;
    }
}
