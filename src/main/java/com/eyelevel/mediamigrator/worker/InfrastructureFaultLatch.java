package com.eyelevel.mediamigrator.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Carries the first infrastructure fault raised on a worker thread to the orchestrator, which stops the run on
 * its next step.
 */
@Slf4j
@Component
public class InfrastructureFaultLatch {

    private final AtomicReference<RuntimeException> firstFault = new AtomicReference<>();

    public void report(RuntimeException fault) {
        if (firstFault.compareAndSet(null, fault)) {
            log.error("CRITICAL: Infrastructure fault on worker thread; the run will be stopped.", fault);
        } else {
            log.error("CRITICAL: Further infrastructure fault on worker thread: {}", fault.toString());
        }
    }

    public Optional<RuntimeException> fault() {
        return Optional.ofNullable(firstFault.get());
    }

    /**
     * Returns and forgets the recorded fault.
     */
    public Optional<RuntimeException> take() {
        return Optional.ofNullable(firstFault.getAndSet(null));
    }
}
