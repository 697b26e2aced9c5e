package com.eyelevel.mediamigrator.scheduler;

import com.eyelevel.mediamigrator.service.orchestrator.PipelineOrchestrator;
import com.eyelevel.mediamigrator.service.orchestrator.RunLifecycleService;
import com.eyelevel.mediamigrator.service.orchestrator.RunState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Advances the active migration run by one orchestrator step at a fixed delay.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.migration.scheduler", name = "enabled", havingValue = "true",
                       matchIfMissing = true)
public class PipelineScheduler {

    private final RunLifecycleService runLifecycleService;
    private final PipelineOrchestrator pipelineOrchestrator;

    @Scheduled(fixedDelayString = "${app.migration.scheduler.step-delay-ms:5000}",
               initialDelayString = "${app.migration.scheduler.step-delay-ms:5000}")
    public void advanceActiveRun() {
        try {
            Optional<RunState> active = runLifecycleService.current();
            if (active.isEmpty()) {
                log.debug("No active migration run.");
                return;
            }
            RunState after = pipelineOrchestrator.step(active.get());
            if (after.status() != active.get().status()) {
                log.info("Run #{} is now {}.", after.runId(), after.status());
            }
        } catch (RuntimeException e) {
            log.error("Pipeline step failed.", e);
        }
    }
}
