package com.eyelevel.mediamigrator.service.orchestrator;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs once the State Store has been verified: resets units an interrupted process left in flight and, when
 * auto-start is enabled, resumes the active run or starts a new one.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class StartupRecovery implements ApplicationRunner {

    private final PipelineOrchestrator pipelineOrchestrator;
    private final RunLifecycleService runLifecycleService;
    private final MigrationProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        pipelineOrchestrator.recoverInFlight();
        if (properties.getScheduler().isAutoStart()) {
            RunState run = runLifecycleService.startOrResume();
            log.info("Auto-start: run #{} is {}.", run.runId(), run.status());
        } else {
            runLifecycleService.current().ifPresentOrElse(
                    run -> log.info("Run #{} is {}; the scheduler will continue it.", run.runId(), run.status()),
                    () -> log.info("No active run. Start one through the operator API."));
        }
    }
}
