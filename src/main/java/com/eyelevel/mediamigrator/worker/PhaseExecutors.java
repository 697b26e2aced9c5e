package com.eyelevel.mediamigrator.worker;

import org.springframework.core.task.TaskExecutor;

/**
 * The per-phase worker pools handed to the orchestrator.
 */
public record PhaseExecutors(TaskExecutor download,
                             TaskExecutor extract,
                             TaskExecutor metadata,
                             TaskExecutor upload) {
}
