package com.eyelevel.mediamigrator.scheduler;

import com.eyelevel.mediamigrator.exception.DiskBudgetException;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.worker.InfrastructureFaultLatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-measures the work directory so estimates booked by workers are replaced with real usage even while no
 * admission is being requested.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.migration.scheduler", name = "enabled", havingValue = "true",
                       matchIfMissing = true)
public class DiskUsageRecomputeScheduler {

    private final DiskBudgetGovernor diskBudgetGovernor;
    private final InfrastructureFaultLatch faultLatch;

    @Scheduled(fixedDelayString = "${app.migration.disk.recompute-interval-ms:60000}")
    public void recompute() {
        try {
            diskBudgetGovernor.recompute();
        } catch (DiskBudgetException e) {
            faultLatch.report(e);
        }
    }
}
