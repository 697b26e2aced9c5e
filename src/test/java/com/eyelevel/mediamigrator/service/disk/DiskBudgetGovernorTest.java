package com.eyelevel.mediamigrator.service.disk;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.DiskBudgetException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiskBudgetGovernorTest {

    @TempDir
    Path workDir;

    private final FakeProbe probe = new FakeProbe();
    private MigrationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MigrationProperties();
        properties.setWorkDir(workDir.toString());
        properties.getDisk().setCeilingBytes(1_000);
        properties.getDisk().setMinFreeBytes(0);
        properties.getDisk().setCleanupThresholdBytes(500);
        properties.getDisk().setRecomputeIntervalMs(60_000);
        probe.used = 0;
        probe.usable = 10_000;
    }

    private DiskBudgetGovernor governor() {
        DiskBudgetGovernor governor = new DiskBudgetGovernor(properties, probe,
                                                             Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        governor.initialize();
        return governor;
    }

    @Test
    void admitsWholeEstimateOrDefers() {
        DiskBudgetGovernor governor = governor();

        Admission first = governor.admit(600, "download a");
        Admission second = governor.admit(500, "download b");

        assertThat(first.isAdmitted()).isTrue();
        assertThat(first.availableBytes()).isEqualTo(400);
        assertThat(second.isAdmitted()).isFalse();
        assertThat(second.reservation()).isNull();
        assertThat(governor.snapshot().reservedBytes()).isEqualTo(600);
    }

    @Test
    void releaseBooksActualBytesInsteadOfTheEstimate() {
        DiskBudgetGovernor governor = governor();
        Admission admission = governor.admit(600, "extract a");

        governor.release(admission.reservation(), 300);

        DiskBudget budget = governor.snapshot();
        assertThat(budget.reservedBytes()).isZero();
        assertThat(budget.usedBytes()).isEqualTo(300);
        assertThat(budget.availableBytes()).isEqualTo(700);
    }

    @Test
    void releasingTwiceIsIgnored() {
        DiskBudgetGovernor governor = governor();
        Admission admission = governor.admit(600, "extract a");

        governor.release(admission.reservation(), 600);
        governor.release(admission.reservation(), 600);

        assertThat(governor.snapshot().usedBytes()).isEqualTo(600);
    }

    @Test
    void recomputeReplacesBookedEstimatesWithMeasuredUsage() {
        DiskBudgetGovernor governor = governor();
        governor.release(governor.admit(600, "download a").reservation(), 600);
        governor.recordFreed(100);

        probe.used = 200;
        governor.recompute();

        assertThat(governor.snapshot().usedBytes()).isEqualTo(200);
        assertThat(governor.snapshot().availableBytes()).isEqualTo(800);
    }

    @Test
    void filesystemBoundsAnUnlimitedCeiling() {
        properties.getDisk().setCeilingBytes(-1);
        properties.getDisk().setMinFreeBytes(1_000);
        probe.usable = 5_000;
        DiskBudgetGovernor governor = governor();

        assertThat(governor.snapshot().availableBytes()).isEqualTo(4_000);
        assertThat(governor.admit(4_001, "too big").isAdmitted()).isFalse();
        assertThat(governor.canEverFit(4_000)).isTrue();
    }

    @Test
    void canEverFitRejectsUnitsLargerThanTheCeiling() {
        DiskBudgetGovernor governor = governor();

        assertThat(governor.canEverFit(1_000)).isTrue();
        assertThat(governor.canEverFit(1_001)).isFalse();
    }

    @Test
    void cleanupThresholdIsCrossedWhenAvailableSpaceRunsLow() {
        DiskBudgetGovernor governor = governor();
        assertThat(governor.cleanupThresholdCrossed()).isFalse();

        governor.admit(600, "download a");

        assertThat(governor.cleanupThresholdCrossed()).isTrue();
    }

    @Test
    void outstandingReservationsNeverExceedTheBudget() {
        DiskBudgetGovernor governor = governor();
        Random random = new Random(42);
        List<DiskReservation> outstanding = new ArrayList<>();

        for (int i = 0; i < 500; i++) {
            if (!outstanding.isEmpty() && random.nextBoolean()) {
                governor.release(outstanding.remove(random.nextInt(outstanding.size())), 0);
            } else {
                Admission admission = governor.admit(random.nextInt(400), "unit " + i);
                if (admission.isAdmitted()) {
                    outstanding.add(admission.reservation());
                }
            }
            long reserved = outstanding.stream().mapToLong(DiskReservation::bytes).sum();
            assertThat(reserved).isLessThanOrEqualTo(1_000);
            assertThat(governor.snapshot().reservedBytes()).isEqualTo(reserved);
        }
    }

    @Test
    void failedMeasurementIsAnInfrastructureFault() {
        DiskBudgetGovernor governor = governor();
        probe.failure = new IOException("device gone");

        assertThatThrownBy(governor::recompute).isInstanceOf(DiskBudgetException.class)
                                               .hasMessageContaining("Unable to measure");
    }

    @Test
    void negativeEstimateIsRejected() {
        DiskBudgetGovernor governor = governor();

        assertThatThrownBy(() -> governor.admit(-1, "bogus")).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class FakeProbe implements DiskUsageProbe {
        long used;
        long usable;
        IOException failure;

        @Override
        public long measureUsedBytes(Path directory) throws IOException {
            if (failure != null) {
                throw failure;
            }
            return used;
        }

        @Override
        public long usableBytes(Path directory) throws IOException {
            if (failure != null) {
                throw failure;
            }
            return usable;
        }
    }
}
