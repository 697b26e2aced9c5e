package com.eyelevel.mediamigrator.controller;

import com.eyelevel.mediamigrator.dto.common.ApiResponse;
import com.eyelevel.mediamigrator.dto.report.MigrationReport;
import com.eyelevel.mediamigrator.dto.run.RunStatusResponse;
import com.eyelevel.mediamigrator.dto.run.UnitActionResponse;
import com.eyelevel.mediamigrator.service.operator.OperatorActionService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for operating a migration run. All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/migration/v1")
@RequiredArgsConstructor
@Validated
public class MigrationController implements MigrationApi {

    private final OperatorActionService operatorActionService;

    // --- 1. RUN CONTROL ---

    @Override
    @PostMapping("/runs")
    public ResponseEntity<ApiResponse<RunStatusResponse>> startRun() {
        log.info("Operator requested a migration run start.");
        RunStatusResponse run = operatorActionService.start();
        return ResponseEntity.ok(ApiResponse.success(describe(run), run));
    }

    @Override
    @GetMapping("/runs/current")
    public ResponseEntity<ApiResponse<RunStatusResponse>> getCurrentRun() {
        RunStatusResponse run = operatorActionService.status();
        return ResponseEntity.ok(ApiResponse.success(null, run));
    }

    @Override
    @PostMapping("/runs/current/proceed")
    public ResponseEntity<ApiResponse<RunStatusResponse>> proceed() {
        log.info("Operator requested to proceed past the failure threshold.");
        RunStatusResponse run = operatorActionService.proceed();
        return ResponseEntity.ok(ApiResponse.success(
                describe(run) + " " + run.getAcknowledgedFailures() + " failed item(s) acknowledged.", run));
    }

    @Override
    @PostMapping("/runs/current/stop")
    public ResponseEntity<ApiResponse<RunStatusResponse>> stop() {
        log.info("Operator requested a graceful stop.");
        RunStatusResponse run = operatorActionService.stop();
        return ResponseEntity.ok(ApiResponse.success(describe(run), run));
    }

    @Override
    @PostMapping("/runs/current/discover")
    public ResponseEntity<ApiResponse<RunStatusResponse>> discover() {
        log.info("Operator requested archive re-discovery.");
        RunStatusResponse run = operatorActionService.discover();
        return ResponseEntity.ok(ApiResponse.success("Archive source listed.", run));
    }

    // --- 2. REPORTING ---

    @Override
    @GetMapping("/report")
    public ResponseEntity<ApiResponse<MigrationReport>> getReport() {
        return ResponseEntity.ok(ApiResponse.success(null, operatorActionService.report()));
    }

    // --- 3. UNIT ACTIONS ---

    @Override
    @PostMapping("/items/retry")
    public ResponseEntity<ApiResponse<UnitActionResponse>> retryItem(
            @RequestParam("id") @NotBlank(message = "The item id cannot be empty.") final String id) {
        log.info("Operator retry for item {}", id);
        UnitActionResponse result = operatorActionService.retryItem(id);
        return ResponseEntity.ok(ApiResponse.success("Item queued for retry from " + result.phase() + ".", result));
    }

    @Override
    @PostMapping("/items/skip")
    public ResponseEntity<ApiResponse<UnitActionResponse>> skipItem(
            @RequestParam("id") @NotBlank(message = "The item id cannot be empty.") final String id) {
        log.info("Operator skip for item {}", id);
        return ResponseEntity.ok(ApiResponse.success("Item skipped.", operatorActionService.skipItem(id)));
    }

    @Override
    @PostMapping("/archives/reacquire")
    public ResponseEntity<ApiResponse<UnitActionResponse>> reacquireArchive(
            @RequestParam("id") @NotBlank(message = "The archive id cannot be empty.") final String id) {
        log.info("Operator re-acquire for archive {}", id);
        return ResponseEntity.ok(ApiResponse.success("Archive queued for a fresh download.",
                                                     operatorActionService.reacquireArchive(id)));
    }

    @Override
    @PostMapping("/archives/skip")
    public ResponseEntity<ApiResponse<UnitActionResponse>> skipArchive(
            @RequestParam("id") @NotBlank(message = "The archive id cannot be empty.") final String id) {
        log.info("Operator skip for archive {}", id);
        return ResponseEntity.ok(ApiResponse.success("Archive skipped.", operatorActionService.skipArchive(id)));
    }

    @Override
    @PostMapping("/archives/retry")
    public ResponseEntity<ApiResponse<UnitActionResponse>> retryArchive(
            @RequestParam("id") @NotBlank(message = "The archive id cannot be empty.") final String id) {
        log.info("Operator retry for archive {}", id);
        UnitActionResponse result = operatorActionService.retryArchive(id);
        return ResponseEntity.ok(ApiResponse.success("Archive queued for retry from " + result.phase() + ".",
                                                     result));
    }

    private static String describe(RunStatusResponse run) {
        return "Migration run #" + run.getRunId() + " is " + run.getStatus() + ".";
    }
}
