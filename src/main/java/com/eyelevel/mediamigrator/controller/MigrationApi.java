package com.eyelevel.mediamigrator.controller;

import com.eyelevel.mediamigrator.dto.common.ApiResponse;
import com.eyelevel.mediamigrator.dto.report.MigrationReport;
import com.eyelevel.mediamigrator.dto.run.RunStatusResponse;
import com.eyelevel.mediamigrator.dto.run.UnitActionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Media Migration", description = "Endpoints for observing a migration run and making the decisions it leaves to the operator.")
public interface MigrationApi {

    @Operation(summary = "Start or Resume a Run",
            description = "Starts a new migration run, or returns the active run if one exists. The scheduler drives the run from then on.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Run started or resumed.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Migration run #1 is RUNNING.",
                                        "response": {
                                            "runId": 1,
                                            "status": "RUNNING",
                                            "discoveryCompleted": false,
                                            "acknowledgedFailures": 0,
                                            "archivesByPhase": {},
                                            "itemsByPhase": {}
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Internal Server Error",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusResponse>> startRun();

    @Operation(summary = "Get Run Status",
            description = "Returns the active run, or the most recent one, with archive and item counts per phase and the disk budget.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved successfully."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No run has been started yet.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusResponse>> getCurrentRun();

    @Operation(summary = "Proceed After Review",
            description = "Resumes a run paused because too many items failed. Items failed since the run started or last proceeded are acknowledged, and only later failures count toward the threshold again. Automatic cleanup resumes.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Run resumed."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The run is not paused for retries.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "The run changed status concurrently.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusResponse>> proceed();

    @Operation(summary = "Stop the Run",
            description = "Requests a graceful stop. Nothing new is admitted; the run is STOPPED once in-flight work has finished.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Stop requested."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "No run is active.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusResponse>> stop();

    @Operation(summary = "Re-list the Archive Source",
            description = "Lists the archive source again and registers archives that have appeared since the last discovery.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Discovery finished."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "No run is active, or the run is stopping.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusResponse>> discover();

    @Operation(summary = "Get Migration Report",
            description = "Builds the migration report for the latest run: counts per phase, album statistics and every failed item and problem archive.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Report built successfully.")
    })
    ResponseEntity<ApiResponse<MigrationReport>> getReport();

    @Operation(summary = "Retry a Failed Item",
            description = "Sends a FAILED media item back to the last phase it reached, with a fresh retry budget.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Item queued for retry."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The item is not FAILED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown item.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UnitActionResponse>> retryItem(
            @Parameter(description = "Media item id, '<archiveId>::<relativePath>'.", required = true)
            @RequestParam("id") String id);

    @Operation(summary = "Skip a Failed Item",
            description = "Marks a FAILED media item SKIPPED, which lets its archive be cleaned.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Item skipped."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The item is not FAILED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown item.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UnitActionResponse>> skipItem(
            @Parameter(description = "Media item id, '<archiveId>::<relativePath>'.", required = true)
            @RequestParam("id") String id);

    @Operation(summary = "Re-acquire a Corrupted Archive",
            description = "Deletes the local copy of a CORRUPTED archive and queues it for a fresh download.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Archive queued for download."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The archive is not CORRUPTED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown archive.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UnitActionResponse>> reacquireArchive(
            @Parameter(description = "Archive id as reported by the archive source.", required = true)
            @RequestParam("id") String id);

    @Operation(summary = "Skip an Archive",
            description = "Marks a CORRUPTED or FAILED archive SKIPPED, together with its items that are not yet finished.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Archive skipped."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The archive is neither CORRUPTED nor FAILED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown archive.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UnitActionResponse>> skipArchive(
            @Parameter(description = "Archive id as reported by the archive source.", required = true)
            @RequestParam("id") String id);

    @Operation(summary = "Retry a Failed Archive",
            description = "Sends a FAILED archive back to the last phase it reached, with a fresh retry budget.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Archive queued for retry."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The archive is not FAILED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown archive.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UnitActionResponse>> retryArchive(
            @Parameter(description = "Archive id as reported by the archive source.", required = true)
            @RequestParam("id") String id);
}
