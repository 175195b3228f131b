package com.mk.fx.qa.load.engine.resource;

import com.mk.fx.qa.load.engine.dto.controllerresponse.LoadTestRequest;
import com.mk.fx.qa.load.engine.dto.controllerresponse.RunSubmissionResponse;
import com.mk.fx.qa.load.engine.dto.controllerresponse.StopTestResponse;
import com.mk.fx.qa.load.engine.dto.report.LoadTestReport;
import com.mk.fx.qa.load.engine.service.LoadTestEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Load Tests", description = "Endpoints for running, stopping and reviewing load tests")
@RestController
@RequestMapping("/api/load-tests")
@Validated
@RequiredArgsConstructor
public class LoadTestController {

  private final LoadTestEngine engine;
  private final ProfileMapper profileMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Running tests
  // -----------------------------------------------------
  @Operation(
      summary = "Start a load test",
      description = "Validates the profile and starts the run in the background.")
  @PostMapping
  public ResponseEntity<RunSubmissionResponse> startLoadTest(
      @Valid @RequestBody LoadTestRequest request) {
    log.info(
        "Received load test submission type={} users={}",
        request.getWorkloadType(),
        request.getConcurrency());
    var runId = engine.startLoadTest(profileMapper.toProfile(request));
    return responseFactory.accepted(
        new RunSubmissionResponse(runId, "RUNNING", "Load test started"));
  }

  @Operation(
      summary = "Run a load test",
      description = "Runs the load test and returns its report once it has finished.")
  @PostMapping("/run")
  public ResponseEntity<LoadTestReport> runLoadTest(@Valid @RequestBody LoadTestRequest request) {
    log.info(
        "Received synchronous load test type={} users={}",
        request.getWorkloadType(),
        request.getConcurrency());
    return ResponseEntity.ok(engine.runLoadTest(profileMapper.toProfile(request)));
  }

  @Operation(summary = "Stop a load test", description = "Requests cancellation of an active run.")
  @DeleteMapping("/{runId}")
  public ResponseEntity<?> stopTest(@PathVariable UUID runId) {
    if (!engine.stopTest(runId)) {
      return responseFactory.notFound("No active load test: " + runId);
    }
    return ResponseEntity.ok(new StopTestResponse(runId, true, "Cancellation requested"));
  }

  // -----------------------------------------------------
  // Results
  // -----------------------------------------------------
  @Operation(summary = "Finished reports", description = "Returns retained reports, oldest first.")
  @GetMapping("/results")
  public ResponseEntity<List<LoadTestReport>> getTestResults() {
    return ResponseEntity.ok(engine.getTestResults());
  }

  @Operation(summary = "Clear reports", description = "Empties the report history.")
  @DeleteMapping("/results")
  public ResponseEntity<Void> clearResults() {
    engine.clearResults();
    return ResponseEntity.noContent().build();
  }

  // -----------------------------------------------------
  // Active runs
  // -----------------------------------------------------
  @Operation(summary = "Active runs", description = "Lists the ids of runs still in progress.")
  @GetMapping("/active")
  public ResponseEntity<Set<UUID>> getActiveRuns() {
    return ResponseEntity.ok(engine.getActiveRunIds());
  }

  @Operation(summary = "Live progress", description = "Returns live counters of an active run.")
  @GetMapping("/{runId}/live")
  public ResponseEntity<?> getLiveSnapshot(@PathVariable UUID runId) {
    return engine
        .getLiveSnapshot(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.debug("No live snapshot for {}", runId);
              return responseFactory.notFound("No active load test: " + runId);
            });
  }

  @Operation(summary = "Workload types", description = "Lists the supported workload type ids.")
  @GetMapping("/types")
  public ResponseEntity<List<String>> getSupportedWorkloadTypes() {
    return ResponseEntity.ok(engine.getSupportedWorkloadTypes());
  }
}
