package com.catalai.classifier.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.DecisionMatrixEvaluation;
import com.catalai.classifier.dto.matrix.EvaluateMatrixRequest;
import com.catalai.classifier.dto.matrix.MatrixExport;
import com.catalai.classifier.dto.matrix.SaveMatrixRequest;
import com.catalai.classifier.service.matrix.DecisionMatrixService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/decision-matrix")
@RequiredArgsConstructor
@Tag(name = "Decision Matrix", description = "Versioned classification rules")
public class DecisionMatrixController {

  static final String USERNAME_HEADER = "X-Username";
  private static final String DEFAULT_USER = "anonymous";

  private final DecisionMatrixService decisionMatrixService;

  @GetMapping
  @Operation(
      summary = "Get the active matrix",
      description = "Generates the initial version when no matrix exists yet")
  public ResponseEntity<DecisionMatrix> getActiveMatrix() {
    return ResponseEntity.ok(decisionMatrixService.getActiveMatrix());
  }

  @GetMapping("/versions")
  @Operation(summary = "List matrix versions", description = "Oldest first, with the active one")
  public ResponseEntity<Map<String, Object>> listVersions() {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("versions", decisionMatrixService.listVersions());
    response.put("activeVersion", decisionMatrixService.getActiveVersion());
    return ResponseEntity.ok(response);
  }

  @GetMapping("/{version}")
  @Operation(summary = "Get one matrix version")
  public ResponseEntity<DecisionMatrix> getVersion(@PathVariable String version) {
    return ResponseEntity.ok(decisionMatrixService.getVersion(version));
  }

  @PutMapping
  @Operation(
      summary = "Save an edited matrix",
      description = "Publishes the edit as a new version; stored versions are never changed")
  public ResponseEntity<DecisionMatrix> saveMatrix(
      @Valid @RequestBody SaveMatrixRequest request,
      @RequestHeader(value = USERNAME_HEADER, required = false) String username) {
    DecisionMatrix saved = decisionMatrixService.save(request, user(username));
    log.info("Decision matrix version {} saved", saved.getVersion());
    return ResponseEntity.status(HttpStatus.CREATED).body(saved);
  }

  @PostMapping("/evaluate")
  @Operation(
      summary = "Evaluate rules",
      description = "Applies a matrix version to attributes and a classification without storing anything")
  public ResponseEntity<DecisionMatrixEvaluation> evaluate(
      @Valid @RequestBody EvaluateMatrixRequest request) {
    return ResponseEntity.ok(decisionMatrixService.evaluate(request));
  }

  @GetMapping("/export")
  @Operation(summary = "Export the active matrix")
  public ResponseEntity<MatrixExport> export(
      @RequestHeader(value = USERNAME_HEADER, required = false) String username) {
    return ResponseEntity.ok(decisionMatrixService.export(user(username)));
  }

  @PostMapping("/import")
  @Operation(summary = "Import an exported matrix", description = "Published as a new version")
  public ResponseEntity<DecisionMatrix> importMatrix(
      @RequestBody MatrixExport export,
      @RequestHeader(value = USERNAME_HEADER, required = false) String username) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(decisionMatrixService.importMatrix(export, user(username)));
  }

  private static String user(String username) {
    return username == null || username.isBlank() ? DEFAULT_USER : username;
  }
}
