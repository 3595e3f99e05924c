package com.grale.harvester.harvest.api;

import com.grale.harvester.harvest.esri.ProbeException;
import com.grale.harvester.harvest.log.LogStateException;
import com.grale.harvester.harvest.plan.PlanningException;
import com.grale.harvester.harvest.service.HarvestRunNotFoundException;
import com.grale.harvester.harvest.service.InvalidHarvestRequestException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class HarvestExceptionHandler {

  @ExceptionHandler(InvalidHarvestRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidHarvestRequestException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_harvest_request", ex);
  }

  @ExceptionHandler(PlanningException.class)
  public ResponseEntity<Map<String, String>> handlePlanning(PlanningException ex) {
    return error(HttpStatus.BAD_REQUEST, "planning_error", ex);
  }

  @ExceptionHandler(ProbeException.class)
  public ResponseEntity<Map<String, String>> handleProbe(ProbeException ex) {
    return error(HttpStatus.BAD_GATEWAY, "probe_failed", ex);
  }

  @ExceptionHandler(HarvestRunNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(HarvestRunNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "harvest_run_not_found", ex);
  }

  @ExceptionHandler(LogStateException.class)
  public ResponseEntity<Map<String, String>> handleLogState(LogStateException ex) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "log_state_error", ex);
  }

  private ResponseEntity<Map<String, String>> error(HttpStatus status, String code, RuntimeException ex) {
    String message = ex.getMessage() == null ? code : ex.getMessage();
    return ResponseEntity.status(status).body(Map.of("error", code, "message", message));
  }
}
