package com.fixfleet.orchestrator.api;

import com.fixfleet.orchestrator.registry.RegistryValidationException;
import com.fixfleet.orchestrator.state.CycleAlreadyRunningException;
import com.fixfleet.orchestrator.state.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain exceptions to HTTP statuses. The body is always {"error": message}.
 *
 *   CycleAlreadyRunningException → 409
 *   optimistic lock conflict     → 409, the caller may resend the signal
 *   IllegalArgumentException     → 400
 *   RegistryValidationException  → 422
 *   StateStoreException          → 503
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CycleAlreadyRunningException.class)
    public ResponseEntity<Map<String, String>> cycleRunning(CycleAlreadyRunningException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, String>> rowChanged(ObjectOptimisticLockingFailureException e) {
        log.info("{} {} changed concurrently, signal rejected", e.getPersistentClassName(), e.getIdentifier());
        return error(HttpStatus.CONFLICT, "row changed concurrently, retry the request");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(RegistryValidationException.class)
    public ResponseEntity<Map<String, String>> badRegistry(RegistryValidationException e) {
        log.warn("Repo registry rejected: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(StateStoreException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StateStoreException e) {
        log.error("State store error: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
