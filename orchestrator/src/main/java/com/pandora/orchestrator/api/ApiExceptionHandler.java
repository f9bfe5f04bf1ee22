package com.pandora.orchestrator.api;

import com.pandora.orchestrator.runtime.InvalidGraphException;
import com.pandora.orchestrator.runtime.SkillNotFoundException;
import com.pandora.orchestrator.sync.SyncConflictException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps domain exceptions to HTTP status codes with a small JSON body. */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SyncConflictException.class)
    public ResponseEntity<Map<String, Object>> conflict(SyncConflictException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error",  e.getMessage());
        body.put("syncId", e.getExistingSyncId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(SkillNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(SkillNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(InvalidGraphException.class)
    public ResponseEntity<Map<String, Object>> invalidGraph(InvalidGraphException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error",  e.getMessage());
        body.put("stepId", e.getStepId());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
    }
}
