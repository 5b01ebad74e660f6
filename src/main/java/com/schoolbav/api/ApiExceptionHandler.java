package com.schoolbav.api;

import com.schoolbav.pipeline.StageOrderingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(StageOrderingException.class)
    public ResponseEntity<Map<String, Object>> stageOrdering(StageOrderingException e) {
        log.warn("Rejected request: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("stage", e.getStage().name());
        body.put("academicYear", e.getAcademicYear());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }
}
