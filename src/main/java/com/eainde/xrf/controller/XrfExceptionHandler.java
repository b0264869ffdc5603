package com.eainde.xrf.controller;

import com.eainde.xrf.exception.GridReadException;
import com.eainde.xrf.exception.XrfProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class XrfExceptionHandler {

    @ExceptionHandler(GridReadException.class)
    public ResponseEntity<Map<String, Object>> handleGridRead(GridReadException e) {
        log.warn("Upload could not be read", e);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(XrfProcessingException.class)
    public ResponseEntity<Map<String, Object>> handleProcessing(XrfProcessingException e) {
        log.warn("Job rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
