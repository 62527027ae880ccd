package com.solo.api;

import com.solo.game_state.SaveCorruptedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Глобальный обработчик исключений для API
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(GameNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(GameNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(SaveCorruptedException.class)
    public ResponseEntity<Map<String, Object>> handleCorruptSave(SaveCorruptedException e) {
        log.error("Corrupt save: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, Exception e) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        String errorMessage = e.getMessage();
        if (errorMessage == null) {
            errorMessage = "Unexpected error: " + e.getClass().getSimpleName();
        }
        error.put("error", errorMessage);
        error.put("type", e.getClass().getSimpleName());
        return ResponseEntity.status(status)
            .header("Content-Type", "application/json;charset=UTF-8")
            .body(error);
    }
}
