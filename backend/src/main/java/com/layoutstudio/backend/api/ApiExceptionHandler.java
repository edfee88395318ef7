package com.layoutstudio.backend.api;

import com.layoutstudio.backend.repo.ProjectStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException e) {
        return Map.of(
                "error", "NOT_FOUND",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(IllegalStateException e) {
        return Map.of(
                "error", "CONFLICT",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(ProjectStorageException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleStorage(ProjectStorageException e) {
        log.error("Project storage failure", e);
        return Map.of(
                "error", "STORAGE_ERROR",
                "message", String.valueOf(e.getMessage())
        );
    }
}
