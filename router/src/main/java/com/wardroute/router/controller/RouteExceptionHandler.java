package com.wardroute.router.controller;

import com.wardroute.router.dto.RouteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Turns request binding failures into the same error body the endpoints return.
 */
@RestControllerAdvice
public class RouteExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(RouteExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<RouteResponse> handleValidation(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        logger.warn("Rejected invalid request: {}", details);
        return ResponseEntity.badRequest().body(RouteResponse.error("Invalid request: " + details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RouteResponse> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(RouteResponse.error("Malformed request body"));
    }
}
