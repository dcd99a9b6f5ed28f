package com.hookrelay.controller;

import com.hookrelay.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.List;

/**
 * Keeps the {"errors": [...]} shape for failures that happen outside the
 * pipeline (reading the request body, bugs).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IOException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadableBody(IOException ex) {
        log.warn("Failed to read webhook request: {}", ex.getMessage());
        return new ErrorResponse(List.of("Failed to read content of request body: " + ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleUnexpected(Exception ex) {
        log.error("Unexpected error while handling webhook", ex);
        return new ErrorResponse(List.of("An unexpected error occurred"));
    }
}
