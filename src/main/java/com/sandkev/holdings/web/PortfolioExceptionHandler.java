package com.sandkev.holdings.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Rejected input (unknown main currency and the like) becomes 400 with a {@code {result, message}} body. */
@RestControllerAdvice
class PortfolioExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<OperationResult> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new OperationResult(false, ex.getMessage()));
    }
}
