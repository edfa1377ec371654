package com.opsdesk.runner.api;

import com.opsdesk.runner.api.dto.ApiError;
import com.opsdesk.runner.command.CommandException;
import com.opsdesk.runner.command.CommandNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps refusals that happen before a command runs to HTTP statuses.
 * Validation and execution failures never get here: they come back as an
 * execution response with exit code 1.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CommandNotFoundException.class)
    public ResponseEntity<ApiError> notFound(CommandNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, null, e.getMessage());
    }

    @ExceptionHandler(CommandException.class)
    public ResponseEntity<ApiError> refused(CommandException e) {
        HttpStatus status = switch (e.getKind()) {
            case COMMAND_RESTRICTED    -> HttpStatus.FORBIDDEN;
            case CONFIRMATION_REQUIRED -> HttpStatus.CONFLICT;
            default                    -> HttpStatus.BAD_REQUEST;
        };
        return error(status, e.getKind().name(), e.getDetail());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(new ApiError(status.value(), kind, message));
    }
}
