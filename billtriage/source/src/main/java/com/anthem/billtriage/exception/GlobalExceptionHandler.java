package com.anthem.billtriage.exception;

import com.anthem.billtriage.model.AssignmentError;
import com.anthem.billtriage.model.AssignmentErrorCode;
import com.anthem.billtriage.model.ErrorResponse;
import com.anthem.billtriage.service.AssignmentConflictException;
import com.anthem.billtriage.service.BillNotFoundException;
import com.anthem.billtriage.service.RateAssignmentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String BILL_NOT_FOUND = "BILL_NOT_FOUND";
    static final String ASSIGNMENT_CONFLICT = "ASSIGNMENT_CONFLICT";
    static final String INVALID_INPUT = "INVALID_INPUT";
    static final String NOT_FOUND = "NOT_FOUND";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(RateAssignmentException.class)
    public ResponseEntity<ErrorResponse> handleRejected(RateAssignmentException ex) {
        AssignmentError error = ex.getError();
        HttpStatus status = error.getCode() == AssignmentErrorCode.APPLY_FAILED
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .success(false)
                .errorCode(error.getCode().name())
                .message(error.getMessage())
                .field(error.getField())
                .subject(error.getSubject())
                .timestamp(Instant.now().toString())
                .build());
    }

    @ExceptionHandler(BillNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(BillNotFoundException ex) {
        log.warn("Bill not found: {}", ex.getFilename());
        return buildResponse(HttpStatus.NOT_FOUND, BILL_NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(AssignmentConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(AssignmentConflictException ex) {
        return buildResponse(HttpStatus.CONFLICT, ASSIGNMENT_CONFLICT, ex.getMessage());
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(Exception ex) {
        log.warn("Invalid input: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or is not valid JSON"
                : ex.getMessage();
        return buildResponse(HttpStatus.BAD_REQUEST, INVALID_INPUT, message);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handle404(NoResourceFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, NOT_FOUND, "Endpoint does not exist.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        log.error("Unhandled exception", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "An unexpected error occurred.");
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .success(false)
                .errorCode(code)
                .message(message)
                .timestamp(Instant.now().toString())
                .build());
    }
}
