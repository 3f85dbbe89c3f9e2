package com.vedant.securequery.exception;

import com.vedant.securequery.dto.ErrorResponseDTO;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // detail stays in the audit log; the response only carries the generic message
    @ExceptionHandler(SecurityViolationException.class)
    public ResponseEntity<ErrorResponseDTO> handleSecurityViolation(SecurityViolationException ex, HttpServletRequest request) {
        log.warn("Security violation on {}: {}", request.getRequestURI(), ex.getKind());
        HttpStatus status = ex.getKind() == ViolationKind.INVALID_TENANT_CODE ? HttpStatus.BAD_REQUEST : HttpStatus.FORBIDDEN;
        ErrorResponseDTO error = new ErrorResponseDTO(ex.getKind().name(), ex.getUserMessage(), request.getRequestURI());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(error);
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponseDTO> handleExecution(QueryExecutionException ex, HttpServletRequest request) {
        ErrorResponseDTO error = new ErrorResponseDTO("EXECUTION_ERROR", "Execution error: " + ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).contentType(MediaType.APPLICATION_JSON).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponseDTO> handleMissingHeader(MissingRequestHeaderException ex, HttpServletRequest request) {
        ErrorResponseDTO error = new ErrorResponseDTO(ViolationKind.INVALID_TENANT_CODE.name(),
                "Tenant code is required", request.getRequestURI());
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        ErrorResponseDTO error = new ErrorResponseDTO("INTERNAL_SERVER_ERROR",
                "An unexpected error occurred. Please try again later.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).contentType(MediaType.APPLICATION_JSON).body(error);
    }
}
