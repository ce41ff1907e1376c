package com.zerodayguardian.passwordrisk.api;

import com.zerodayguardian.passwordrisk.analysis.InvalidAnalysisRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Maps malformed requests to 400 responses. Analysis itself never fails.
 *
 * @author Naveed Gung
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidAnalysisRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidAnalysisRequestException e) {
        log.debug("Rejected analysis request: field={} message={}", e.getField(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.debug("Rejected analysis request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", message));
    }

    // Never echo the decoder message: it may quote the request body.
    @ExceptionHandler({ServerWebInputException.class, DecodingException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.debug("Unreadable analysis request: {}", e.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MALFORMED_REQUEST", "Request body is not a valid analysis request"));
    }
}
