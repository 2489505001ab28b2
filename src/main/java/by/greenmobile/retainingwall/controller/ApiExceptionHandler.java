package by.greenmobile.retainingwall.controller;

import by.greenmobile.retainingwall.config.RequestIdFilter;
import by.greenmobile.retainingwall.controller.dto.ApiError;
import by.greenmobile.retainingwall.service.DesignTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Ошибки API-слоя. Нарушения контракта движка (IllegalArgument/IllegalState) сюда не
 * маппятся специально: это дефект, пусть уходит в 500 с полным стеком в логе.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidDesignRequestException.class)
    public ResponseEntity<ApiError> handleInvalid(InvalidDesignRequestException ex) {
        log.warn("Rejected design request: {}", ex.getViolations());
        return build(HttpStatus.BAD_REQUEST, "Validation failed", ex.getViolations());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed design request: {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed request body",
                List.of(ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(DesignNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(DesignNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), List.of());
    }

    @ExceptionHandler(DesignTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(DesignTimeoutException ex) {
        log.error("Design run timed out", ex);
        return build(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), List.of());
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String message, List<String> details) {
        ApiError body = new ApiError(status.value(), status.getReasonPhrase(), message, details,
                MDC.get(RequestIdFilter.MDC_REQUEST_ID));
        return ResponseEntity.status(status).body(body);
    }
}
