package com.fintech.timeseries.api;

import com.fintech.timeseries.service.MarketDataService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps service and binding failures to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MarketDataService.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleServiceValidation(
            MarketDataService.ValidationException ex,
            WebRequest request) {
        String path = path(request);
        log.warn("Query rejected on {}: {}", path, ex.getMessage());
        return badRequest(new ErrorResponse(400, "QUERY_VALIDATION_ERROR", ex.getMessage(), path));
    }

    /**
     * Store and infrastructure failures; the message is not exposed.
     */
    @ExceptionHandler(MarketDataService.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            MarketDataService.ServiceException ex,
            WebRequest request) {
        String path = path(request);
        log.error("Service exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
            500, "SERVICE_ERROR", "The time-series store could not serve this request.", path));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {
        List<ErrorResponse.ValidationError> violations = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ValidationError(
                fieldName(violation),
                String.valueOf(violation.getInvalidValue()),
                violation.getMessage()))
            .toList();
        String path = path(request);
        log.warn("Validation error on {}: {}", path, violations);
        return badRequest(new ErrorResponse(400, "VALIDATION_ERROR", "Request validation failed", path, violations));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {
        String path = path(request);
        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return badRequest(new ErrorResponse(400, "MISSING_PARAMETER",
            "Required parameter '" + ex.getParameterName() + "' is missing", path,
            List.of(new ErrorResponse.ValidationError(ex.getParameterName(), null, "This parameter is required"))));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {
        String path = path(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        log.warn("Type mismatch on {}: {} expected {} but got {}", path, ex.getName(), expectedType, ex.getValue());
        return badRequest(new ErrorResponse(400, "TYPE_MISMATCH",
            "Parameter '" + ex.getName() + "' must be a valid " + expectedType, path,
            List.of(new ErrorResponse.ValidationError(ex.getName(), String.valueOf(ex.getValue()),
                "Expected type: " + expectedType))));
    }

    /**
     * Unparseable enum-like parameters (bucket, resolution, filter syntax).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request) {
        String path = path(request);
        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return badRequest(new ErrorResponse(400, "INVALID_ARGUMENT", ex.getMessage(), path));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {
        String path = path(request);
        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
            500, "INTERNAL_ERROR", "An unexpected error occurred.", path));
    }

    private static ResponseEntity<ErrorResponse> badRequest(ErrorResponse body) {
        return ResponseEntity.badRequest().body(body);
    }

    private static String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private static String fieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
