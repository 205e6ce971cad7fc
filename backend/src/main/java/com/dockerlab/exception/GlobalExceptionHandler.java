package com.dockerlab.exception;

import com.dockerlab.config.AppProperties;
import com.dockerlab.config.RouteCatalog;
import com.dockerlab.dto.response.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Terminal error handler: every failure leaves the service as an {@link ErrorResponse}.
 * Exception messages are attached as {@code detail} outside production only.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final AppProperties appProperties;
    private final RouteCatalog routeCatalog;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        String message = fields.isEmpty()
            ? "Invalid request"
            : fields.values().stream().collect(Collectors.joining("; "));

        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error(message)
            .fields(fields)
            .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Malformed or missing JSON request body")
            .detail(detail(e.getMostSpecificCause()))
            .build());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Invalid value '" + e.getValue() + "' for parameter '" + e.getName() + "'")
            .build());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error(e.getMessage())
            .build());
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUserNotFound(UserNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.builder()
            .error(e.getMessage())
            .build());
    }

    @ExceptionHandler(EmailAlreadyRegisteredException.class)
    public ResponseEntity<ErrorResponse> handleEmailConflict(EmailAlreadyRegisteredException e) {
        log.info("Rejected duplicate email: {}", e.getEmail());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error(e.getMessage())
            .build());
    }

    @ExceptionHandler({
        NoHandlerFoundException.class,
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleUnknownRoute(Exception e) {
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.builder()
            .error("Route not found")
            .availableRoutes(routeCatalog.paths())
            .build());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Request body must be JSON")
            .detail(detail(e))
            .build());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Database operation failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.builder()
            .error("Database operation failed")
            .detail(detail(e.getMostSpecificCause()))
            .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected server error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.builder()
            .error("Internal server error")
            .detail(detail(e))
            .build());
    }

    private String detail(Throwable cause) {
        if (appProperties.isProduction() || cause == null) {
            return null;
        }
        return cause.getMessage();
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status).body(body);
    }
}
