package com.wcoptimizer.exception;

import com.wcoptimizer.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request, HttpServletResponse response) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     "One or more fields failed validation", request, response, fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request, HttpServletResponse response) {
        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations().stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();
        return build(HttpStatus.BAD_REQUEST, "Bad Request", "INVALID_PARAMETER",
                     "One or more parameters are out of range", request, response, fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request, HttpServletResponse response) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", "INVALID_PARAMETER", msg, request, response, null);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
        HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleMalformedRequest(
            Exception ex, HttpServletRequest request, HttpServletResponse response) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", "MALFORMED_REQUEST",
                     ex.getMessage(), request, response, null);
    }

    @ExceptionHandler({UnknownAnalysisException.class, InvalidCategoryException.class,
        InvalidParameterException.class, QueryRejectedException.class, DatasetLoadException.class})
    public ResponseEntity<ApiError> handleInvalidInput(
            WcOptimizerException ex, HttpServletRequest request, HttpServletResponse response) {
        log.info("Rejected request | code={} | path={} | reason={}",
            ex.getErrorCode(), request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getErrorCode(),
                     ex.getMessage(), request, response, null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleUploadTooLarge(
            MaxUploadSizeExceededException ex, HttpServletRequest request, HttpServletResponse response) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Upload Too Large", "UPLOAD_TOO_LARGE",
                     "Uploaded file exceeds the configured size limit", request, response, null);
    }

    @ExceptionHandler(GraphStoreUnavailableException.class)
    public ResponseEntity<ApiError> handleGraphUnavailable(
            GraphStoreUnavailableException ex, HttpServletRequest request, HttpServletResponse response) {
        log.error("Graph store unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Graph Store Unavailable", ex.getErrorCode(),
                     ex.getMessage(), request, response, null);
    }

    @ExceptionHandler(TabularStoreException.class)
    public ResponseEntity<ApiError> handleTabularStore(
            TabularStoreException ex, HttpServletRequest request, HttpServletResponse response) {
        log.error("Tabular store failure at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Tabular Store Error", ex.getErrorCode(),
                     ex.getMessage(), request, response, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request, HttpServletResponse response) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                     "An unexpected error occurred", request, response, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String code, String message,
            HttpServletRequest request, HttpServletResponse response,
            List<ApiError.FieldError> fieldErrors) {

        String requestId = response.getHeader("X-Request-ID");
        if (requestId == null) {
            requestId = request.getHeader("X-Request-ID");
        }

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(requestId)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
