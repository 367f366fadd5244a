package com.driftops.exception;

import com.driftops.config.OperatorGuardFilter;
import com.driftops.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.Violation> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.Violation.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_FAILED", fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(
            ConstraintViolationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, "VALIDATION_FAILED", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "TYPE_MISMATCH", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be parsed",
                     request, "MALFORMED_BODY", null);
    }

    @ExceptionHandler({ModelVersionNotFoundException.class, JobNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            DriftOpsException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({RegistryTransitionConflictException.class, NoRollbackTargetException.class,
                       RetrainInProgressException.class, IncomparableProfilesException.class})
    public ResponseEntity<ApiError> handleConflict(
            DriftOpsException ex, HttpServletRequest request) {
        log.warn("Conflict at {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({InsufficientDataException.class, InvalidRequestException.class})
    public ResponseEntity<ApiError> handleUnprocessable(
            DriftOpsException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Request", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(NoBaselineException.class)
    public ResponseEntity<ApiError> handleNoBaseline(
            NoBaselineException ex, HttpServletRequest request) {
        return build(HttpStatus.PRECONDITION_FAILED, "No Baseline", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(ClassifierApiUnavailableException.class)
    public ResponseEntity<ApiError> handleClassifierUnavailable(
            ClassifierApiUnavailableException ex, HttpServletRequest request) {
        log.error("Classifier API unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Classifier Service Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({ClassifierApiException.class, TrainingFailureException.class})
    public ResponseEntity<ApiError> handleClassifierError(
            DriftOpsException ex, HttpServletRequest request) {
        log.error("Classifier API error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Classifier Service Error",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String code,
            List<ApiError.Violation> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .code(code)
            .message(message)
            .retryable(status == HttpStatus.SERVICE_UNAVAILABLE || "RETRAIN_IN_PROGRESS".equals(code))
            .path(request.getRequestURI())
            .requestId(OperatorGuardFilter.resolveRequestId(request))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
