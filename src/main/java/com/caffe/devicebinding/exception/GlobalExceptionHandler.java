package com.caffe.devicebinding.exception;

import com.caffe.devicebinding.api.dto.ApiErrorResponse;
import com.caffe.devicebinding.config.RequestLoggingFilter;
import com.caffe.devicebinding.domain.binding.DeviceBindingEvent;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to {@link ApiErrorResponse} with a machine-readable error code.
 * Fingerprint digests never appear in an error body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Returns 400 Bad Request
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        String message = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("Invalid request");

        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, request);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.debug("Rejected malformed request {}: {}", request.getRequestURI(), ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or malformed"
                : ex.getMessage();
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, request);
    }

    /**
     * Returns 401 Unauthorized
     */
    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidCredentials(
            InvalidCredentialsException ex,
            HttpServletRequest request) {
        return error(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", ex.getMessage(), request);
    }

    /**
     * Returns 403 Forbidden with the observer ID and whether a reset is already pending,
     * so the client can offer the reset request flow.
     */
    @ExceptionHandler(DeviceMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleDeviceMismatch(
            DeviceMismatchException ex,
            HttpServletRequest request) {

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("observerId", ex.getObserverId());
        details.put("resetPending", ex.isResetPending());

        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(new ApiErrorResponse("DEVICE_MISMATCH", ex.getMessage(),
                        RequestLoggingFilter.traceIdOf(request), details));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied for {} {}", request.getMethod(), request.getRequestURI());
        return error(HttpStatus.FORBIDDEN, "FORBIDDEN", "Insufficient role", request);
    }

    /**
     * Returns 404 Not Found
     */
    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleAccountNotFound(
            AccountNotFoundException ex,
            HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "ACCOUNT_NOT_FOUND", "No account matches the request", request);
    }

    @ExceptionHandler(ResetRequestNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleResetRequestNotFound(
            ResetRequestNotFoundException ex,
            HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "RESET_REQUEST_NOT_FOUND", ex.getMessage(), request);
    }

    /**
     * Returns 409 Conflict
     */
    @ExceptionHandler(ResetAlreadyPendingException.class)
    public ResponseEntity<ApiErrorResponse> handleResetAlreadyPending(
            ResetAlreadyPendingException ex,
            HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "RESET_ALREADY_PENDING", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidResetResolutionException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidResolution(
            InvalidResetResolutionException ex,
            HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "INVALID_RESET_RESOLUTION", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalBindingTransitionException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalTransition(
            IllegalBindingTransitionException ex,
            HttpServletRequest request) {
        log.warn("Refused binding transition: {}", ex.getMessage());
        if (ex.getEvent() == DeviceBindingEvent.RESET_REQUESTED) {
            return error(HttpStatus.CONFLICT, "NO_DEVICE_MISMATCH",
                    "No recent device mismatch to reset for this account", request);
        }
        return error(HttpStatus.CONFLICT, "ILLEGAL_BINDING_TRANSITION", ex.getMessage(), request);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleOptimisticLock(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {
        log.warn("Concurrent modification on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.CONFLICT, "RESOLUTION_CONFLICT",
                "The record was changed concurrently, reload and retry", request);
    }

    /**
     * Returns 503 Service Unavailable
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiErrorResponse> handleDataAccess(
            DataAccessException ex,
            HttpServletRequest request) {
        log.error("Storage failure on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE",
                "Storage is temporarily unavailable. Please try again later.", request);
    }

    /**
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(
            Exception ex,
            HttpServletRequest request) {
        if (ex instanceof ErrorResponse framework) {
            // unknown path, unsupported method and similar MVC-level rejections
            HttpStatusCode status = framework.getStatusCode();
            return ResponseEntity.status(status)
                    .body(new ApiErrorResponse("HTTP_" + status.value(), ex.getMessage(),
                            RequestLoggingFilter.traceIdOf(request)));
        }
        log.error("Unhandled error on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Something went wrong. Please try again later.", request);
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message,
                                                          HttpServletRequest request) {
        return ResponseEntity
                .status(status)
                .body(new ApiErrorResponse(code, message, RequestLoggingFilter.traceIdOf(request)));
    }
}
