package com.openforge.taskmate.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps the error taxonomy onto HTTP status codes.
 *
 *   AuthenticationRequired  → 401     ResourceNotFound     → 404
 *   OwnershipViolation      → 403     AmbiguousReference   → 409
 *   InvalidToolArguments    → 422     ToolExecution        → 500
 *   ModelInvocation         → 503     malformed request    → 400
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String MODEL_RETRY_MESSAGE =
            "The assistant is not available right now, please try again.";

    private static final Map<Class<? extends TaskmateException>, HttpStatus> STATUS_BY_TYPE = Map.of(
            AuthenticationRequiredException.class, HttpStatus.UNAUTHORIZED,
            OwnershipViolationException.class,     HttpStatus.FORBIDDEN,
            InvalidToolArgumentsException.class,   HttpStatus.UNPROCESSABLE_ENTITY,
            ResourceNotFoundException.class,       HttpStatus.NOT_FOUND,
            AmbiguousReferenceException.class,     HttpStatus.CONFLICT,
            ToolExecutionException.class,          HttpStatus.INTERNAL_SERVER_ERROR,
            ModelInvocationException.class,        HttpStatus.SERVICE_UNAVAILABLE
    );

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String error, String message, Object details) {

        static ErrorResponse of(String error, String message) {
            return new ErrorResponse(error, message, null);
        }
    }

    @ExceptionHandler(TaskmateException.class)
    public ResponseEntity<ErrorResponse> handleTaskmate(TaskmateException ex, HttpServletRequest request) {
        HttpStatus status = STATUS_BY_TYPE.getOrDefault(ex.getClass(), HttpStatus.INTERNAL_SERVER_ERROR);
        if (status.is5xxServerError()) {
            log.error("[Api] {} {} failed: type={} message={}",
                    request.getMethod(), request.getRequestURI(), ex.getClass().getSimpleName(), ex.getMessage(), ex);
        } else {
            log.warn("[Api] {} {} rejected: type={} message={}",
                    request.getMethod(), request.getRequestURI(), ex.getClass().getSimpleName(), ex.getMessage());
        }

        String message = ex instanceof ModelInvocationException ? MODEL_RETRY_MESSAGE : ex.getMessage();
        Object details = ex instanceof AmbiguousReferenceException ambiguous ? ambiguous.getCandidates() : null;
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getCode(), message, details));
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("[Api] {} {} bad request: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("bad_request", truncate(ex.getMessage(), 300)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("[Api] {} {} unexpected failure: {}",
                request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("internal_error", "An internal error occurred while processing the request"));
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        return text.substring(0, maxLength);
    }
}
