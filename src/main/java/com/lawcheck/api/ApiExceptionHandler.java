package com.lawcheck.api;

import com.lawcheck.eval.EvaluationLimitExceededException;
import com.lawcheck.model.InvalidStatuteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Maps failures to the machine-readable error body:
 * {
 *   "error_code": "INVALID_STATUTE",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidStatuteException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidStatute(InvalidStatuteException ex) {
        log.warn("Invalid statute input: {}", ex.getMessage());
        return errorResponse("INVALID_STATUTE", ex.getMessage());
    }

    @ExceptionHandler(PatternSyntaxException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidPattern(PatternSyntaxException ex) {
        log.warn("Rejected condition with invalid regex '{}'", ex.getPattern());
        return errorResponse("INVALID_PATTERN",
            "invalid regex '" + ex.getPattern() + "': " + ex.getDescription());
    }

    @ExceptionHandler(EvaluationLimitExceededException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleLimitExceeded(EvaluationLimitExceededException ex) {
        log.warn("Condition exceeds evaluation limits: {}", ex.getMessage());
        return errorResponse("CONDITION_TOO_COMPLEX", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "statute or condition payload could not be read: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Verification request failed", ex);
        return errorResponse("INTERNAL_ERROR", "verification failed unexpectedly");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
