package eu.virtualparadox.knowledgebase.api;

import eu.virtualparadox.knowledgebase.api.dto.ErrorResponse;
import eu.virtualparadox.knowledgebase.error.ErrorCode;
import eu.virtualparadox.knowledgebase.error.KnowledgeBaseException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.stream.Collectors;

/**
 * Maps errors to HTTP statuses with a {@code {code, message, stage}} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(KnowledgeBaseException.class)
    public ResponseEntity<ErrorResponse> knowledgeBase(final KnowledgeBaseException e) {
        final HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Request failed", e);
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getErrorCode().getCode(), e.getMessage(), e.getStage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(final MethodArgumentNotValidException e) {
        final String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        return badRequest(message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ErrorResponse> invalidParameter(final Exception e) {
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(final HttpMessageNotReadableException e) {
        final Throwable cause = e.getMostSpecificCause();
        if (cause instanceof KnowledgeBaseException kbe) {
            return badRequest(kbe.getMessage());
        }
        return badRequest("malformed request body");
    }

    private static ResponseEntity<ErrorResponse> badRequest(final String message) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ErrorCode.VALIDATION.getCode(), message, null));
    }

    static HttpStatus statusOf(final ErrorCode code) {
        return switch (code) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT, CANCELLED -> HttpStatus.CONFLICT;
            case PROVIDER -> HttpStatus.BAD_GATEWAY;
            case STORAGE, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
