package eu.virtualparadox.knowledgebase.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable error codes surfaced in job records and API responses.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    VALIDATION("validation_error"),
    PROVIDER("provider_error"),
    STORAGE("storage_error"),
    NOT_FOUND("not_found"),
    CONFLICT("conflict"),
    CANCELLED("cancelled"),
    INTERNAL("internal_error");

    private final String code;
}
