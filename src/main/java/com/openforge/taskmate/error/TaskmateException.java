package com.openforge.taskmate.error;

import lombok.Getter;

/**
 * Root of the orchestrator's error taxonomy.
 *
 * {@code code} is a stable machine-readable identifier that ends up in the
 * "error" field of HTTP error bodies and in failed tool-call results.
 */
@Getter
public abstract class TaskmateException extends RuntimeException {

    private final String code;

    protected TaskmateException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected TaskmateException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
