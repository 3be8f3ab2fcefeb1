package com.openforge.taskmate.error;

/**
 * Store-level failure while running a cleared tool call.
 *
 * Never retried automatically: replaying a mutating call without an
 * idempotency key could apply it twice.
 */
public class ToolExecutionException extends TaskmateException {

    public ToolExecutionException(String toolName, Throwable cause) {
        super("tool_execution_failed",
                "Tool '%s' failed: %s".formatted(toolName, cause.getMessage()), cause);
    }
}
