package com.openforge.taskmate.error;

/** The assistant backend failed, timed out, or returned something unusable. */
public class ModelInvocationException extends TaskmateException {

    public ModelInvocationException(String message) {
        super("model_unavailable", message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super("model_unavailable", message, cause);
    }
}
