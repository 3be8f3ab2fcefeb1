package com.openforge.taskmate.error;

public class InvalidToolArgumentsException extends TaskmateException {

    public InvalidToolArgumentsException(String message) {
        super("validation_error", message);
    }
}
