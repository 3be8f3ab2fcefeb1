package com.openforge.taskmate.error;

/** No verified identity on the request.  Raised before any store access. */
public class AuthenticationRequiredException extends TaskmateException {

    public AuthenticationRequiredException(String message) {
        super("authentication_required", message);
    }
}
