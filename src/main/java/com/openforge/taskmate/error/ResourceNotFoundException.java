package com.openforge.taskmate.error;

import lombok.Getter;

@Getter
public class ResourceNotFoundException extends TaskmateException {

    private final String resource;
    private final Object resourceId;

    public ResourceNotFoundException(String resource, Object resourceId) {
        super("not_found", "%s %s not found".formatted(capitalize(resource), resourceId));
        this.resource   = resource;
        this.resourceId = resourceId;
    }

    private static String capitalize(String s) {
        return s == null || s.isEmpty() ? "Resource" : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
