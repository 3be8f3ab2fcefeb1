package com.openforge.taskmate.error;

/**
 * The caller is authenticated but the referenced conversation, task or tool
 * call belongs to someone else.
 *
 * Only the orchestrator raises this.  The stores report such lookups as
 * {@link ResourceNotFoundException} so that existence never leaks across
 * internal boundaries.
 */
public class OwnershipViolationException extends TaskmateException {

    public OwnershipViolationException(String resource, Object id) {
        super("forbidden", "Access denied to %s %s".formatted(resource, id));
    }
}
