package com.openforge.taskmate.tool;

/**
 * SAFE tools only read and always run in the same turn.
 * SENSITIVE tools mutate tasks and pass through the confirmation gate.
 */
public enum ToolSensitivity {
    SAFE,
    SENSITIVE
}
