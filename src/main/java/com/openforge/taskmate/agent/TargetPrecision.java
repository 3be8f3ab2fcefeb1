package com.openforge.taskmate.agent;

/** How the task a proposed call acts on was identified. */
public enum TargetPrecision {

    /** The tool takes no target (add_task, list_tasks). */
    NONE,

    /** The model supplied an id that exists for the owner. */
    EXACT_ID,

    /** A free-text reference matched one title exactly. */
    RESOLVED_EXACT,

    /** A free-text reference matched one title above the threshold, but not exactly. */
    RESOLVED_FUZZY;

    public boolean fullConfidence() {
        return this != RESOLVED_FUZZY;
    }
}
