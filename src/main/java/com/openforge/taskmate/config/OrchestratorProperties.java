package com.openforge.taskmate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Turn-handling policy, read from "taskmate.orchestrator".
 *
 * @param autoConfirmNonDestructive update_task / complete_task with a fully
 *                                  confident target run without a confirm
 *                                  round-trip; delete_task never does
 * @param confirmationWindow        a proposal older than this is abandoned
 *                                  and can no longer be confirmed
 * @param minIntentConfidence       mutations the model reports with lower
 *                                  confidence are held for confirmation
 * @param maxContextMessages        sliding window of history sent to the model
 * @param modelRetryBackoff         wait before the single retry of a failed
 *                                  assistant call
 * @param sweepIntervalMs           period of the abandoned-proposal sweep
 */
@ConfigurationProperties(prefix = "taskmate.orchestrator")
public record OrchestratorProperties(
        @DefaultValue("true")  boolean  autoConfirmNonDestructive,
        @DefaultValue("15m")   Duration confirmationWindow,
        @DefaultValue("0.7")   double   minIntentConfidence,
        @DefaultValue("50")    int      maxContextMessages,
        @DefaultValue("500ms") Duration modelRetryBackoff,
        @DefaultValue("60000") long     sweepIntervalMs
) {
}
