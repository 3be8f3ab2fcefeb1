package com.openforge.taskmate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Scoring limits for free-text task references ("taskmate.disambiguation").
 *
 * @param threshold minimum score for a task to count as a match
 * @param margin    a runner-up scoring within this distance of the best
 *                  match makes the reference ambiguous
 */
@ConfigurationProperties(prefix = "taskmate.disambiguation")
public record DisambiguationProperties(
        @DefaultValue("0.5") double threshold,
        @DefaultValue("0.1") double margin
) {
}
