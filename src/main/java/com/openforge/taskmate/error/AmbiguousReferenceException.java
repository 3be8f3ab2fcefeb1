package com.openforge.taskmate.error;

import lombok.Getter;

import java.util.List;

/**
 * A free-text task reference matched zero tasks, or several tasks too
 * closely to pick one.
 *
 * The orchestrator turns this into a clarifying question; it never reaches
 * the HTTP layer during a chat turn.
 */
@Getter
public class AmbiguousReferenceException extends TaskmateException {

    public enum Reason {
        NOT_FOUND("not found"),
        MULTIPLE_MATCHES("multiple matches");

        private final String label;

        Reason(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public record Candidate(Long id, String title, double score) {}

    private final Reason          reason;
    private final String          reference;
    private final List<Candidate> candidates;

    public AmbiguousReferenceException(Reason reason, String reference, List<Candidate> candidates) {
        super("ambiguous_reference", "%s for \"%s\"".formatted(reason.label(), reference));
        this.reason     = reason;
        this.reference  = reference;
        this.candidates = List.copyOf(candidates);
    }
}
