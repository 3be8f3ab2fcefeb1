package com.openforge.taskmate.agent;

import com.openforge.taskmate.config.DisambiguationProperties;
import com.openforge.taskmate.error.AmbiguousReferenceException;
import com.openforge.taskmate.error.AmbiguousReferenceException.Candidate;
import com.openforge.taskmate.error.AmbiguousReferenceException.Reason;
import com.openforge.taskmate.task.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a free-text task reference ("the call mom task") onto one task id.
 *
 * Both the reference and every title are normalised (lower case, no
 * punctuation, filler words dropped) and scored:
 *
 *   exact match          1.0
 *   one contains other   0.6 + 0.3 * shorter/longer
 *   shared tokens        0.8 * jaccard(tokens)
 *
 * The best task wins when it reaches {@code threshold} and no other task
 * scores within {@code margin} of it.  Only an exact match counts as a
 * full-confidence resolution.  Reads the task list, never writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DisambiguationResolver {

    private static final Set<String> FILLER_WORDS =
            Set.of("the", "a", "an", "my", "task", "tasks", "to");

    public record Resolution(Long taskId, String title, double score) {

        public boolean fullConfidence() {
            return score >= 1.0;
        }
    }

    private final TaskStore                taskStore;
    private final DisambiguationProperties properties;

    public Resolution resolve(Long ownerId, String reference) {
        String needle = normalize(reference);
        if (needle.isEmpty()) {
            throw new AmbiguousReferenceException(Reason.NOT_FOUND, String.valueOf(reference), List.of());
        }

        List<Candidate> scored = taskStore.list(ownerId, TaskStore.StatusFilter.ALL).stream()
                .map(task -> new Candidate(task.getId(), task.getTitle(), score(needle, normalize(task.getTitle()))))
                .filter(candidate -> candidate.score() > 0)
                .sorted(Comparator.comparingDouble(Candidate::score).reversed()
                        .thenComparing(Candidate::id))
                .toList();

        if (scored.isEmpty() || scored.get(0).score() < properties.threshold()) {
            log.info("[Disambiguation] owner={} ref='{}' matched nothing", ownerId, reference);
            throw new AmbiguousReferenceException(Reason.NOT_FOUND, reference, List.of());
        }

        Candidate best = scored.get(0);
        List<Candidate> close = scored.stream()
                .filter(candidate -> best.score() - candidate.score() < properties.margin())
                .toList();
        if (close.size() > 1) {
            log.info("[Disambiguation] owner={} ref='{}' matched {} tasks closely", ownerId, reference, close.size());
            throw new AmbiguousReferenceException(Reason.MULTIPLE_MATCHES, reference, close);
        }

        log.debug("[Disambiguation] owner={} ref='{}' -> task {} score={}",
                ownerId, reference, best.id(), best.score());
        return new Resolution(best.id(), best.title(), best.score());
    }

    // ── Scoring ──────────────────────────────────────────────────────────────

    static String normalize(String text) {
        if (text == null) return "";
        String cleaned = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s]", " ");
        return Arrays.stream(cleaned.trim().split("\\s+"))
                .filter(token -> !token.isEmpty() && !FILLER_WORDS.contains(token))
                .collect(Collectors.joining(" "));
    }

    static double score(String reference, String title) {
        if (reference.isEmpty() || title.isEmpty()) return 0.0;
        if (reference.equals(title)) return 1.0;

        if (title.contains(reference) || reference.contains(title)) {
            double shorter = Math.min(reference.length(), title.length());
            double longer  = Math.max(reference.length(), title.length());
            return 0.6 + 0.3 * (shorter / longer);
        }

        Set<String> refTokens   = tokens(reference);
        Set<String> titleTokens = tokens(title);
        Set<String> union = new HashSet<>(refTokens);
        union.addAll(titleTokens);
        refTokens.retainAll(titleTokens);
        return union.isEmpty() ? 0.0 : 0.8 * refTokens.size() / union.size();
    }

    private static Set<String> tokens(String normalized) {
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }
}
