package com.openforge.taskmate.task;

import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.error.InvalidToolArgumentsException;
import com.openforge.taskmate.error.ResourceNotFoundException;
import com.openforge.taskmate.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Owner-scoped access to {@link Task} rows.
 *
 * Every method that takes an id looks the row up by (id, owner) in a single
 * query, so a task owned by somebody else is indistinguishable from a
 * missing one: both raise {@link ResourceNotFoundException}.
 *
 * The plain CRUD surface and the chat tools share this class, so both see
 * the same ownership and validation rules.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStore {

    public static final int MAX_TITLE_LENGTH       = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    public enum StatusFilter {
        ALL,
        PENDING,
        COMPLETED;

        /** Lenient parse: null or blank means ALL; unknown values are rejected. */
        public static StatusFilter parse(String value) {
            if (value == null || value.isBlank()) return ALL;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidToolArgumentsException(
                        "status must be one of all, pending, completed (got '%s')".formatted(value));
            }
        }
    }

    /** Partial update; null fields are left untouched. */
    public record TaskChanges(String title, String description) {

        public boolean isEmpty() {
            return title == null && description == null;
        }
    }

    private final TaskRepository taskRepository;

    // ── Create ───────────────────────────────────────────────────────────────

    @Transactional
    public Task create(Long ownerId, String title, String description) {
        Task task = Task.builder()
                .ownerId(ownerId)
                .title(normalizeTitle(title))
                .description(normalizeDescription(description))
                .completed(false)
                .build();
        Task saved = taskRepository.save(task);
        log.info("[TaskStore] Created task id={} owner={} title='{}'", saved.getId(), ownerId, saved.getTitle());
        return saved;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    /** Most recently created first. */
    @Transactional(readOnly = true)
    public List<Task> list(Long ownerId, StatusFilter filter) {
        return switch (filter) {
            case ALL       -> taskRepository.findByOwnerIdOrderByCreateTimeDescIdDesc(ownerId);
            case PENDING   -> taskRepository.findByOwnerIdAndCompletedOrderByCreateTimeDescIdDesc(ownerId, false);
            case COMPLETED -> taskRepository.findByOwnerIdAndCompletedOrderByCreateTimeDescIdDesc(ownerId, true);
        };
    }

    @Transactional(readOnly = true)
    public Task get(Long ownerId, Long taskId) {
        return find(ownerId, taskId)
                .orElseThrow(() -> new ResourceNotFoundException("task", taskId));
    }

    @Transactional(readOnly = true)
    public Optional<Task> find(Long ownerId, Long taskId) {
        if (taskId == null) return Optional.empty();
        return taskRepository.findByIdAndOwnerId(taskId, ownerId);
    }

    /**
     * True when a task with this id exists for any owner.  Only the
     * orchestrator uses this, to tell a cross-tenant attempt apart from a
     * plain miss.
     */
    @Transactional(readOnly = true)
    public boolean existsForAnyOwner(Long taskId) {
        return taskId != null && taskRepository.existsById(taskId);
    }

    // ── Mutate ───────────────────────────────────────────────────────────────

    @Transactional
    public Task update(Long ownerId, Long taskId, TaskChanges changes) {
        if (changes == null || changes.isEmpty()) {
            throw new InvalidToolArgumentsException("Nothing to update: provide a title or a description");
        }
        Task task = get(ownerId, taskId);
        if (changes.title() != null) {
            task.setTitle(normalizeTitle(changes.title()));
        }
        if (changes.description() != null) {
            task.setDescription(normalizeDescription(changes.description()));
        }
        Task saved = taskRepository.save(task);
        log.info("[TaskStore] Updated task id={} owner={}", taskId, ownerId);
        return saved;
    }

    @Transactional
    public Task setCompleted(Long ownerId, Long taskId, boolean completed) {
        Task task = get(ownerId, taskId);
        task.setCompleted(completed);
        Task saved = taskRepository.save(task);
        log.info("[TaskStore] Task id={} owner={} completed={}", taskId, ownerId, completed);
        return saved;
    }

    @Transactional
    public Task delete(Long ownerId, Long taskId) {
        Task task = get(ownerId, taskId);
        taskRepository.delete(task);
        log.info("[TaskStore] Deleted task id={} owner={}", taskId, ownerId);
        return task;
    }

    // ── Validation ───────────────────────────────────────────────────────────

    static String normalizeTitle(String title) {
        String trimmed = title == null ? "" : title.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidToolArgumentsException("Title cannot be empty");
        }
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw new InvalidToolArgumentsException(
                    "Title must be 1-%d characters".formatted(MAX_TITLE_LENGTH));
        }
        return trimmed;
    }

    /** Blank descriptions are stored as null. */
    static String normalizeDescription(String description) {
        if (description == null) return null;
        String trimmed = description.trim();
        if (trimmed.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidToolArgumentsException(
                    "Description must be %d characters or less".formatted(MAX_DESCRIPTION_LENGTH));
        }
        return trimmed.isEmpty() ? null : trimmed;
    }
}
