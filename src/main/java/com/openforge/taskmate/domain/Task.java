package com.openforge.taskmate.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One entry in a user's task list.
 *
 * Every row has exactly one owner.  The store never returns a task to a
 * caller whose owner id differs from {@link #ownerId}; such lookups behave
 * exactly like a missing row.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "tasks",
    indexes = @Index(name = "idx_tasks_owner", columnList = "owner_id")
)
public class Task extends BaseEntity {

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @Builder.Default
    @Column(name = "completed", nullable = false)
    private Boolean completed = false;

    public boolean isCompleted() {
        return Boolean.TRUE.equals(completed);
    }
}
