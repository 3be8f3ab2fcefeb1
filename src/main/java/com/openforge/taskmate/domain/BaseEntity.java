package com.openforge.taskmate.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Audit columns shared by every table.
 *
 * - id           : identity; also the tie-breaker when two rows share a create_time
 * - create_time  : set once on INSERT
 * - update_time  : refreshed by the auditing listener whenever the row is dirty
 * - version      : optimistic-lock counter; concurrent writers on the same row
 *                  fail with OptimisticLockException instead of overwriting.
 *                  Null until the first INSERT, which is how Spring Data
 *                  tells a new entity from a detached one.
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    @Version
    @Column(nullable = false)
    private Integer version;
}
