package com.openforge.taskmate.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Container for the ordered messages of one chat thread.
 *
 * The server keeps nothing about a conversation in memory; every request
 * rebuilds its view from this row and its messages.
 *
 * lastMessageTime and update_time are bumped on every append by a bulk
 * update that leaves version alone, so appends racing on one conversation
 * do not conflict.  Conversation lists are sorted by update_time, newest
 * first.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "conversations",
    indexes = @Index(name = "idx_conversations_owner", columnList = "owner_id")
)
public class Conversation extends BaseEntity {

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "last_message_time")
    private LocalDateTime lastMessageTime;
}
