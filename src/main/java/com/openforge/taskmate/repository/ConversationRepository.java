package com.openforge.taskmate.repository;

import com.openforge.taskmate.domain.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, Long> {

    Optional<Conversation> findByIdAndOwnerId(Long id, Long ownerId);

    List<Conversation> findByOwnerIdOrderByUpdateTimeDescIdDesc(Long ownerId);

    Optional<Conversation> findFirstByOwnerIdOrderByUpdateTimeDescIdDesc(Long ownerId);

    /**
     * Bumps the activity timestamps without touching {@code version}, so
     * concurrent appends to one conversation never fail the optimistic lock.
     * Auditing does not see bulk updates; update_time is set here.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Conversation c set c.lastMessageTime = :now, c.updateTime = :now where c.id = :id")
    int touch(@Param("id") Long id, @Param("now") LocalDateTime now);
}
