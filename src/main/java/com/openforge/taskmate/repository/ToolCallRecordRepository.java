package com.openforge.taskmate.repository;

import com.openforge.taskmate.domain.ToolCallRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ToolCallRecordRepository extends JpaRepository<ToolCallRecord, Long> {

    List<ToolCallRecord> findByMessageIdOrderByIdAsc(Long messageId);

    List<ToolCallRecord> findByMessageIdInOrderByIdAsc(Collection<Long> messageIds);

    /**
     * Row lock for status transitions.  Two confirmations racing on the same
     * record serialize here; the second one sees the terminal status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from ToolCallRecord r where r.id = :id")
    Optional<ToolCallRecord> findByIdForUpdate(@Param("id") Long id);

    List<ToolCallRecord> findByStatusAndCreateTimeBefore(ToolCallRecord.Status status, LocalDateTime cutoff);

    long deleteByConversationId(Long conversationId);

    long deleteByMessageId(Long messageId);
}
