package com.openforge.taskmate.repository;

import com.openforge.taskmate.domain.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    Optional<Task> findByIdAndOwnerId(Long id, Long ownerId);

    /** Newest first; id breaks create_time ties. */
    List<Task> findByOwnerIdOrderByCreateTimeDescIdDesc(Long ownerId);

    List<Task> findByOwnerIdAndCompletedOrderByCreateTimeDescIdDesc(Long ownerId, Boolean completed);
}
