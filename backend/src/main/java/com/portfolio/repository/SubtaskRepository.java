package com.portfolio.repository;

import com.portfolio.entity.Subtask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Subtask entity operations.
 */
@Repository
public interface SubtaskRepository extends JpaRepository<Subtask, String> {

    Optional<Subtask> findByIdAndTaskId(String id, String taskId);

    /**
     * Check whether a subtask id is used under a task other than {@code taskId}.
     *
     * @param id candidate subtask ID
     * @param taskId the task being written
     * @return true if another task owns a subtask with this id
     */
    boolean existsByIdAndTaskIdNot(String id, String taskId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE subtask SET assignee_id = :toId WHERE assignee_id = :fromId", nativeQuery = true)
    int reassignAssignee(@Param("fromId") String fromId, @Param("toId") String toId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE subtask SET assignee_id = NULL WHERE assignee_id = :personId", nativeQuery = true)
    int clearAssignee(@Param("personId") String personId);
}
