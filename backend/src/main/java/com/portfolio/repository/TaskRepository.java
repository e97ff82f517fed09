package com.portfolio.repository;

import com.portfolio.entity.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Task entity operations.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, String> {

    /**
     * Find a task by id within a project.
     *
     * @param id the task ID
     * @param projectId the owning project's ID
     * @return Optional containing the task if it belongs to the project
     */
    Optional<Task> findByIdAndProjectId(String id, String projectId);

    /**
     * Check whether a task id is used by a project other than {@code projectId}.
     *
     * @param id candidate task ID
     * @param projectId the project being written
     * @return true if another project owns a task with this id
     */
    boolean existsByIdAndProjectIdNot(String id, String projectId);

    /**
     * Point every task assigned to one person at another.
     *
     * @param fromId person being merged away
     * @param toId surviving person
     * @return number of tasks updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE task SET assignee_id = :toId WHERE assignee_id = :fromId", nativeQuery = true)
    int reassignAssignee(@Param("fromId") String fromId, @Param("toId") String toId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE task SET assignee_id = NULL WHERE assignee_id = :personId", nativeQuery = true)
    int clearAssignee(@Param("personId") String personId);
}
