package com.portfolio.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Subtask entity, owned by a task.
 *
 * Database Table: subtask
 */
@Entity
@Table(name = "subtask", indexes = {
    @Index(name = "idx_subtask_task_id", columnList = "task_id"),
    @Index(name = "idx_subtask_assignee_id", columnList = "assignee_id")
})
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Subtask {

    @Id
    @EqualsAndHashCode.Include
    @Column(name = "id", length = 64, updatable = false, nullable = false)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false, foreignKey = @ForeignKey(name = "fk_subtask_task"))
    @ToString.Exclude
    private Task task;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "status", nullable = false, length = 50)
    private String status = "todo";

    @Column(name = "due_date", length = 32)
    private String dueDate;

    @Column(name = "completed_date", length = 32)
    private String completedDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assignee_id", foreignKey = @ForeignKey(name = "fk_subtask_assignee"))
    @ToString.Exclude
    private Person assignee;

    public Subtask(String id, Task task) {
        this.id = id;
        this.task = task;
    }
}
