package com.portfolio.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Task entity: one step of a project's plan, with an optional assignee and an
 * ordered list of subtasks.
 *
 * Database Table: task
 */
@Entity
@Table(name = "task", indexes = {
    @Index(name = "idx_task_project_id", columnList = "project_id"),
    @Index(name = "idx_task_assignee_id", columnList = "assignee_id")
})
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Task {

    @Id
    @EqualsAndHashCode.Include
    @Column(name = "id", length = 64, updatable = false, nullable = false)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false, foreignKey = @ForeignKey(name = "fk_task_project"))
    @ToString.Exclude
    private Project project;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "status", nullable = false, length = 50)
    private String status = "todo";

    @Column(name = "due_date", length = 32)
    private String dueDate;

    @Column(name = "completed_date", length = 32)
    private String completedDate;

    /**
     * Assigned person, null when unassigned.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assignee_id", foreignKey = @ForeignKey(name = "fk_task_assignee"))
    @ToString.Exclude
    private Person assignee;

    @OneToMany(mappedBy = "task", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderColumn(name = "list_index")
    @ToString.Exclude
    private List<Subtask> subtasks = new ArrayList<>();

    /**
     * Constructor for a new task owned by a project.
     *
     * @param id      the identifier to insert under
     * @param project owning project
     */
    public Task(String id, Project project) {
        this.id = id;
        this.project = project;
    }
}
