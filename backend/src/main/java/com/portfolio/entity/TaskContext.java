package com.portfolio.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional pointer from an activity entry to the task or subtask it concerns.
 * Titles are copied at write time so the entry still reads correctly after the
 * task is renamed or removed.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskContext {

    @Column(name = "context_task_id", length = 64)
    private String taskId;

    @Column(name = "context_subtask_id", length = 64)
    private String subtaskId;

    @Column(name = "context_task_title")
    private String taskTitle;

    @Column(name = "context_subtask_title")
    private String subtaskTitle;
}
