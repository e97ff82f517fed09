package com.portfolio.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Desired state of one task and its subtasks.
 *
 * {@code assignee} accepts a name or a person object. {@code assigneeId} is
 * the older id-only form and is used when {@code assignee} is absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPayload {

    private String id;

    @NotBlank(message = "Task title is required")
    private String title;

    private String status;

    private String dueDate;

    private String completedDate;

    private PersonReference assignee;

    private String assigneeId;

    @Valid
    @Builder.Default
    private List<SubtaskPayload> subtasks = new ArrayList<>();
}
