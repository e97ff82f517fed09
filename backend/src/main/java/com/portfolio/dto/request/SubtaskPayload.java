package com.portfolio.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Desired state of one subtask.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubtaskPayload {

    private String id;

    @NotBlank(message = "Subtask title is required")
    private String title;

    private String status;

    private String dueDate;

    private String completedDate;

    private PersonReference assignee;

    private String assigneeId;
}
