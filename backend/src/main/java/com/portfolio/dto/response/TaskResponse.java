package com.portfolio.dto.response;

import com.portfolio.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a task with its subtasks in plan order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private String id;

    private String title;

    private String status;

    private String dueDate;

    private String completedDate;

    private PersonResponse assignee;

    private List<SubtaskResponse> subtasks;

    public static TaskResponse from(Task task) {
        return TaskResponse.builder()
                .id(task.getId())
                .title(task.getTitle())
                .status(task.getStatus())
                .dueDate(task.getDueDate())
                .completedDate(task.getCompletedDate())
                .assignee(PersonResponse.from(task.getAssignee()))
                .subtasks(task.getSubtasks().stream().map(SubtaskResponse::from).collect(Collectors.toList()))
                .build();
    }
}
