package com.portfolio.dto.response;

import com.portfolio.entity.Subtask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubtaskResponse {

    private String id;

    private String title;

    private String status;

    private String dueDate;

    private String completedDate;

    private PersonResponse assignee;

    public static SubtaskResponse from(Subtask subtask) {
        return SubtaskResponse.builder()
                .id(subtask.getId())
                .title(subtask.getTitle())
                .status(subtask.getStatus())
                .dueDate(subtask.getDueDate())
                .completedDate(subtask.getCompletedDate())
                .assignee(PersonResponse.from(subtask.getAssignee()))
                .build();
    }
}
