package com.portfolio.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Task or subtask an activity entry refers to. Also used in responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskContextPayload {

    private String taskId;

    private String subtaskId;

    private String taskTitle;

    private String subtaskTitle;
}
