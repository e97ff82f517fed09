package com.portfolio.dto.response;

import com.portfolio.dto.request.TaskContextPayload;
import com.portfolio.entity.Activity;
import com.portfolio.entity.TaskContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an activity log entry.
 *
 * {@code author} is the display name; {@code authorId} is set when the author
 * is linked to a person.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityResponse {

    private String id;

    private String date;

    private String note;

    private String author;

    private String authorId;

    private TaskContextPayload taskContext;

    public static ActivityResponse from(Activity activity) {
        TaskContext context = activity.getTaskContext();
        return ActivityResponse.builder()
                .id(activity.getId())
                .date(activity.getDate())
                .note(activity.getNote())
                .author(activity.getAuthor())
                .authorId(activity.getAuthorPerson() != null ? activity.getAuthorPerson().getId() : null)
                .taskContext(context == null ? null : TaskContextPayload.builder()
                        .taskId(context.getTaskId())
                        .subtaskId(context.getSubtaskId())
                        .taskTitle(context.getTaskTitle())
                        .subtaskTitle(context.getSubtaskTitle())
                        .build())
                .build();
    }
}
