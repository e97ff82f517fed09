package com.portfolio.dto.response;

import com.portfolio.entity.Project;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a full project aggregate.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "id": "project-3f2a9c1b77d0",
 *   "name": "Apollo",
 *   "status": "in-progress",
 *   "priority": "high",
 *   "progress": 40,
 *   "lastUpdate": "Scope agreed",
 *   "stakeholders": [{"id": "person-8c1d2e3f4a5b", "name": "Sarah Chen", "team": "Product", "email": null}],
 *   "tasks": [{"id": "task-0b9e1c2d3f4a", "title": "Kickoff", "status": "done", "subtasks": []}],
 *   "activities": [{"id": "activity-5e6f7a8b9c0d", "date": "2025-03-01", "note": "Scope agreed", "author": "Sarah Chen"}]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectResponse {

    private String id;

    private String name;

    private String status;

    private String priority;

    private Integer progress;

    private String description;

    private String executiveUpdate;

    private String startDate;

    private String targetDate;

    /**
     * Note of the newest activity entry.
     */
    private String lastUpdate;

    private List<PersonResponse> stakeholders;

    private List<TaskResponse> tasks;

    private List<ActivityResponse> activities;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Map an initialized aggregate.
     *
     * @param project the aggregate root with its children loaded
     * @return the DTO
     */
    public static ProjectResponse from(Project project) {
        return ProjectResponse.builder()
                .id(project.getId())
                .name(project.getName())
                .status(project.getStatus())
                .priority(project.getPriority())
                .progress(project.getProgress())
                .description(project.getDescription())
                .executiveUpdate(project.getExecutiveUpdate())
                .startDate(project.getStartDate())
                .targetDate(project.getTargetDate())
                .lastUpdate(project.getLastUpdate())
                .stakeholders(project.getStakeholders().stream().map(PersonResponse::from).collect(Collectors.toList()))
                .tasks(project.getTasks().stream().map(TaskResponse::from).collect(Collectors.toList()))
                .activities(project.getActivities().stream().map(ActivityResponse::from).collect(Collectors.toList()))
                .createdAt(project.getCreatedAt())
                .updatedAt(project.getUpdatedAt())
                .build();
    }
}
