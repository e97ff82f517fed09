package com.portfolio.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full desired state of a project aggregate.
 *
 * An upsert rebuilds the stored project to exactly this content: tasks,
 * subtasks and activity entries absent from the payload are removed.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "id": "project-3f2a9c1b",
 *   "name": "Apollo",
 *   "status": "in-progress",
 *   "stakeholders": ["Sarah Chen", {"name": "Marcus Rivera", "team": "Engineering"}],
 *   "tasks": [{"title": "Kickoff", "assignee": "Sarah Chen"}],
 *   "activities": [{"date": "2025-03-01", "note": "Scope agreed", "author": "Marcus Rivera"}]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectPayload {

    /**
     * Project to update; a new project is created under this id when absent.
     */
    private String id;

    @NotBlank(message = "Project name is required")
    private String name;

    private String status;

    private String priority;

    @Min(value = 0, message = "Progress must be between 0 and 100")
    @Max(value = 100, message = "Progress must be between 0 and 100")
    private Integer progress;

    private String description;

    private String executiveUpdate;

    private String startDate;

    private String targetDate;

    @Builder.Default
    private List<PersonReference> stakeholders = new ArrayList<>();

    @Valid
    @Builder.Default
    @JsonAlias("plan")
    private List<TaskPayload> tasks = new ArrayList<>();

    @Valid
    @Builder.Default
    @JsonAlias("recentActivity")
    private List<ActivityPayload> activities = new ArrayList<>();
}
