package com.portfolio.controller;

import com.portfolio.dto.request.ActivityPayload;
import com.portfolio.dto.request.ImportPayload;
import com.portfolio.dto.request.ProjectPayload;
import com.portfolio.dto.request.SubtaskPayload;
import com.portfolio.dto.request.TaskPayload;
import com.portfolio.dto.response.ProjectResponse;
import com.portfolio.entity.Project;
import com.portfolio.service.ProjectItemService;
import com.portfolio.service.ProjectService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller for project aggregates and their tasks, subtasks and
 * activity entries.
 *
 * Writes to a project return the whole re-read aggregate. POST and PUT on a
 * project replace its children with the payload's.
 *
 * Error Responses:
 * - 400 Bad Request: blank name or title, malformed body, unknown import mode
 * - 404 Not Found: unknown project, task, subtask or activity entry
 * - 409 Conflict: project name already used by another project
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 *
 * @see com.portfolio.service.ProjectService
 * @see com.portfolio.service.ProjectItemService
 */
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
@Slf4j
public class ProjectController {

    private final ProjectService projectService;
    private final ProjectItemService projectItemService;

    @GetMapping
    public ResponseEntity<List<ProjectResponse>> listProjects() {
        List<Project> projects = projectService.listProjects();
        return ResponseEntity.ok(projects.stream().map(ProjectResponse::from).collect(Collectors.toList()));
    }

    /**
     * Create a project, or replace the project with the payload's id.
     *
     * @param payload desired aggregate state
     * @return the stored aggregate with 201 Created
     */
    @PostMapping
    public ResponseEntity<ProjectResponse> createProject(@Valid @RequestBody ProjectPayload payload) {
        log.info("Upsert project request: id={}, name='{}'", payload.getId(), payload.getName());
        Project project = projectService.upsertProject(payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
    }

    /**
     * Bulk load projects in {@code replace} or {@code merge} mode.
     *
     * @param payload projects to load, optionally with a mode
     * @param mode mode used when the body names none
     * @return every project after the import
     */
    @PostMapping("/import")
    public ResponseEntity<List<ProjectResponse>> importProjects(
            @Valid @RequestBody ImportPayload payload,
            @RequestParam(defaultValue = "replace") String mode) {
        String effectiveMode = payload.getMode() != null ? payload.getMode() : mode;
        log.info("Import request: {} projects, mode={}",
                payload.getProjects() != null ? payload.getProjects().size() : 0, effectiveMode);
        List<Project> projects = projectService.importPortfolio(payload.getProjects(), effectiveMode);
        return ResponseEntity.ok(projects.stream().map(ProjectResponse::from).collect(Collectors.toList()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable String id) {
        return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(id)));
    }

    /**
     * Replace a project aggregate. The path id wins over any id in the body.
     *
     * @param id the project ID
     * @param payload desired aggregate state
     * @return the stored aggregate
     */
    @PutMapping("/{id}")
    public ResponseEntity<ProjectResponse> updateProject(
            @PathVariable String id,
            @Valid @RequestBody ProjectPayload payload) {
        payload.setId(id);
        log.info("Replace project request: id={}, name='{}'", id, payload.getName());
        return ResponseEntity.ok(ProjectResponse.from(projectService.upsertProject(payload)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProject(@PathVariable String id) {
        log.info("Delete project request: id={}", id);
        projectService.deleteProject(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/tasks")
    public ResponseEntity<ProjectResponse> addTask(
            @PathVariable String id,
            @Valid @RequestBody TaskPayload payload) {
        Project project = projectItemService.addTask(id, payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
    }

    @PutMapping("/{id}/tasks/{taskId}")
    public ResponseEntity<ProjectResponse> updateTask(
            @PathVariable String id,
            @PathVariable String taskId,
            @Valid @RequestBody TaskPayload payload) {
        return ResponseEntity.ok(ProjectResponse.from(projectItemService.updateTask(id, taskId, payload)));
    }

    @DeleteMapping("/{id}/tasks/{taskId}")
    public ResponseEntity<ProjectResponse> deleteTask(@PathVariable String id, @PathVariable String taskId) {
        return ResponseEntity.ok(ProjectResponse.from(projectItemService.deleteTask(id, taskId)));
    }

    @PostMapping("/{id}/tasks/{taskId}/subtasks")
    public ResponseEntity<ProjectResponse> addSubtask(
            @PathVariable String id,
            @PathVariable String taskId,
            @Valid @RequestBody SubtaskPayload payload) {
        Project project = projectItemService.addSubtask(id, taskId, payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
    }

    @PutMapping("/{id}/tasks/{taskId}/subtasks/{subtaskId}")
    public ResponseEntity<ProjectResponse> updateSubtask(
            @PathVariable String id,
            @PathVariable String taskId,
            @PathVariable String subtaskId,
            @Valid @RequestBody SubtaskPayload payload) {
        return ResponseEntity.ok(ProjectResponse.from(
                projectItemService.updateSubtask(id, taskId, subtaskId, payload)));
    }

    @DeleteMapping("/{id}/tasks/{taskId}/subtasks/{subtaskId}")
    public ResponseEntity<ProjectResponse> deleteSubtask(
            @PathVariable String id,
            @PathVariable String taskId,
            @PathVariable String subtaskId) {
        return ResponseEntity.ok(ProjectResponse.from(projectItemService.deleteSubtask(id, taskId, subtaskId)));
    }

    @PostMapping("/{id}/activities")
    public ResponseEntity<ProjectResponse> addActivity(
            @PathVariable String id,
            @Valid @RequestBody ActivityPayload payload) {
        Project project = projectItemService.addActivity(id, payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
    }

    @PutMapping("/{id}/activities/{activityId}")
    public ResponseEntity<ProjectResponse> updateActivity(
            @PathVariable String id,
            @PathVariable String activityId,
            @Valid @RequestBody ActivityPayload payload) {
        return ResponseEntity.ok(ProjectResponse.from(projectItemService.updateActivity(id, activityId, payload)));
    }

    @DeleteMapping("/{id}/activities/{activityId}")
    public ResponseEntity<ProjectResponse> deleteActivity(@PathVariable String id, @PathVariable String activityId) {
        return ResponseEntity.ok(ProjectResponse.from(projectItemService.deleteActivity(id, activityId)));
    }
}
