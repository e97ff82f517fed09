package com.portfolio.service;

import com.portfolio.dto.request.ActivityPayload;
import com.portfolio.dto.request.SubtaskPayload;
import com.portfolio.dto.request.TaskPayload;
import com.portfolio.entity.Activity;
import com.portfolio.entity.Project;
import com.portfolio.entity.Subtask;
import com.portfolio.entity.Task;
import com.portfolio.exception.ResourceNotFoundException;
import com.portfolio.repository.ActivityRepository;
import com.portfolio.repository.ProjectRepository;
import com.portfolio.repository.SubtaskRepository;
import com.portfolio.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for editing single tasks, subtasks and activity entries of a
 * project without resending the whole aggregate.
 *
 * Each operation runs in its own transaction and returns the re-read project
 * aggregate. Activity edits keep the log sorted by date and recompute the
 * project's {@code lastUpdate}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProjectItemService {

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final SubtaskRepository subtaskRepository;
    private final ActivityRepository activityRepository;
    private final AggregateAssembler assembler;
    private final ProjectAggregateLoader loader;

    /**
     * Append a task to a project's plan.
     *
     * @param projectId the project ID
     * @param payload task content, including its subtasks
     * @return the updated aggregate
     */
    @Transactional
    public Project addTask(String projectId, TaskPayload payload) {
        Project project = findProject(projectId);
        Task task = assembler.newTask(project, payload);
        project.getTasks().add(task);
        log.info("Added task {} to project {}", task.getId(), projectId);
        return loader.reload(projectId);
    }

    /**
     * Overwrite a task. Its subtasks are replaced by the payload's.
     *
     * @param projectId the project ID
     * @param taskId the task ID
     * @param payload task content
     * @return the updated aggregate
     */
    @Transactional
    public Project updateTask(String projectId, String taskId, TaskPayload payload) {
        Task task = findTask(projectId, taskId);
        assembler.applyTask(task, payload);
        log.info("Updated task {} of project {}", taskId, projectId);
        return loader.reload(projectId);
    }

    @Transactional
    public Project deleteTask(String projectId, String taskId) {
        Task task = findTask(projectId, taskId);
        task.getProject().getTasks().remove(task);
        log.info("Deleted task {} from project {}", taskId, projectId);
        return loader.reload(projectId);
    }

    @Transactional
    public Project addSubtask(String projectId, String taskId, SubtaskPayload payload) {
        Task task = findTask(projectId, taskId);
        Subtask subtask = assembler.newSubtask(task, payload);
        task.getSubtasks().add(subtask);
        log.info("Added subtask {} to task {} of project {}", subtask.getId(), taskId, projectId);
        return loader.reload(projectId);
    }

    @Transactional
    public Project updateSubtask(String projectId, String taskId, String subtaskId, SubtaskPayload payload) {
        Subtask subtask = findSubtask(projectId, taskId, subtaskId);
        assembler.applySubtask(subtask, payload);
        log.info("Updated subtask {} of task {}", subtaskId, taskId);
        return loader.reload(projectId);
    }

    @Transactional
    public Project deleteSubtask(String projectId, String taskId, String subtaskId) {
        Subtask subtask = findSubtask(projectId, taskId, subtaskId);
        subtask.getTask().getSubtasks().remove(subtask);
        log.info("Deleted subtask {} from task {}", subtaskId, taskId);
        return loader.reload(projectId);
    }

    /**
     * Add an activity entry at its chronological position.
     *
     * @param projectId the project ID
     * @param payload entry content
     * @return the updated aggregate
     */
    @Transactional
    public Project addActivity(String projectId, ActivityPayload payload) {
        Project project = findProject(projectId);
        Activity activity = assembler.newActivity(project, payload);

        List<Activity> activities = project.getActivities();
        int position = activities.size();
        while (position > 0 && activities.get(position - 1).getDate().compareTo(activity.getDate()) > 0) {
            position--;
        }
        activities.add(position, activity);
        project.setLastUpdate(AggregateAssembler.deriveLastUpdate(activities));

        log.info("Added activity {} to project {}", activity.getId(), projectId);
        return loader.reload(projectId);
    }

    @Transactional
    public Project updateActivity(String projectId, String activityId, ActivityPayload payload) {
        Activity activity = findActivity(projectId, activityId);
        Project project = activity.getProject();
        assembler.applyActivity(activity, payload);
        AggregateAssembler.sortByDate(project.getActivities());
        project.setLastUpdate(AggregateAssembler.deriveLastUpdate(project.getActivities()));

        log.info("Updated activity {} of project {}", activityId, projectId);
        return loader.reload(projectId);
    }

    @Transactional
    public Project deleteActivity(String projectId, String activityId) {
        Activity activity = findActivity(projectId, activityId);
        Project project = activity.getProject();
        project.getActivities().remove(activity);
        project.setLastUpdate(AggregateAssembler.deriveLastUpdate(project.getActivities()));

        log.info("Deleted activity {} from project {}", activityId, projectId);
        return loader.reload(projectId);
    }

    private Project findProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> ResourceNotFoundException.project(projectId));
    }

    private Task findTask(String projectId, String taskId) {
        findProject(projectId);
        return taskRepository.findByIdAndProjectId(taskId, projectId)
                .orElseThrow(() -> ResourceNotFoundException.task(taskId));
    }

    private Subtask findSubtask(String projectId, String taskId, String subtaskId) {
        findTask(projectId, taskId);
        return subtaskRepository.findByIdAndTaskId(subtaskId, taskId)
                .orElseThrow(() -> ResourceNotFoundException.subtask(subtaskId));
    }

    private Activity findActivity(String projectId, String activityId) {
        findProject(projectId);
        return activityRepository.findByIdAndProjectId(activityId, projectId)
                .orElseThrow(() -> ResourceNotFoundException.activity(activityId));
    }
}
