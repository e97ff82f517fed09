package com.portfolio.service;

import com.portfolio.entity.Activity;
import com.portfolio.entity.Project;
import com.portfolio.entity.Subtask;
import com.portfolio.entity.Task;
import com.portfolio.exception.ResourceNotFoundException;
import com.portfolio.repository.ProjectRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.hibernate.Hibernate;
import org.springframework.stereotype.Component;

/**
 * Loads project aggregates with every child collection and person reference
 * initialized, so they can be mapped after the transaction ends
 * ({@code open-in-view} is off).
 */
@Component
@RequiredArgsConstructor
public class ProjectAggregateLoader {

    private final ProjectRepository projectRepository;
    private final EntityManager entityManager;

    /**
     * @param projectId the project to load
     * @return the fully initialized aggregate
     * @throws ResourceNotFoundException if the project does not exist
     */
    public Project load(String projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> ResourceNotFoundException.project(projectId));
        initialize(project);
        return project;
    }

    /**
     * Flush pending changes, drop the persistence context and load the
     * aggregate again as stored.
     *
     * @param projectId the project to reload
     * @return the fully initialized aggregate
     */
    public Project reload(String projectId) {
        projectRepository.flush();
        entityManager.clear();
        return load(projectId);
    }

    /**
     * Initialize the lazy parts of an already loaded aggregate.
     *
     * @param project the aggregate root
     */
    public void initialize(Project project) {
        Hibernate.initialize(project.getStakeholders());
        for (Task task : project.getTasks()) {
            Hibernate.initialize(task.getAssignee());
            for (Subtask subtask : task.getSubtasks()) {
                Hibernate.initialize(subtask.getAssignee());
            }
        }
        for (Activity activity : project.getActivities()) {
            Hibernate.initialize(activity.getAuthorPerson());
        }
    }
}
