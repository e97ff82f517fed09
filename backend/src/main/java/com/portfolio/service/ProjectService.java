package com.portfolio.service;

import com.portfolio.dto.request.ProjectPayload;
import com.portfolio.entity.IdentityKeys;
import com.portfolio.entity.Project;
import com.portfolio.exception.NameConflictException;
import com.portfolio.exception.ResourceNotFoundException;
import com.portfolio.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for writing and reading whole project aggregates.
 *
 * An upsert makes the stored aggregate equal to the payload:
 *
 * 1. Validation, before anything is touched:
 *    - the name must not be blank
 *    - no other project may use the same name, ignoring case
 *
 * 2. Scalars are applied to the project found by id, or to a new project
 *    created under the supplied id or a fresh one.
 *
 * 3. Children are rebuilt from the payload:
 *    - stakeholders: each reference resolved, one entry per person
 *    - tasks and their subtasks: matched by id, updated in place, missing ones removed
 *    - activity entries: sorted by date, matched by id, authors resolved
 *
 * 4. {@code lastUpdate} is derived from the newest activity entry.
 *
 * All of it runs in one transaction; the aggregate is then re-read from the
 * store and returned fully initialized.
 *
 * @see AggregateAssembler
 * @see PersonResolver
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProjectService {

    private static final String IMPORT_REPLACE = "replace";
    private static final String IMPORT_MERGE = "merge";

    private final ProjectRepository projectRepository;
    private final AggregateAssembler assembler;
    private final ProjectAggregateLoader loader;
    private final IdGenerator idGenerator;

    /**
     * Create or fully replace a project aggregate.
     *
     * @param payload desired aggregate state
     * @return the stored aggregate
     * @throws IllegalArgumentException if the name is blank
     * @throws NameConflictException if another project already uses the name
     */
    @Transactional
    public Project upsertProject(ProjectPayload payload) {
        String name = IdentityKeys.trimToNull(payload.getName());
        if (name == null) {
            log.warn("Rejected project upsert without a name");
            throw new IllegalArgumentException("Project name cannot be null or empty");
        }

        String requestedId = IdentityKeys.trimToNull(payload.getId());
        String nameKey = IdentityKeys.normalize(name);
        boolean nameTaken = requestedId == null
                ? projectRepository.existsByNameKey(nameKey)
                : projectRepository.existsByNameKeyAndIdNot(nameKey, requestedId);
        if (nameTaken) {
            log.warn("Rejected project upsert: name '{}' already used by another project", name);
            throw NameConflictException.forProject(name);
        }

        Project project = requestedId != null ? projectRepository.findById(requestedId).orElse(null) : null;
        boolean created = project == null;
        if (created) {
            project = new Project(requestedId != null ? requestedId : idGenerator.newId("project"));
        }

        applyScalars(project, payload, name);
        assembler.replaceStakeholders(project, payload.getStakeholders());
        ChildListReconciler.Result tasks = assembler.replaceTasks(project, payload.getTasks());
        ChildListReconciler.Result activities = assembler.replaceActivities(project, payload.getActivities());
        project.setLastUpdate(AggregateAssembler.deriveLastUpdate(project.getActivities()));

        if (created) {
            project = projectRepository.save(project);
        }

        log.info("{} project {} ('{}'): {} stakeholders, tasks [{}], activities [{}]",
                created ? "Created" : "Updated", project.getId(), name,
                project.getStakeholders().size(), tasks, activities);

        return loader.reload(project.getId());
    }

    /**
     * Get a single project aggregate.
     *
     * @param projectId the project ID
     * @return the initialized aggregate
     * @throws ResourceNotFoundException if the project does not exist
     */
    @Transactional(readOnly = true)
    public Project getProject(String projectId) {
        return loader.load(projectId);
    }

    /**
     * List every project aggregate in creation order.
     *
     * @return initialized aggregates
     */
    @Transactional(readOnly = true)
    public List<Project> listProjects() {
        List<Project> projects = projectRepository.findAllByOrderByCreatedAtAscIdAsc();
        projects.forEach(loader::initialize);
        return projects;
    }

    /**
     * Delete a project with its tasks, subtasks, activity entries and
     * stakeholder links.
     *
     * @param projectId the project ID
     * @throws ResourceNotFoundException if the project does not exist
     */
    @Transactional
    public void deleteProject(String projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> ResourceNotFoundException.project(projectId));
        projectRepository.delete(project);
        log.info("Deleted project {} ('{}')", projectId, project.getName());
    }

    /**
     * Load many project aggregates at once, in one transaction.
     *
     * <ul>
     *   <li>{@code replace}: every existing project is deleted first</li>
     *   <li>{@code merge}: a project whose id is already stored is deleted and
     *       written again from its payload; other projects are kept</li>
     * </ul>
     * Each payload then goes through {@link #upsertProject}. People are never
     * deleted. Any failure rolls back the whole import.
     *
     * @param projects aggregates to load, in order
     * @param mode {@code replace} or {@code merge}, case-insensitive
     * @return every project after the import
     * @throws IllegalArgumentException if the mode is unknown or a payload is invalid
     * @throws NameConflictException if two projects would end up with the same name
     */
    @Transactional
    public List<Project> importPortfolio(List<ProjectPayload> projects, String mode) {
        String normalizedMode = IdentityKeys.normalize(mode);
        if (!IMPORT_REPLACE.equals(normalizedMode) && !IMPORT_MERGE.equals(normalizedMode)) {
            throw new IllegalArgumentException("Invalid import mode: " + mode);
        }
        List<ProjectPayload> payloads = projects != null ? projects : List.of();

        if (IMPORT_REPLACE.equals(normalizedMode)) {
            List<Project> existing = projectRepository.findAll();
            projectRepository.deleteAll(existing);
            projectRepository.flush();
            log.info("Import replacing portfolio: deleted {} projects", existing.size());
        }

        int replaced = 0;
        for (ProjectPayload payload : payloads) {
            String id = IdentityKeys.trimToNull(payload.getId());
            if (IMPORT_MERGE.equals(normalizedMode) && id != null) {
                Project current = projectRepository.findById(id).orElse(null);
                if (current != null) {
                    projectRepository.delete(current);
                    projectRepository.flush();
                    replaced++;
                }
            }
            upsertProject(payload);
        }

        log.info("Imported {} projects in {} mode ({} replaced by id)", payloads.size(), normalizedMode, replaced);
        return listProjects();
    }

    private void applyScalars(Project project, ProjectPayload payload, String name) {
        project.setName(name);
        project.setStatus(valueOrDefault(payload.getStatus(), "planning"));
        project.setPriority(valueOrDefault(payload.getPriority(), "medium"));
        project.setProgress(payload.getProgress() != null ? payload.getProgress() : 0);
        project.setDescription(payload.getDescription() != null ? payload.getDescription() : "");
        project.setExecutiveUpdate(payload.getExecutiveUpdate() != null ? payload.getExecutiveUpdate() : "");
        project.setStartDate(IdentityKeys.trimToNull(payload.getStartDate()));
        project.setTargetDate(IdentityKeys.trimToNull(payload.getTargetDate()));
    }

    private static String valueOrDefault(String value, String fallback) {
        String trimmed = IdentityKeys.trimToNull(value);
        return trimmed != null ? trimmed : fallback;
    }
}
