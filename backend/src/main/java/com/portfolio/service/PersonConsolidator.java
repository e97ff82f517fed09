package com.portfolio.service;

import com.portfolio.entity.Person;
import com.portfolio.entity.Project;
import com.portfolio.exception.ResourceNotFoundException;
import com.portfolio.repository.ActivityRepository;
import com.portfolio.repository.PersonRepository;
import com.portfolio.repository.ProjectRepository;
import com.portfolio.repository.SubtaskRepository;
import com.portfolio.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Rewrites or removes every reference to a person so the person row can be
 * deleted.
 *
 * Used by deduplication (merge one record into another) and by person deletion
 * (detach, then delete). Task and subtask assignees and activity authors are
 * rewritten with bulk statements, which clear the persistence context: callers
 * must treat previously loaded entities as detached afterwards and use the
 * returned instance.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PersonConsolidator {

    private final PersonRepository personRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final SubtaskRepository subtaskRepository;
    private final ActivityRepository activityRepository;

    /**
     * Merge {@code discarded} into {@code kept}.
     *
     * Every assignee, author and stakeholder reference to the discarded person
     * is pointed at the kept one, the discarded row is deleted, and the kept
     * person's empty team and email are filled from the discarded record.
     *
     * @param kept the surviving person
     * @param discarded the duplicate to remove
     * @return the kept person, managed by the current persistence context
     */
    @Transactional
    public Person merge(Person kept, Person discarded) {
        String keptId = kept.getId();
        String discardedId = discarded.getId();
        if (keptId.equals(discardedId)) {
            return kept;
        }

        String teamToFill = isBlank(kept.getTeam()) && !isBlank(discarded.getTeam()) ? discarded.getTeam() : null;
        String emailToFill = isBlank(kept.getEmail()) && !isBlank(discarded.getEmail()) ? discarded.getEmail() : null;

        int links = relinkStakeholder(discardedId, keptId);
        int tasks = taskRepository.reassignAssignee(discardedId, keptId);
        int subtasks = subtaskRepository.reassignAssignee(discardedId, keptId);
        int activities = activityRepository.reassignAuthor(discardedId, keptId, kept.getName());

        personRepository.deleteById(discardedId);
        personRepository.flush();

        Person survivor = personRepository.findById(keptId)
                .orElseThrow(() -> ResourceNotFoundException.person(keptId));
        boolean changed = false;
        if (teamToFill != null) {
            survivor.setTeam(teamToFill);
            changed = true;
        }
        if (emailToFill != null && !personRepository.existsByEmailKeyAndIdNot(emailToFill, keptId)) {
            survivor.setEmail(emailToFill);
            changed = true;
        }
        if (changed) {
            survivor = personRepository.saveAndFlush(survivor);
        }

        log.info("Merged person {} into {}: {} stakeholder links, {} tasks, {} subtasks, {} activity entries",
                discardedId, keptId, links, tasks, subtasks, activities);
        return survivor;
    }

    /**
     * Clear every reference to a person and delete it.
     *
     * Assignments and activity authorship become empty; activity entries keep
     * their author display name.
     *
     * @param person the person to delete
     */
    @Transactional
    public void detachAndDelete(Person person) {
        String personId = person.getId();

        int links = relinkStakeholder(personId, null);
        int tasks = taskRepository.clearAssignee(personId);
        int subtasks = subtaskRepository.clearAssignee(personId);
        int activities = activityRepository.clearAuthor(personId);

        personRepository.deleteById(personId);
        personRepository.flush();

        log.info("Deleted person {}: unlinked from {} projects, {} tasks, {} subtasks, {} activity entries",
                personId, links, tasks, subtasks, activities);
    }

    /**
     * Replace one stakeholder with another in every project listing it, keeping
     * its position; drop it where the replacement is already listed or when no
     * replacement is given.
     */
    private int relinkStakeholder(String fromId, String toId) {
        List<Project> projects = projectRepository.findByStakeholderId(fromId);
        Person replacement = toId != null ? personRepository.getReferenceById(toId) : null;

        for (Project project : projects) {
            List<Person> stakeholders = project.getStakeholders();
            boolean alreadyListed = replacement != null
                    && stakeholders.stream().anyMatch(p -> toId.equals(p.getId()));
            for (int i = 0; i < stakeholders.size(); i++) {
                if (!fromId.equals(stakeholders.get(i).getId())) {
                    continue;
                }
                if (replacement == null || alreadyListed) {
                    stakeholders.remove(i);
                    i--;
                } else {
                    stakeholders.set(i, replacement);
                    alreadyListed = true;
                }
            }
        }
        projectRepository.flush();
        return projects.size();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
