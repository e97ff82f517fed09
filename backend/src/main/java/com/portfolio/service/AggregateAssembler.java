package com.portfolio.service;

import com.portfolio.dto.request.ActivityPayload;
import com.portfolio.dto.request.PersonReference;
import com.portfolio.dto.request.SubtaskPayload;
import com.portfolio.dto.request.TaskContextPayload;
import com.portfolio.dto.request.TaskPayload;
import com.portfolio.entity.Activity;
import com.portfolio.entity.IdentityKeys;
import com.portfolio.entity.Person;
import com.portfolio.entity.Project;
import com.portfolio.entity.Subtask;
import com.portfolio.entity.Task;
import com.portfolio.entity.TaskContext;
import com.portfolio.repository.ActivityRepository;
import com.portfolio.repository.SubtaskRepository;
import com.portfolio.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Applies payload content to the children of a project aggregate.
 *
 * Shared by the full-aggregate upsert and the single-child operations, so a
 * task written either way gets the same defaults, the same assignee
 * resolution and the same subtask reconciliation. Every person reference goes
 * through {@link PersonResolver}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AggregateAssembler {

    private static final Comparator<String> DATE_ORDER = Comparator.nullsLast(Comparator.naturalOrder());

    private final PersonResolver personResolver;
    private final TaskRepository taskRepository;
    private final SubtaskRepository subtaskRepository;
    private final ActivityRepository activityRepository;
    private final IdGenerator idGenerator;

    @Value("${app.activity.unknown-author:Unknown}")
    private String unknownAuthor;

    /**
     * Replace the stakeholder list with the resolved references, in input
     * order, each person at most once. Unresolvable references are skipped.
     *
     * @param project the project to update
     * @param references desired stakeholders, may be null
     */
    public void replaceStakeholders(Project project, List<PersonReference> references) {
        List<Person> desired = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (references != null) {
            for (PersonReference reference : references) {
                Person person = personResolver.resolve(reference);
                if (person != null && seen.add(person.getId())) {
                    desired.add(person);
                }
            }
        }

        List<Person> current = project.getStakeholders();
        for (int i = 0; i < desired.size(); i++) {
            if (i < current.size()) {
                if (!desired.get(i).getId().equals(current.get(i).getId())) {
                    current.set(i, desired.get(i));
                }
            } else {
                current.add(desired.get(i));
            }
        }
        while (current.size() > desired.size()) {
            current.remove(current.size() - 1);
        }
    }

    /**
     * Reconcile a project's task plan with the payload.
     *
     * @param project the project to update
     * @param payloads desired tasks in order, may be null
     * @return reconciliation counts
     */
    public ChildListReconciler.Result replaceTasks(Project project, List<TaskPayload> payloads) {
        return ChildListReconciler.reconcile(project.getTasks(), payloads, new TaskBinding(project));
    }

    /**
     * Reconcile a project's activity log with the payload, ordered by date.
     * Entries with equal dates keep their payload order.
     *
     * @param project the project to update
     * @param payloads desired entries in any order, may be null
     * @return reconciliation counts
     */
    public ChildListReconciler.Result replaceActivities(Project project, List<ActivityPayload> payloads) {
        List<ActivityPayload> sorted = new ArrayList<>();
        if (payloads != null) {
            sorted.addAll(payloads);
            sorted.sort(Comparator.comparing(ActivityPayload::getDate, DATE_ORDER));
        }
        return ChildListReconciler.reconcile(project.getActivities(), sorted, new ActivityBinding(project));
    }

    /**
     * Build a new task for a project, without attaching it.
     *
     * @param project owning project
     * @param payload task content
     * @return the new task
     */
    public Task newTask(Project project, TaskPayload payload) {
        TaskBinding binding = new TaskBinding(project);
        return binding.create(allocateId(payload.getId(), taskRepository::existsById, binding), payload);
    }

    public Subtask newSubtask(Task task, SubtaskPayload payload) {
        SubtaskBinding binding = new SubtaskBinding(task);
        return binding.create(allocateId(payload.getId(), subtaskRepository::existsById, binding), payload);
    }

    public Activity newActivity(Project project, ActivityPayload payload) {
        ActivityBinding binding = new ActivityBinding(project);
        return binding.create(allocateId(payload.getId(), activityRepository::existsById, binding), payload);
    }

    /**
     * Overwrite a task with the payload, replacing its subtasks.
     *
     * @param task the task to update
     * @param payload task content
     */
    public void applyTask(Task task, TaskPayload payload) {
        task.setTitle(requireText(payload.getTitle(), "Task title"));
        task.setStatus(valueOrDefault(payload.getStatus(), "todo"));
        task.setDueDate(IdentityKeys.trimToNull(payload.getDueDate()));
        task.setCompletedDate(IdentityKeys.trimToNull(payload.getCompletedDate()));
        task.setAssignee(resolveAssignee(payload.getAssignee(), payload.getAssigneeId()));

        ChildListReconciler.Result subtasks =
                ChildListReconciler.reconcile(task.getSubtasks(), payload.getSubtasks(), new SubtaskBinding(task));
        log.debug("Task {} subtasks reconciled: {}", task.getId(), subtasks);
    }

    public void applySubtask(Subtask subtask, SubtaskPayload payload) {
        subtask.setTitle(requireText(payload.getTitle(), "Subtask title"));
        subtask.setStatus(valueOrDefault(payload.getStatus(), "todo"));
        subtask.setDueDate(IdentityKeys.trimToNull(payload.getDueDate()));
        subtask.setCompletedDate(IdentityKeys.trimToNull(payload.getCompletedDate()));
        subtask.setAssignee(resolveAssignee(payload.getAssignee(), payload.getAssigneeId()));
    }

    /**
     * Overwrite an activity entry with the payload and resolve its author.
     * A resolved author's canonical name replaces the payload's author text.
     * The unknown-author placeholder, sent back without an id or email, is
     * kept as text and never resolved to a person.
     *
     * @param activity the entry to update
     * @param payload entry content
     */
    public void applyActivity(Activity activity, ActivityPayload payload) {
        activity.setDate(requireText(payload.getDate(), "Activity date"));
        activity.setNote(requireText(payload.getNote(), "Activity note"));

        Person author = isUnknownAuthor(payload) ? null : personResolver.resolve(PersonReference.byFields(
                payload.getAuthorId(), payload.getAuthor(), null, payload.getAuthorEmail()));
        activity.setAuthorPerson(author);
        if (author != null) {
            activity.setAuthor(author.getName());
        } else {
            String text = IdentityKeys.trimToNull(payload.getAuthor());
            activity.setAuthor(text != null ? text : unknownAuthor);
        }

        TaskContextPayload context = payload.getTaskContext();
        activity.setTaskContext(context == null ? null : new TaskContext(
                context.getTaskId(), context.getSubtaskId(), context.getTaskTitle(), context.getSubtaskTitle()));
    }

    /**
     * Stable-sort a managed activity list by date.
     *
     * @param activities the list to reorder in place
     */
    public static void sortByDate(List<Activity> activities) {
        List<Activity> sorted = new ArrayList<>(activities);
        sorted.sort(Comparator.comparing(Activity::getDate, DATE_ORDER));
        for (int i = 0; i < sorted.size(); i++) {
            if (activities.get(i) != sorted.get(i)) {
                activities.set(i, sorted.get(i));
            }
        }
    }

    /**
     * The note of the entry with the greatest date; the earliest such entry
     * on ties.
     *
     * @param activities the activity log
     * @return the derived last update, or null for an empty log
     */
    public static String deriveLastUpdate(List<Activity> activities) {
        Activity latest = null;
        for (Activity activity : activities) {
            if (activity.getDate() == null) {
                continue;
            }
            if (latest == null || activity.getDate().compareTo(latest.getDate()) > 0) {
                latest = activity;
            }
        }
        return latest != null ? latest.getNote() : null;
    }

    private boolean isUnknownAuthor(ActivityPayload payload) {
        String text = IdentityKeys.trimToNull(payload.getAuthor());
        return text != null && text.equalsIgnoreCase(unknownAuthor)
                && IdentityKeys.trimToNull(payload.getAuthorId()) == null
                && IdentityKeys.trimToNull(payload.getAuthorEmail()) == null;
    }

    private Person resolveAssignee(PersonReference assignee, String assigneeId) {
        if (assignee != null) {
            return personResolver.resolve(assignee);
        }
        if (IdentityKeys.trimToNull(assigneeId) != null) {
            return personResolver.resolve(PersonReference.byFields(assigneeId, null, null, null));
        }
        return null;
    }

    private <E, P> String allocateId(String requestedId, Predicate<String> taken,
                                     ChildListReconciler.Binding<E, P> binding) {
        String id = IdentityKeys.trimToNull(requestedId);
        if (id == null || taken.test(id)) {
            return binding.newId();
        }
        return id;
    }

    private static String requireText(String value, String field) {
        String trimmed = IdentityKeys.trimToNull(value);
        if (trimmed == null) {
            throw new IllegalArgumentException(field + " cannot be null or empty");
        }
        return trimmed;
    }

    private static String valueOrDefault(String value, String fallback) {
        String trimmed = IdentityKeys.trimToNull(value);
        return trimmed != null ? trimmed : fallback;
    }

    @RequiredArgsConstructor
    private class TaskBinding implements ChildListReconciler.Binding<Task, TaskPayload> {
        private final Project project;

        @Override
        public String entityId(Task entity) {
            return entity.getId();
        }

        @Override
        public String payloadId(TaskPayload payload) {
            return payload.getId();
        }

        @Override
        public boolean isOwnedElsewhere(String id) {
            return taskRepository.existsByIdAndProjectIdNot(id, project.getId());
        }

        @Override
        public String newId() {
            return idGenerator.newId("task");
        }

        @Override
        public Task create(String id, TaskPayload payload) {
            Task task = new Task(id, project);
            applyTask(task, payload);
            return task;
        }

        @Override
        public void update(Task entity, TaskPayload payload) {
            applyTask(entity, payload);
        }
    }

    @RequiredArgsConstructor
    private class SubtaskBinding implements ChildListReconciler.Binding<Subtask, SubtaskPayload> {
        private final Task task;

        @Override
        public String entityId(Subtask entity) {
            return entity.getId();
        }

        @Override
        public String payloadId(SubtaskPayload payload) {
            return payload.getId();
        }

        @Override
        public boolean isOwnedElsewhere(String id) {
            return subtaskRepository.existsByIdAndTaskIdNot(id, task.getId());
        }

        @Override
        public String newId() {
            return idGenerator.newId("subtask");
        }

        @Override
        public Subtask create(String id, SubtaskPayload payload) {
            Subtask subtask = new Subtask(id, task);
            applySubtask(subtask, payload);
            return subtask;
        }

        @Override
        public void update(Subtask entity, SubtaskPayload payload) {
            applySubtask(entity, payload);
        }
    }

    @RequiredArgsConstructor
    private class ActivityBinding implements ChildListReconciler.Binding<Activity, ActivityPayload> {
        private final Project project;

        @Override
        public String entityId(Activity entity) {
            return entity.getId();
        }

        @Override
        public String payloadId(ActivityPayload payload) {
            return payload.getId();
        }

        @Override
        public boolean isOwnedElsewhere(String id) {
            return activityRepository.existsByIdAndProjectIdNot(id, project.getId());
        }

        @Override
        public String newId() {
            return idGenerator.newId("activity");
        }

        @Override
        public Activity create(String id, ActivityPayload payload) {
            Activity activity = new Activity(id, project);
            applyActivity(activity, payload);
            return activity;
        }

        @Override
        public void update(Activity entity, ActivityPayload payload) {
            applyActivity(entity, payload);
        }
    }
}
