package com.portfolio.service;

import com.portfolio.dto.request.ActivityPayload;
import com.portfolio.dto.request.PersonReference;
import com.portfolio.dto.request.ProjectPayload;
import com.portfolio.dto.request.SubtaskPayload;
import com.portfolio.dto.request.TaskPayload;
import com.portfolio.entity.Activity;
import com.portfolio.entity.Person;
import com.portfolio.entity.Project;
import com.portfolio.entity.Subtask;
import com.portfolio.entity.Task;
import com.portfolio.exception.NameConflictException;
import com.portfolio.exception.ResourceNotFoundException;
import com.portfolio.repository.ActivityRepository;
import com.portfolio.repository.ProjectRepository;
import com.portfolio.repository.SubtaskRepository;
import com.portfolio.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProjectService.
 *
 * Runs the real AggregateAssembler against mocked repositories and a mocked
 * PersonResolver, and inspects the aggregate handed to the repository.
 *
 * Covers:
 * - validation before any mutation
 * - replace-children semantics for tasks and subtasks
 * - activity ordering, author resolution and lastUpdate derivation
 * - stakeholder resolution and deduplication
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProjectService Unit Tests")
class ProjectServiceTest {

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private SubtaskRepository subtaskRepository;

    @Mock
    private ActivityRepository activityRepository;

    @Mock
    private PersonResolver personResolver;

    @Mock
    private ProjectAggregateLoader loader;

    private AggregateAssembler assembler;

    private ProjectService projectService;

    @BeforeEach
    void setUp() {
        IdGenerator idGenerator = new IdGenerator();
        assembler = new AggregateAssembler(
                personResolver, taskRepository, subtaskRepository, activityRepository, idGenerator);
        ReflectionTestUtils.setField(assembler, "unknownAuthor", "Unknown");
        projectService = new ProjectService(projectRepository, assembler, loader, idGenerator);
    }

    @Test
    @DisplayName("upsertProject should derive lastUpdate from the newest activity entry")
    void testUpsertProject_LastUpdate() {
        // Arrange
        ProjectPayload payload = ProjectPayload.builder()
                .name("Apollo")
                .activities(Arrays.asList(
                        activity("2025-01-01", "A"),
                        activity("2025-03-01", "B"),
                        activity("2025-02-01", "C")))
                .build();
        stubSave();

        // Act
        projectService.upsertProject(payload);

        // Assert
        Project saved = captureSaved();
        assertEquals("B", saved.getLastUpdate());
        assertEquals(List.of("A", "C", "B"), notes(saved.getActivities()));
        assertEquals("Unknown", saved.getActivities().get(0).getAuthor());
        verify(loader).reload(saved.getId());
    }

    @Test
    @DisplayName("upsertProject should apply defaults to a new project")
    void testUpsertProject_Defaults() {
        // Arrange
        stubSave();

        // Act
        projectService.upsertProject(ProjectPayload.builder().id("project-42").name("  Apollo ").build());

        // Assert
        Project saved = captureSaved();
        assertEquals("project-42", saved.getId());
        assertEquals("Apollo", saved.getName());
        assertEquals("planning", saved.getStatus());
        assertEquals("medium", saved.getPriority());
        assertEquals(0, saved.getProgress());
        assertEquals("", saved.getDescription());
        assertNull(saved.getLastUpdate());
    }

    @Test
    @DisplayName("upsertProject should reject a blank name")
    void testUpsertProject_BlankName() {
        // Act & Assert
        assertThrows(IllegalArgumentException.class,
                () -> projectService.upsertProject(ProjectPayload.builder().name("   ").build()));
        verifyNoInteractions(projectRepository, personResolver, loader);
    }

    @Test
    @DisplayName("upsertProject should reject a name used by another project before touching anything")
    void testUpsertProject_NameConflict() {
        // Arrange
        when(projectRepository.existsByNameKeyAndIdNot("apollo", "project-2")).thenReturn(true);
        ProjectPayload payload = ProjectPayload.builder()
                .id("project-2")
                .name("APOLLO")
                .stakeholders(List.of(PersonReference.named("Sarah Chen")))
                .build();

        // Act & Assert
        NameConflictException ex = assertThrows(NameConflictException.class,
                () -> projectService.upsertProject(payload));
        assertEquals("project", ex.getResourceType());
        verify(projectRepository, never()).findById(anyString());
        verify(projectRepository, never()).save(any(Project.class));
        verifyNoInteractions(personResolver);
    }

    @Test
    @DisplayName("upsertProject should drop tasks and subtasks missing from the payload")
    void testUpsertProject_ReplacesTasks() {
        // Arrange
        Project existing = new Project("project-1");
        existing.setName("Apollo");
        Task kept = new Task("task-kept", existing);
        kept.setTitle("Design");
        kept.getSubtasks().add(new Subtask("subtask-old", kept));
        Task dropped = new Task("task-dropped", existing);
        dropped.setTitle("Obsolete");
        existing.getTasks().addAll(Arrays.asList(dropped, kept));
        when(projectRepository.findById("project-1")).thenReturn(Optional.of(existing));

        ProjectPayload payload = ProjectPayload.builder()
                .id("project-1")
                .name("Apollo")
                .tasks(Arrays.asList(
                        TaskPayload.builder().id("task-kept").title("Design v2").status("in-progress")
                                .subtasks(List.of(SubtaskPayload.builder().title("Review").build()))
                                .build(),
                        TaskPayload.builder().title("Launch").build()))
                .build();

        // Act
        projectService.upsertProject(payload);

        // Assert
        List<Task> tasks = existing.getTasks();
        assertEquals(2, tasks.size());
        assertSame(kept, tasks.get(0));
        assertEquals("Design v2", kept.getTitle());
        assertEquals("in-progress", kept.getStatus());
        assertEquals(1, kept.getSubtasks().size());
        assertEquals("Review", kept.getSubtasks().get(0).getTitle());
        assertNotEquals("subtask-old", kept.getSubtasks().get(0).getId());
        assertEquals("Launch", tasks.get(1).getTitle());
        assertEquals("todo", tasks.get(1).getStatus());
        assertFalse(tasks.contains(dropped));
        verify(projectRepository, never()).save(any(Project.class));
        verify(loader).reload("project-1");
    }

    @Test
    @DisplayName("upsertProject should list each resolved stakeholder once, in input order")
    void testUpsertProject_DeduplicatesStakeholders() {
        // Arrange
        Person sarah = new Person("person-sarah", "Sarah Chen", "Design", null);
        Person bob = new Person("person-bob", "Bob", "Platform", null);
        when(personResolver.resolve(any(PersonReference.class))).thenReturn(sarah, sarah, null, bob);
        stubSave();

        ProjectPayload payload = ProjectPayload.builder()
                .name("Apollo")
                .stakeholders(Arrays.asList(
                        PersonReference.named("Sarah Chen"),
                        PersonReference.byFields(null, "sarah chen", null, null),
                        PersonReference.byFields(null, null, "Nobody", null),
                        PersonReference.named("Bob")))
                .build();

        // Act
        projectService.upsertProject(payload);

        // Assert
        assertEquals(List.of(sarah, bob), captureSaved().getStakeholders());
    }

    @Test
    @DisplayName("upsertProject should store the canonical name of a resolved activity author")
    void testUpsertProject_ResolvesAuthorsAndAssignees() {
        // Arrange
        Person sarah = new Person("person-sarah", "Sarah Chen", "Design", null);
        when(personResolver.resolve(any(PersonReference.class))).thenAnswer(inv -> {
            PersonReference reference = inv.getArgument(0);
            return "sarah chen".equals(reference.toFields().getNameKey()) ? sarah : null;
        });
        stubSave();

        ActivityPayload entry = activity("2025-04-01", "Kickoff");
        entry.setAuthor("SARAH CHEN");
        ProjectPayload payload = ProjectPayload.builder()
                .name("Apollo")
                .tasks(List.of(TaskPayload.builder().title("Plan")
                        .assignee(PersonReference.named("Sarah Chen")).build()))
                .activities(List.of(entry))
                .build();

        // Act
        projectService.upsertProject(payload);

        // Assert
        Project saved = captureSaved();
        Activity activity = saved.getActivities().get(0);
        assertEquals("Sarah Chen", activity.getAuthor());
        assertSame(sarah, activity.getAuthorPerson());
        assertSame(sarah, saved.getTasks().get(0).getAssignee());
        assertEquals("Kickoff", saved.getLastUpdate());
    }

    @Test
    @DisplayName("upsertProject should keep the unknown-author placeholder as text when it is sent back")
    void testUpsertProject_UnknownAuthorRoundTrip() {
        // Arrange
        stubSave();
        projectService.upsertProject(ProjectPayload.builder()
                .name("Apollo")
                .activities(List.of(activity("2025-01-01", "A")))
                .build());
        Activity stored = captureSaved().getActivities().get(0);

        ActivityPayload echoed = activity(stored.getDate(), stored.getNote());
        echoed.setId(stored.getId());
        echoed.setAuthor(stored.getAuthor());
        Activity target = new Activity(stored.getId(), stored.getProject());

        // Act
        assembler.applyActivity(target, echoed);

        // Assert
        assertEquals("Unknown", stored.getAuthor());
        assertEquals("Unknown", target.getAuthor());
        assertNull(target.getAuthorPerson());
        verify(personResolver, never()).resolve(argThat(reference ->
                reference != null && "unknown".equals(reference.toFields().getNameKey())));
    }

    @Test
    @DisplayName("applyActivity should resolve a placeholder author that carries an email")
    void testApplyActivity_PlaceholderWithEmail() {
        // Arrange
        Person unknown = new Person("person-u", "Unknown", "Contributor", "unknown@example.com");
        when(personResolver.resolve(any(PersonReference.class))).thenReturn(unknown);
        ActivityPayload payload = activity("2025-01-01", "A");
        payload.setAuthor("unknown");
        payload.setAuthorEmail("unknown@example.com");
        Activity target = new Activity("activity-1", new Project("project-1"));

        // Act
        assembler.applyActivity(target, payload);

        // Assert
        assertSame(unknown, target.getAuthorPerson());
    }

    @Test
    @DisplayName("importPortfolio in replace mode should delete every project before loading")
    void testImportPortfolio_Replace() {
        // Arrange
        Project old1 = new Project("project-old1");
        Project old2 = new Project("project-old2");
        List<Project> existing = Arrays.asList(old1, old2);
        when(projectRepository.findAll()).thenReturn(existing);
        when(projectRepository.existsByNameKey("apollo")).thenReturn(false);
        stubSave();
        Project loaded = new Project("project-new");
        when(projectRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of(loaded));

        // Act
        List<Project> result = projectService.importPortfolio(
                List.of(ProjectPayload.builder().name("Apollo").build()), "REPLACE");

        // Assert
        assertEquals(List.of(loaded), result);
        InOrder order = inOrder(projectRepository);
        order.verify(projectRepository).deleteAll(existing);
        order.verify(projectRepository).flush();
        order.verify(projectRepository).save(any(Project.class));
        verify(projectRepository, never()).delete(any(Project.class));
    }

    @Test
    @DisplayName("importPortfolio in merge mode should rewrite only projects whose id is stored")
    void testImportPortfolio_Merge() {
        // Arrange
        Project current = new Project("project-1");
        current.setName("Apollo");
        current.getTasks().add(new Task("task-old", current));
        when(projectRepository.findById("project-1"))
                .thenReturn(Optional.of(current))
                .thenReturn(Optional.empty());
        when(projectRepository.findById("project-2")).thenReturn(Optional.empty());
        stubSave();
        when(projectRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of());

        // Act
        projectService.importPortfolio(Arrays.asList(
                ProjectPayload.builder().id("project-1").name("Apollo").build(),
                ProjectPayload.builder().id("project-2").name("Gemini").build()), "merge");

        // Assert
        verify(projectRepository).delete(current);
        verify(projectRepository, never()).findAll();
        verify(projectRepository, never()).deleteAll(anyList());
        ArgumentCaptor<Project> captor = ArgumentCaptor.forClass(Project.class);
        verify(projectRepository, times(2)).save(captor.capture());
        Project rewritten = captor.getAllValues().get(0);
        assertNotSame(current, rewritten);
        assertEquals("project-1", rewritten.getId());
        assertTrue(rewritten.getTasks().isEmpty());
        assertEquals("project-2", captor.getAllValues().get(1).getId());
    }

    @Test
    @DisplayName("importPortfolio should reject an unknown mode before touching anything")
    void testImportPortfolio_UnknownMode() {
        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> projectService.importPortfolio(
                List.of(ProjectPayload.builder().name("Apollo").build()), "append"));
        verifyNoInteractions(projectRepository, personResolver, loader);
    }

    @Test
    @DisplayName("deleteProject should throw ResourceNotFoundException for an unknown project")
    void testDeleteProject_NotFound() {
        // Arrange
        when(projectRepository.findById("project-x")).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> projectService.deleteProject("project-x"));
        verify(projectRepository, never()).delete(any(Project.class));
    }

    private void stubSave() {
        when(projectRepository.save(any(Project.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Project captureSaved() {
        ArgumentCaptor<Project> captor = ArgumentCaptor.forClass(Project.class);
        verify(projectRepository).save(captor.capture());
        return captor.getValue();
    }

    private static ActivityPayload activity(String date, String note) {
        return ActivityPayload.builder().date(date).note(note).build();
    }

    private static List<String> notes(List<Activity> activities) {
        return activities.stream().map(Activity::getNote).collect(Collectors.toList());
    }
}
