package com.portfolio.service;

import com.portfolio.entity.Person;
import com.portfolio.entity.Project;
import com.portfolio.repository.ActivityRepository;
import com.portfolio.repository.PersonRepository;
import com.portfolio.repository.ProjectRepository;
import com.portfolio.repository.SubtaskRepository;
import com.portfolio.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PersonConsolidator Unit Tests")
class PersonConsolidatorTest {

    @Mock
    private PersonRepository personRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private SubtaskRepository subtaskRepository;

    @Mock
    private ActivityRepository activityRepository;

    @InjectMocks
    private PersonConsolidator personConsolidator;

    private Person kept;
    private Person discarded;
    private Person bob;

    @BeforeEach
    void setUp() {
        kept = new Person("person-kept", "Jamie Li", "", null);
        discarded = new Person("person-dup", "jamie li", "Design", "jamie@example.com");
        bob = new Person("person-bob", "Bob", "Platform", null);
    }

    @Test
    @DisplayName("merge should repoint references, delete the duplicate and fill empty fields")
    void testMerge_Success() {
        // Arrange
        Project project = projectWith(discarded, bob);
        when(projectRepository.findByStakeholderId("person-dup")).thenReturn(List.of(project));
        when(personRepository.getReferenceById("person-kept")).thenReturn(kept);
        when(personRepository.findById("person-kept")).thenReturn(Optional.of(kept));
        when(personRepository.saveAndFlush(any(Person.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        Person survivor = personConsolidator.merge(kept, discarded);

        // Assert
        assertSame(kept, survivor);
        assertEquals("Design", survivor.getTeam());
        assertEquals("jamie@example.com", survivor.getEmail());
        assertEquals(List.of(kept, bob), project.getStakeholders());
        verify(taskRepository).reassignAssignee("person-dup", "person-kept");
        verify(subtaskRepository).reassignAssignee("person-dup", "person-kept");
        verify(activityRepository).reassignAuthor("person-dup", "person-kept", "Jamie Li");
        verify(personRepository).deleteById("person-dup");
    }

    @Test
    @DisplayName("merge should drop the duplicate where the kept person is already a stakeholder")
    void testMerge_AlreadyStakeholder() {
        // Arrange
        Project project = projectWith(kept, discarded);
        when(projectRepository.findByStakeholderId("person-dup")).thenReturn(List.of(project));
        when(personRepository.getReferenceById("person-kept")).thenReturn(kept);
        when(personRepository.findById("person-kept")).thenReturn(Optional.of(kept));
        when(personRepository.saveAndFlush(any(Person.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        personConsolidator.merge(kept, discarded);

        // Assert
        assertEquals(List.of(kept), project.getStakeholders());
    }

    @Test
    @DisplayName("merge should keep the surviving person's own team and email")
    void testMerge_KeepsExistingFields() {
        // Arrange
        kept.setTeam("Platform");
        kept.setEmail("jamie.li@example.com");
        when(personRepository.findById("person-kept")).thenReturn(Optional.of(kept));

        // Act
        Person survivor = personConsolidator.merge(kept, discarded);

        // Assert
        assertEquals("Platform", survivor.getTeam());
        assertEquals("jamie.li@example.com", survivor.getEmail());
        verify(personRepository, never()).saveAndFlush(any(Person.class));
    }

    @Test
    @DisplayName("merge should do nothing when both records are the same person")
    void testMerge_SamePerson() {
        // Act
        Person survivor = personConsolidator.merge(kept, kept);

        // Assert
        assertSame(kept, survivor);
        verifyNoInteractions(personRepository, projectRepository, taskRepository, subtaskRepository,
                activityRepository);
    }

    @Test
    @DisplayName("detachAndDelete should clear every reference and delete the person")
    void testDetachAndDelete() {
        // Arrange
        Project project = projectWith(bob, discarded);
        when(projectRepository.findByStakeholderId("person-dup")).thenReturn(List.of(project));

        // Act
        personConsolidator.detachAndDelete(discarded);

        // Assert
        assertEquals(List.of(bob), project.getStakeholders());
        verify(taskRepository).clearAssignee("person-dup");
        verify(subtaskRepository).clearAssignee("person-dup");
        verify(activityRepository).clearAuthor("person-dup");
        verify(personRepository).deleteById("person-dup");
    }

    private static Project projectWith(Person... stakeholders) {
        Project project = new Project("project-1");
        project.setName("Apollo");
        project.getStakeholders().addAll(Arrays.asList(stakeholders));
        return project;
    }
}
