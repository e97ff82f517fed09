package com.portfolio.migration;

import com.portfolio.entity.Person;
import com.portfolio.entity.Project;
import com.portfolio.repository.PersonRepository;
import com.portfolio.repository.ProjectRepository;
import com.portfolio.service.PersonConsolidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DedupeConstrainMigration Unit Tests")
class DedupeConstrainMigrationTest {

    @Mock
    private PersonRepository personRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private PersonConsolidator personConsolidator;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private DedupeConstrainMigration migration;

    @Test
    @DisplayName("apply should merge people by name, then by email, before creating the indexes")
    void testApply_MergesPeopleThenIndexes() {
        // Arrange
        Person jamie = new Person("person-1", "Jamie Li", "Design", null);
        Person jamieAgain = new Person("person-2", " JAMIE LI ", "", null);
        Person sam = new Person("person-3", "Sam", "", "sam@example.com");
        Person samuel = new Person("person-4", "Samuel", "Ops", "sam@example.com");
        when(personRepository.findAllByOrderByCreatedAtAscIdAsc())
                .thenReturn(Arrays.asList(jamie, jamieAgain, sam, samuel))
                .thenReturn(Arrays.asList(jamie, sam, samuel));
        when(personConsolidator.merge(jamie, jamieAgain)).thenReturn(jamie);
        when(personConsolidator.merge(sam, samuel)).thenReturn(sam);

        // Act
        migration.apply();

        // Assert
        InOrder inOrder = inOrder(personConsolidator, jdbcTemplate);
        inOrder.verify(personConsolidator).merge(jamie, jamieAgain);
        inOrder.verify(personConsolidator).merge(sam, samuel);
        inOrder.verify(jdbcTemplate, times(3)).execute(anyString());
        DedupeConstrainMigration.UNIQUE_INDEXES.forEach(sql -> verify(jdbcTemplate).execute(sql));
    }

    @Test
    @DisplayName("apply should rename later projects that share a name")
    void testApply_RenamesDuplicateProjects() {
        // Arrange
        Project apollo = project("project-1", "Apollo");
        Project apolloCopy = project("project-2", "apollo ");
        Project apolloTwo = project("project-3", "Apollo (2)");
        Project apolloAgain = project("project-4", "APOLLO");
        when(projectRepository.findAllByOrderByCreatedAtAscIdAsc())
                .thenReturn(Arrays.asList(apollo, apolloCopy, apolloTwo, apolloAgain));

        // Act
        migration.apply();

        // Assert
        assertEquals("Apollo", apollo.getName());
        assertEquals("apollo (3)", apolloCopy.getName());
        assertEquals("Apollo (2)", apolloTwo.getName());
        assertEquals("APOLLO (4)", apolloAgain.getName());
        verify(personConsolidator, never()).merge(any(Person.class), any(Person.class));
    }

    @Test
    @DisplayName("nextFreeName should skip suffixes already in use")
    void testNextFreeName() {
        assertEquals("Apollo (2)", DedupeConstrainMigration.nextFreeName("Apollo", Set.of("apollo")));
        assertEquals("Apollo (4)", DedupeConstrainMigration.nextFreeName("Apollo",
                Set.of("apollo", "apollo (2)", "apollo (3)")));
    }

    @Test
    @DisplayName("key should be stable")
    void testKey() {
        assertEquals("dedupe-constrain-v1", migration.key());
        assertEquals(List.of("identity-keys-v1", "dedupe-constrain-v1", "people-backfill-v1"),
                List.of(IdentityKeysMigration.KEY, DedupeConstrainMigration.KEY, PeopleBackfillMigration.KEY));
    }

    private static Project project(String id, String name) {
        Project project = new Project(id);
        project.setName(name);
        return project;
    }
}
