package com.portfolio.migration;

import com.portfolio.entity.IdentityKeys;
import com.portfolio.entity.Person;
import com.portfolio.entity.Project;
import com.portfolio.repository.PersonRepository;
import com.portfolio.repository.ProjectRepository;
import com.portfolio.service.PersonConsolidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Removes duplicate people and project names, then enforces uniqueness with
 * database indexes.
 *
 * People are merged first by name and then by email: within a group the
 * oldest record survives and the others are merged into it. Duplicate project
 * names are kept but renamed {@code "Name (2)"}, {@code "Name (3)"} and so on.
 * The unique indexes are only created once the data satisfies them.
 */
@Component
@Order(2)
@Slf4j
@RequiredArgsConstructor
public class DedupeConstrainMigration implements DataMigration {

    public static final String KEY = "dedupe-constrain-v1";

    static final List<String> UNIQUE_INDEXES = List.of(
            "CREATE UNIQUE INDEX IF NOT EXISTS ux_person_name_key ON person (name_key)",
            "CREATE UNIQUE INDEX IF NOT EXISTS ux_person_email_key ON person (email_key)",
            "CREATE UNIQUE INDEX IF NOT EXISTS ux_project_name_key ON project (name_key)"
    );

    private final PersonRepository personRepository;
    private final ProjectRepository projectRepository;
    private final PersonConsolidator personConsolidator;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public void apply() {
        int byName = mergePeople(person -> IdentityKeys.normalize(person.getName()));
        int byEmail = mergePeople(person -> IdentityKeys.normalize(person.getEmail()));
        int renamed = renameDuplicateProjects();

        UNIQUE_INDEXES.forEach(jdbcTemplate::execute);

        log.info("Deduplicated identities: {} people merged by name, {} by email, {} projects renamed",
                byName, byEmail, renamed);
    }

    private int mergePeople(Function<Person, String> keyOf) {
        List<Person> people = personRepository.findAllByOrderByCreatedAtAscIdAsc();
        Map<String, Person> firstByKey = new HashMap<>();
        int merged = 0;

        for (Person person : people) {
            String key = keyOf.apply(person);
            if (key == null) {
                continue;
            }
            Person first = firstByKey.get(key);
            if (first == null) {
                firstByKey.put(key, person);
            } else {
                firstByKey.put(key, personConsolidator.merge(first, person));
                merged++;
            }
        }
        return merged;
    }

    private int renameDuplicateProjects() {
        List<Project> projects = projectRepository.findAllByOrderByCreatedAtAscIdAsc();
        Set<String> usedKeys = new HashSet<>();
        projects.forEach(project -> usedKeys.add(IdentityKeys.normalize(project.getName())));

        Set<String> seen = new HashSet<>();
        int renamed = 0;
        for (Project project : projects) {
            String key = IdentityKeys.normalize(project.getName());
            if (seen.add(key)) {
                continue;
            }
            String newName = nextFreeName(project.getName().trim(), usedKeys);
            log.info("Renaming duplicate project {} from '{}' to '{}'", project.getId(), project.getName(), newName);
            project.setName(newName);
            usedKeys.add(IdentityKeys.normalize(newName));
            seen.add(IdentityKeys.normalize(newName));
            renamed++;
        }
        projectRepository.flush();
        return renamed;
    }

    static String nextFreeName(String baseName, Set<String> usedKeys) {
        int suffix = 2;
        String candidate = baseName + " (" + suffix + ")";
        while (usedKeys.contains(IdentityKeys.normalize(candidate))) {
            suffix++;
            candidate = baseName + " (" + suffix + ")";
        }
        return candidate;
    }
}
