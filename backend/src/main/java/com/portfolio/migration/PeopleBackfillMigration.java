package com.portfolio.migration;

import com.portfolio.dto.request.PersonReference;
import com.portfolio.entity.Activity;
import com.portfolio.entity.Person;
import com.portfolio.entity.Project;
import com.portfolio.repository.ActivityRepository;
import com.portfolio.repository.ProjectRepository;
import com.portfolio.service.PersonResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Links historical data to person records.
 *
 * 1. Each project's embedded stakeholder JSON is resolved entry by entry; new
 *    stakeholders are appended to the project and the JSON column is cleared.
 * 2. Each activity entry with an author name but no author link is linked to
 *    the resolved person and takes its canonical name. The placeholder shown
 *    for entries without an author is left alone.
 *
 * Both steps only select rows that still need work, so running the migration
 * again after a partial failure picks up where it stopped.
 */
@Component
@Order(3)
@Slf4j
@RequiredArgsConstructor
public class PeopleBackfillMigration implements DataMigration {

    public static final String KEY = "people-backfill-v1";

    private final ProjectRepository projectRepository;
    private final ActivityRepository activityRepository;
    private final PersonResolver personResolver;
    private final LegacyStakeholderParser parser;

    @Value("${app.activity.unknown-author:Unknown}")
    private String unknownAuthor;

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public void apply() {
        int linked = backfillStakeholders();
        int authors = backfillActivityAuthors();
        log.info("People backfill: {} stakeholder links added, {} activity authors linked", linked, authors);
    }

    private int backfillStakeholders() {
        List<Project> projects = projectRepository.findByLegacyStakeholdersIsNotNullOrderByCreatedAtAscIdAsc();
        int linked = 0;

        for (Project project : projects) {
            List<PersonReference> references = parser.parse(project.getLegacyStakeholders());
            Set<String> present = new HashSet<>();
            project.getStakeholders().forEach(person -> present.add(person.getId()));

            for (PersonReference reference : references) {
                Person person = personResolver.resolve(reference);
                if (person != null && present.add(person.getId())) {
                    project.getStakeholders().add(person);
                    linked++;
                }
            }
            project.setLegacyStakeholders(null);
            log.debug("Project {}: {} legacy stakeholder entries processed", project.getId(), references.size());
        }

        projectRepository.flush();
        return linked;
    }

    private int backfillActivityAuthors() {
        List<Activity> activities = activityRepository.findUnlinkedAuthored();
        int linked = 0;

        for (Activity activity : activities) {
            if (activity.getAuthor().trim().equalsIgnoreCase(unknownAuthor)) {
                continue;
            }
            Person author = personResolver.resolve(PersonReference.named(activity.getAuthor()));
            if (author == null) {
                continue;
            }
            activity.setAuthorPerson(author);
            activity.setAuthor(author.getName());
            linked++;
        }

        activityRepository.flush();
        return linked;
    }
}
