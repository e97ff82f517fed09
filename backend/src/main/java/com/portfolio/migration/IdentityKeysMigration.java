package com.portfolio.migration;

import com.portfolio.repository.PersonRepository;
import com.portfolio.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fills the {@code name_key} / {@code email_key} lookup columns on people and
 * projects stored before those columns existed, and turns blank emails into
 * nulls so they never collide under the email index.
 */
@Component
@Order(1)
@Slf4j
@RequiredArgsConstructor
public class IdentityKeysMigration implements DataMigration {

    public static final String KEY = "identity-keys-v1";

    private final PersonRepository personRepository;
    private final ProjectRepository projectRepository;

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public void apply() {
        int blankEmails = personRepository.clearBlankEmails();
        int personNames = personRepository.backfillNameKeys();
        int personEmails = personRepository.backfillEmailKeys();
        int projectNames = projectRepository.backfillNameKeys();

        log.info("Backfilled identity keys: {} person names, {} person emails ({} blank emails cleared), {} project names",
                personNames, personEmails, blankEmails, projectNames);
    }
}
