package com.portfolio.service;

import com.portfolio.entity.IdentityKeys;
import com.portfolio.entity.Person;
import com.portfolio.repository.PersonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Inserts new people inside the caller's transaction.
 *
 * The insert skips rows whose id, name or email is already taken, including
 * by a concurrent transaction that commits first. The caller then sees an
 * empty result and repeats its lookup instead of handling a unique-index
 * violation, which would abort the surrounding transaction.
 *
 * @see PersonResolver
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PersonCreator {

    private final PersonRepository personRepository;
    private final IdGenerator idGenerator;

    @Value("${app.people.default-team:Contributor}")
    private String defaultTeam;

    /**
     * Insert a person unless its identity is already taken.
     *
     * @param id    identifier to use, or null for a generated one
     * @param name  display name, required
     * @param team  team, or null for the configured default
     * @param email email, may be null
     * @return the managed new person, or empty when the id, name or email is taken
     * @throws IllegalArgumentException if the name is blank
     */
    @Transactional
    public Optional<Person> create(String id, String name, String team, String email) {
        String trimmedName = IdentityKeys.trimToNull(name);
        if (trimmedName == null) {
            throw new IllegalArgumentException("Person name cannot be null or empty");
        }

        String trimmedTeam = IdentityKeys.trimToNull(team);
        String personId = id != null ? id : idGenerator.newId("person");
        String resolvedTeam = trimmedTeam != null ? trimmedTeam : defaultTeam;

        int inserted = personRepository.insertIfAbsent(personId, trimmedName, IdentityKeys.normalize(trimmedName),
                resolvedTeam, IdentityKeys.normalize(email), LocalDateTime.now());
        if (inserted == 0) {
            log.debug("Person '{}' not inserted: id, name or email already taken", trimmedName);
            return Optional.empty();
        }

        log.info("Created person: id={}, name='{}', team='{}'", personId, trimmedName, resolvedTeam);
        return personRepository.findById(personId);
    }
}
