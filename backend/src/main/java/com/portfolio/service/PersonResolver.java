package com.portfolio.service;

import com.portfolio.dto.request.PersonReference;
import com.portfolio.entity.IdentityKeys;
import com.portfolio.entity.Person;
import com.portfolio.exception.NameConflictException;
import com.portfolio.repository.PersonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Service turning a partial person reference into the canonical Person.
 *
 * Resolution runs one algorithm over the normalized fields of a reference:
 *
 * 1. Selection, first match wins:
 *    - a person whose id equals the supplied id
 *    - a person whose email key equals the supplied email
 *    - a person whose name key equals the supplied name
 *
 * 2. Merge into the selected person:
 *    - team is overwritten by a different non-empty team
 *    - email is overwritten by a different non-empty email nobody else owns
 *    - name is overwritten by a case-insensitively different name nobody else owns
 *    Changes are flushed at once; a reference that changes nothing writes nothing.
 *
 * 3. Creation when nothing was selected and a name is present, under the
 *    supplied id if any. With no name the reference resolves to null.
 *
 * A supplied id that matches nobody does not stop the email and name lookups:
 * when the name already belongs to someone, that person is returned rather than
 * a second person with the same name.
 *
 * Creation goes through {@link PersonCreator} in the caller's transaction.
 * When a concurrent request inserts the same identity first, the insert is
 * skipped, the lookup is repeated once and the other request's person is
 * returned.
 *
 * @see PersonReference
 * @see PersonCreator
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PersonResolver {

    private final PersonRepository personRepository;
    private final PersonCreator personCreator;

    /**
     * Resolve a reference to a person, creating or enriching it as needed.
     *
     * @param reference the reference, may be null
     * @return the managed canonical person, or null for an empty reference
     * @throws NameConflictException if a skipped insert matches nobody on the second lookup
     */
    @Transactional
    public Person resolve(PersonReference reference) {
        if (reference == null) {
            return null;
        }

        PersonReference.Fields fields = reference.toFields();
        if (fields.isEmpty()) {
            log.debug("Empty person reference resolved to nobody");
            return null;
        }

        Optional<Person> existing = findExisting(fields);
        if (existing.isPresent()) {
            return mergeInto(existing.get(), fields);
        }

        if (fields.getName() == null) {
            log.debug("Person reference without a name matched nobody: id={}, email={}",
                    fields.getId(), fields.getEmail());
            return null;
        }

        return create(fields);
    }

    /**
     * Selection step only: id, then email, then name.
     *
     * @param fields normalized reference fields
     * @return the selected person, if any
     */
    @Transactional(readOnly = true)
    public Optional<Person> findExisting(PersonReference.Fields fields) {
        if (fields.getId() != null) {
            Optional<Person> byId = personRepository.findById(fields.getId());
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (fields.getEmail() != null) {
            Optional<Person> byEmail = personRepository.findFirstByEmailKeyOrderByCreatedAtAscIdAsc(fields.getEmail());
            if (byEmail.isPresent()) {
                return byEmail;
            }
        }
        if (fields.getName() != null) {
            return personRepository.findFirstByNameKeyOrderByCreatedAtAscIdAsc(fields.getNameKey());
        }
        return Optional.empty();
    }

    private Person mergeInto(Person person, PersonReference.Fields fields) {
        boolean changed = false;

        if (fields.getTeam() != null && !fields.getTeam().equals(person.getTeam())) {
            person.setTeam(fields.getTeam());
            changed = true;
        }

        if (fields.getEmail() != null && !fields.getEmail().equals(IdentityKeys.normalize(person.getEmail()))) {
            if (personRepository.existsByEmailKeyAndIdNot(fields.getEmail(), person.getId())) {
                log.warn("Not assigning email {} to person {}: already used by another person",
                        fields.getEmail(), person.getId());
            } else {
                person.setEmail(fields.getEmail());
                changed = true;
            }
        }

        String nameKey = fields.getNameKey();
        if (nameKey != null && !nameKey.equals(IdentityKeys.normalize(person.getName()))) {
            if (personRepository.existsByNameKeyAndIdNot(nameKey, person.getId())) {
                log.warn("Not renaming person {} to '{}': name already used by another person",
                        person.getId(), fields.getName());
            } else {
                person.setName(fields.getName());
                changed = true;
            }
        }

        if (!changed) {
            log.debug("Resolved person {} without changes", person.getId());
            return person;
        }

        Person saved = personRepository.saveAndFlush(person);
        log.info("Updated person {} from reference: name='{}', team='{}', email={}",
                saved.getId(), saved.getName(), saved.getTeam(), saved.getEmail());
        return saved;
    }

    private Person create(PersonReference.Fields fields) {
        Optional<Person> created =
                personCreator.create(fields.getId(), fields.getName(), fields.getTeam(), fields.getEmail());
        if (created.isPresent()) {
            return created.get();
        }

        log.warn("Concurrent creation of person '{}' detected, repeating lookup", fields.getName());
        Optional<Person> winner = findExisting(fields);
        if (winner.isEmpty()) {
            throw NameConflictException.forPerson(fields.getName());
        }
        return mergeInto(winner.get(), fields);
    }
}
