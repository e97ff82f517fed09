package com.portfolio.service;

import com.portfolio.dto.request.PersonPayload;
import com.portfolio.entity.IdentityKeys;
import com.portfolio.entity.Person;
import com.portfolio.exception.NameConflictException;
import com.portfolio.exception.ResourceNotFoundException;
import com.portfolio.repository.PersonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for the people directory.
 *
 * Listing doubles as a repair pass: records that share an email, or failing
 * that a name, are merged into the first one seen, so duplicates written before
 * the unique indexes existed disappear the first time the directory is read.
 *
 * @see PersonConsolidator
 * @see PersonResolver
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PersonService {

    private final PersonRepository personRepository;
    private final PersonResolver personResolver;
    private final PersonConsolidator personConsolidator;

    /**
     * List every person once, merging duplicates on the way.
     *
     * People are walked in creation order. A person whose email, or else
     * whose name, matches one already seen is merged into that earlier record
     * and removed.
     *
     * @return surviving people in first-seen order
     */
    @Transactional
    public List<Person> listPeopleDeduplicated() {
        List<Person> people = personRepository.findAllByOrderByCreatedAtAscIdAsc();

        Map<String, Person> byEmail = new HashMap<>();
        Map<String, Person> byName = new HashMap<>();
        Map<String, Person> survivors = new LinkedHashMap<>();
        int merged = 0;

        for (Person person : people) {
            String emailKey = IdentityKeys.normalize(person.getEmail());
            String nameKey = IdentityKeys.normalize(person.getName());

            Person first = emailKey != null ? byEmail.get(emailKey) : null;
            if (first == null && nameKey != null) {
                first = byName.get(nameKey);
            }

            Person survivor = person;
            if (first != null) {
                survivor = personConsolidator.merge(first, person);
                merged++;
            }

            survivors.put(survivor.getId(), survivor);
            index(survivor, IdentityKeys.normalize(survivor.getEmail()), IdentityKeys.normalize(survivor.getName()),
                    byEmail, byName);
            index(survivor, emailKey, nameKey, byEmail, byName);
        }

        if (merged > 0) {
            log.info("People listing merged {} duplicate records, {} people remain", merged, survivors.size());
        }
        return new ArrayList<>(survivors.values());
    }

    /**
     * Create a person, or return the existing one matching the payload's id,
     * email or name.
     *
     * @param payload person fields
     * @return the resolved person
     * @throws IllegalArgumentException if the payload names nobody
     */
    @Transactional
    public Person createPerson(PersonPayload payload) {
        Person person = personResolver.resolve(payload.toReference());
        if (person == null) {
            throw new IllegalArgumentException("Person name cannot be null or empty");
        }
        return person;
    }

    @Transactional(readOnly = true)
    public Person getPerson(String personId) {
        return personRepository.findById(personId)
                .orElseThrow(() -> ResourceNotFoundException.person(personId));
    }

    /**
     * Rename a person and overwrite team and email.
     *
     * @param personId the person ID
     * @param payload new field values
     * @return the updated person
     * @throws ResourceNotFoundException if the person does not exist
     * @throws NameConflictException if another person uses the name or email
     */
    @Transactional
    public Person updatePerson(String personId, PersonPayload payload) {
        Person person = getPerson(personId);

        String name = IdentityKeys.trimToNull(payload.getName());
        if (name == null) {
            throw new IllegalArgumentException("Person name cannot be null or empty");
        }
        if (personRepository.existsByNameKeyAndIdNot(IdentityKeys.normalize(name), personId)) {
            log.warn("Rejected rename of person {} to '{}': name in use", personId, name);
            throw NameConflictException.forPerson(name);
        }
        String emailKey = IdentityKeys.normalize(payload.getEmail());
        if (emailKey != null && personRepository.existsByEmailKeyAndIdNot(emailKey, personId)) {
            log.warn("Rejected email change of person {}: {} in use", personId, emailKey);
            throw NameConflictException.forPersonEmail(emailKey);
        }

        person.setName(name);
        String team = IdentityKeys.trimToNull(payload.getTeam());
        person.setTeam(team != null ? team : "");
        person.setEmail(emailKey);

        Person saved = personRepository.saveAndFlush(person);
        log.info("Updated person {}: name='{}', team='{}'", personId, saved.getName(), saved.getTeam());
        return saved;
    }

    /**
     * Delete a person, clearing assignments and authorship and removing it
     * from every stakeholder list.
     *
     * @param personId the person ID
     * @throws ResourceNotFoundException if the person does not exist
     */
    @Transactional
    public void deletePerson(String personId) {
        Person person = getPerson(personId);
        personConsolidator.detachAndDelete(person);
    }

    private static void index(Person survivor, String emailKey, String nameKey,
                              Map<String, Person> byEmail, Map<String, Person> byName) {
        if (emailKey != null) {
            byEmail.put(emailKey, survivor);
        }
        if (nameKey != null) {
            byName.put(nameKey, survivor);
        }
    }
}
