package com.portfolio.controller;

import com.portfolio.dto.request.PersonPayload;
import com.portfolio.dto.response.PersonResponse;
import com.portfolio.entity.Person;
import com.portfolio.service.PersonService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller for the people directory.
 *
 * Endpoints:
 * - GET    /api/people       list people, merging duplicates
 * - POST   /api/people       create or resolve a person
 * - GET    /api/people/{id}  get one person
 * - PUT    /api/people/{id}  rename / update a person
 * - DELETE /api/people/{id}  delete a person and clear its references
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 *
 * @see com.portfolio.service.PersonService
 */
@RestController
@RequestMapping("/api/people")
@RequiredArgsConstructor
@Slf4j
public class PeopleController {

    private final PersonService personService;

    @GetMapping
    public ResponseEntity<List<PersonResponse>> listPeople() {
        List<Person> people = personService.listPeopleDeduplicated();
        return ResponseEntity.ok(people.stream().map(PersonResponse::from).collect(Collectors.toList()));
    }

    /**
     * Create a person. An existing person matching the payload's id, email or
     * name is returned instead, enriched with the payload's fields.
     *
     * @param payload person fields
     * @return the resolved person with 201 Created
     */
    @PostMapping
    public ResponseEntity<PersonResponse> createPerson(@Valid @RequestBody PersonPayload payload) {
        log.info("Create person request: name='{}'", payload.getName());
        Person person = personService.createPerson(payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(PersonResponse.from(person));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PersonResponse> getPerson(@PathVariable String id) {
        return ResponseEntity.ok(PersonResponse.from(personService.getPerson(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PersonResponse> updatePerson(
            @PathVariable String id,
            @Valid @RequestBody PersonPayload payload) {
        log.info("Update person request: id={}", id);
        return ResponseEntity.ok(PersonResponse.from(personService.updatePerson(id, payload)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePerson(@PathVariable String id) {
        log.info("Delete person request: id={}", id);
        personService.deletePerson(id);
        return ResponseEntity.noContent().build();
    }
}
