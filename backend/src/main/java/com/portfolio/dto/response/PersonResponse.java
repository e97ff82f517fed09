package com.portfolio.dto.response;

import com.portfolio.entity.Person;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a person.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "id": "person-8c1d2e3f4a5b",
 *   "name": "Jamie Li",
 *   "team": "Design",
 *   "email": "jamie@example.com"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonResponse {

    private String id;

    private String name;

    private String team;

    private String email;

    /**
     * @param person the entity, may be null
     * @return the DTO, or null for no person
     */
    public static PersonResponse from(Person person) {
        if (person == null) {
            return null;
        }
        return PersonResponse.builder()
                .id(person.getId())
                .name(person.getName())
                .team(person.getTeam())
                .email(person.getEmail())
                .build();
    }
}
