package com.portfolio.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or renaming a person.
 *
 * On create the payload is resolved like any other reference, so posting an
 * existing name or email returns (and enriches) the existing person.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonPayload {

    private String id;

    @NotBlank(message = "Name is required")
    private String name;

    private String team;

    @Email(message = "Email must be valid")
    private String email;

    /**
     * The payload as a structured person reference.
     *
     * @return reference carrying every supplied field
     */
    public PersonReference toReference() {
        return PersonReference.byFields(id, name, team, email);
    }
}
