package com.portfolio.dto.request;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.portfolio.entity.IdentityKeys;
import lombok.Value;

/**
 * A possibly partial reference to a person, as it arrives in a payload or in
 * legacy stored data.
 *
 * Two shapes exist:
 * <ul>
 *   <li>{@link Named}: a bare display name, e.g. {@code "Sarah Chen"}</li>
 *   <li>{@link ByFields}: any of {@code id}, {@code name}, {@code team},
 *       {@code email}</li>
 * </ul>
 *
 * Both reduce to the same normalized {@link Fields} before resolution, so
 * there is a single resolution algorithm. In JSON either a string or an object
 * is accepted (see {@link PersonReferenceDeserializer}).
 *
 * @see com.portfolio.service.PersonResolver
 */
@JsonDeserialize(using = PersonReferenceDeserializer.class)
public interface PersonReference {

    /**
     * Normalized view of this reference: values trimmed, blanks absent, email
     * lower-cased.
     *
     * @return the normalized fields
     */
    Fields toFields();

    static PersonReference named(String name) {
        return new Named(name);
    }

    static PersonReference byFields(String id, String name, String team, String email) {
        return new ByFields(id, name, team, email);
    }

    /**
     * Reference by display name only.
     */
    @Value
    class Named implements PersonReference {
        String name;

        @Override
        public Fields toFields() {
            return Fields.of(null, name, null, null);
        }
    }

    /**
     * Structured reference; every field is optional.
     */
    @Value
    class ByFields implements PersonReference {
        String id;
        String name;
        String team;
        String email;

        @Override
        public Fields toFields() {
            return Fields.of(id, name, team, email);
        }
    }

    /**
     * Normalized field set. A null value means "not supplied".
     */
    @Value
    class Fields {
        String id;
        String name;
        String team;
        String email;

        public static Fields of(String id, String name, String team, String email) {
            return new Fields(
                    IdentityKeys.trimToNull(id),
                    IdentityKeys.trimToNull(name),
                    IdentityKeys.trimToNull(team),
                    IdentityKeys.normalize(email));
        }

        public String getNameKey() {
            return IdentityKeys.normalize(name);
        }

        public boolean isEmpty() {
            return id == null && name == null && email == null;
        }
    }
}
