package com.portfolio.dto.request;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Reads a {@link PersonReference} from either a JSON string (a display name)
 * or a JSON object with optional {@code id}, {@code name}, {@code team} and
 * {@code email} members.
 *
 * Any other JSON value yields null, which resolves to "no person".
 */
public class PersonReferenceDeserializer extends JsonDeserializer<PersonReference> {

    @Override
    public PersonReference deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return fromNode(node);
    }

    /**
     * Maps one already-parsed JSON value onto a reference.
     *
     * @param node a string or object node, may be null
     * @return the reference, or null when the node has neither shape
     */
    public static PersonReference fromNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return PersonReference.named(node.asText());
        }
        if (node.isObject()) {
            return PersonReference.byFields(
                    text(node, "id"),
                    text(node, "name"),
                    text(node, "team"),
                    text(node, "email"));
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
