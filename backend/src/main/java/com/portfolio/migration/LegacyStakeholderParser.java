package com.portfolio.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.dto.request.PersonReference;
import com.portfolio.dto.request.PersonReferenceDeserializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the stakeholder JSON that projects embedded before people were
 * normalized.
 *
 * Accepts an array whose entries are names or person objects, or a single
 * such value. Entries of any other shape are skipped. Unparseable text is
 * logged and yields no references.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LegacyStakeholderParser {

    private final ObjectMapper objectMapper;

    /**
     * @param json raw column value, may be null
     * @return references in stored order
     */
    public List<PersonReference> parse(String json) {
        List<PersonReference> references = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return references;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparseable legacy stakeholder data '{}': {}", json, e.getOriginalMessage());
            return references;
        }

        if (root.isArray()) {
            for (JsonNode entry : root) {
                addIfPresent(references, entry);
            }
        } else {
            addIfPresent(references, root);
        }
        return references;
    }

    private void addIfPresent(List<PersonReference> references, JsonNode node) {
        PersonReference reference = PersonReferenceDeserializer.fromNode(node);
        if (reference != null) {
            references.add(reference);
        } else {
            log.debug("Skipping legacy stakeholder entry of unsupported shape: {}", node);
        }
    }
}
