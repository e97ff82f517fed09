package com.portfolio.service;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Generates prefixed string identifiers such as {@code task-1f3c9a7e20b4}.
 */
@Component
public class IdGenerator {

    private static final int RANDOM_LENGTH = 12;

    /**
     * @param prefix entity kind, e.g. "person" or "task"
     * @return a fresh identifier
     */
    public String newId(String prefix) {
        String random = UUID.randomUUID().toString().replace("-", "");
        return prefix + "-" + random.substring(0, RANDOM_LENGTH);
    }
}
