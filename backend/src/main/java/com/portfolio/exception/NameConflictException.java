package com.portfolio.exception;

/**
 * Exception thrown when a write would give two projects, or two people, the
 * same case-insensitive name (or two people the same email).
 *
 * Raised before any part of the write is applied. GlobalExceptionHandler maps
 * this to HTTP 409 Conflict with RFC 7807 format.
 *
 * @see com.portfolio.service.ProjectService
 * @see com.portfolio.service.PersonResolver
 */
public class NameConflictException extends RuntimeException {

    private final String resourceType;
    private final String conflictingValue;

    /**
     * Constructs a new NameConflictException.
     *
     * @param resourceType "project" or "person"
     * @param conflictingValue the name or email already in use
     * @param message the detail message
     * @param cause the underlying constraint violation, may be null
     */
    public NameConflictException(String resourceType, String conflictingValue, String message, Throwable cause) {
        super(message, cause);
        this.resourceType = resourceType;
        this.conflictingValue = conflictingValue;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getConflictingValue() {
        return conflictingValue;
    }

    /**
     * Another project already uses the name.
     *
     * @param name the rejected project name
     * @return a NameConflictException with a formatted message
     */
    public static NameConflictException forProject(String name) {
        return new NameConflictException(
                "project",
                name,
                String.format("A project named '%s' already exists. Project names must be unique.", name),
                null
        );
    }

    /**
     * Another person already uses the name.
     *
     * @param name the rejected person name
     * @return a NameConflictException with a formatted message
     */
    public static NameConflictException forPerson(String name) {
        return new NameConflictException(
                "person",
                name,
                String.format("A person named '%s' already exists. Person names must be unique.", name),
                null
        );
    }

    /**
     * Another person already uses the email.
     *
     * @param email the rejected email
     * @return a NameConflictException with a formatted message
     */
    public static NameConflictException forPersonEmail(String email) {
        return new NameConflictException(
                "person",
                email,
                String.format("A person with email '%s' already exists. Emails must be unique.", email),
                null
        );
    }
}
