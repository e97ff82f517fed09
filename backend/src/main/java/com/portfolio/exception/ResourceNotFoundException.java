package com.portfolio.exception;

/**
 * Exception thrown when a project, task, subtask, activity entry or person
 * addressed by id does not exist.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found with RFC 7807 format.
 *
 * @see com.portfolio.exception.GlobalExceptionHandler
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    /**
     * Constructs a new ResourceNotFoundException.
     *
     * @param resourceType kind of resource, e.g. "project"
     * @param resourceId the id that was not found
     */
    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s '%s' was not found.", capitalize(resourceType), resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public static ResourceNotFoundException project(String id) {
        return new ResourceNotFoundException("project", id);
    }

    public static ResourceNotFoundException task(String id) {
        return new ResourceNotFoundException("task", id);
    }

    public static ResourceNotFoundException subtask(String id) {
        return new ResourceNotFoundException("subtask", id);
    }

    public static ResourceNotFoundException activity(String id) {
        return new ResourceNotFoundException("activity", id);
    }

    public static ResourceNotFoundException person(String id) {
        return new ResourceNotFoundException("person", id);
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
