package com.portfolio.dto.request;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Bulk load of project aggregates.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "mode": "merge",
 *   "projects": [{"id": "project-3f2a9c1b", "name": "Apollo", "tasks": []}]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportPayload {

    /**
     * {@code replace} or {@code merge}. Absent means the request's mode parameter.
     */
    private String mode;

    @Valid
    @Builder.Default
    private List<ProjectPayload> projects = new ArrayList<>();
}
