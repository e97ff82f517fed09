package com.portfolio.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Desired state of one activity log entry.
 *
 * The author is identified by any combination of {@code authorId},
 * {@code authorEmail} and the {@code author} display name. When it resolves to
 * a person, the stored display name becomes that person's canonical name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityPayload {

    private String id;

    /**
     * ISO-8601 date or date-time, e.g. {@code 2025-03-01}.
     */
    @NotBlank(message = "Activity date is required")
    private String date;

    @NotBlank(message = "Activity note is required")
    private String note;

    private String author;

    private String authorId;

    private String authorEmail;

    private TaskContextPayload taskContext;
}
