package com.portfolio.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Activity entity: one dated entry of a project's activity log.
 *
 * {@code author} is the display name shown to readers. When the author has
 * been resolved to a person, {@code authorPerson} links to it and
 * {@code author} holds that person's canonical name.
 *
 * Database Table: activity
 */
@Entity
@Table(name = "activity", indexes = {
    @Index(name = "idx_activity_project_id", columnList = "project_id"),
    @Index(name = "idx_activity_author_id", columnList = "author_id")
})
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Activity {

    @Id
    @EqualsAndHashCode.Include
    @Column(name = "id", length = 64, updatable = false, nullable = false)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false, foreignKey = @ForeignKey(name = "fk_activity_project"))
    @ToString.Exclude
    private Project project;

    /**
     * ISO-8601 date or date-time. Sorts lexicographically in time order.
     */
    @Column(name = "activity_date", nullable = false, length = 32)
    private String date;

    @Column(name = "note", nullable = false, columnDefinition = "TEXT")
    private String note;

    @Column(name = "author")
    private String author;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", foreignKey = @ForeignKey(name = "fk_activity_author"))
    @ToString.Exclude
    private Person authorPerson;

    @Embedded
    private TaskContext taskContext;

    public Activity(String id, Project project) {
        this.id = id;
        this.project = project;
    }
}
