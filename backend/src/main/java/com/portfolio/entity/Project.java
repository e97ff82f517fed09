package com.portfolio.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Project entity: the root of an aggregate owning an ordered task plan and an
 * ordered activity log, and linked to its stakeholder people.
 *
 * Deleting a project cascades to its tasks (and their subtasks), its activity
 * entries and its stakeholder links. {@code lastUpdate} is derived from the
 * activity log and never written directly by callers.
 *
 * Database Table: project
 */
@Entity
@Table(name = "project", indexes = {
    @Index(name = "idx_project_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Project implements Persistable<String> {

    @Id
    @EqualsAndHashCode.Include
    @Column(name = "id", length = 64, updatable = false, nullable = false)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Lower-cased trimmed name, unique once {@code dedupe-constrain-v1} has run.
     */
    @Column(name = "name_key")
    private String nameKey;

    @Column(name = "status", nullable = false, length = 50)
    private String status = "planning";

    @Column(name = "priority", nullable = false, length = 50)
    private String priority = "medium";

    /**
     * Completion percentage, 0 to 100.
     */
    @Column(name = "progress", nullable = false)
    private Integer progress = 0;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description = "";

    @Column(name = "executive_update", columnDefinition = "TEXT")
    private String executiveUpdate = "";

    @Column(name = "start_date", length = 32)
    private String startDate;

    @Column(name = "target_date", length = 32)
    private String targetDate;

    /**
     * Note of the most recent activity entry, null when the log is empty.
     */
    @Column(name = "last_update", columnDefinition = "TEXT")
    private String lastUpdate;

    /**
     * Raw JSON of the stakeholder list embedded before people were normalized.
     * Entries are bare names or {@code {id, name, team, email}} objects.
     * Cleared by {@code people-backfill-v1} once its entries are linked.
     */
    @Column(name = "legacy_stakeholders", columnDefinition = "TEXT")
    private String legacyStakeholders;

    @OneToMany(mappedBy = "project", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderColumn(name = "list_index")
    @ToString.Exclude
    private List<Task> tasks = new ArrayList<>();

    @OneToMany(mappedBy = "project", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderColumn(name = "list_index")
    @ToString.Exclude
    private List<Activity> activities = new ArrayList<>();

    @ManyToMany
    @JoinTable(
            name = "project_stakeholders",
            joinColumns = @JoinColumn(name = "project_id", foreignKey = @ForeignKey(name = "fk_stakeholder_project")),
            inverseJoinColumns = @JoinColumn(name = "person_id", foreignKey = @ForeignKey(name = "fk_stakeholder_person"))
    )
    @OrderColumn(name = "list_index")
    @ToString.Exclude
    private List<Person> stakeholders = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    private boolean persisted;

    /**
     * Constructor for a new, empty project.
     *
     * @param id the identifier to insert under
     */
    public Project(String id) {
        this.id = id;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PrePersist
    @PreUpdate
    void refreshKeys() {
        this.nameKey = IdentityKeys.normalize(name);
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }
}
