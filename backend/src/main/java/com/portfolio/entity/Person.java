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

/**
 * Person entity: the canonical record for one human referenced by projects,
 * tasks and activity entries.
 *
 * Names and emails are unique case-insensitively. The derived {@code name_key}
 * and {@code email_key} columns carry the unique indexes and are refreshed on
 * every insert and update. Rows written before those columns existed have null
 * keys until the {@code identity-keys-v1} migration backfills them.
 *
 * Database Table: person
 */
@Entity
@Table(name = "person", indexes = {
    @Index(name = "idx_person_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Person implements Persistable<String> {

    /**
     * Primary key, {@code person-xxxxxxxxxxxx} unless supplied by the caller.
     */
    @Id
    @EqualsAndHashCode.Include
    @Column(name = "id", length = 64, updatable = false, nullable = false)
    private String id;

    /**
     * Display name, stored trimmed.
     */
    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Lower-cased trimmed name, unique once {@code dedupe-constrain-v1} has run.
     */
    @Column(name = "name_key")
    private String nameKey;

    /**
     * Free-text team or role.
     */
    @Column(name = "team", nullable = false)
    private String team = "";

    /**
     * Optional email, stored trimmed and lower-cased.
     */
    @Column(name = "email")
    private String email;

    /**
     * Lower-cased trimmed email, null when no email is set.
     */
    @Column(name = "email_key")
    private String emailKey;

    /**
     * Creation time. Defines the "first record" order for deduplication.
     */
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
     * Constructor for creating a new person.
     *
     * @param id    the identifier to insert under
     * @param name  display name
     * @param team  team or role
     * @param email optional email
     */
    public Person(String id, String name, String team, String email) {
        this.id = id;
        this.name = name;
        this.team = team;
        setEmail(email);
    }

    /**
     * Sets the email, trimming and lower-casing it. Blank input clears it.
     *
     * @param email raw email, may be null
     */
    public void setEmail(String email) {
        this.email = IdentityKeys.normalize(email);
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PrePersist
    @PreUpdate
    void refreshKeys() {
        this.nameKey = IdentityKeys.normalize(name);
        this.emailKey = IdentityKeys.normalize(email);
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }
}
