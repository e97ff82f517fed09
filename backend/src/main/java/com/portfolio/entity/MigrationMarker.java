package com.portfolio.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted proof that a one-shot data migration completed.
 *
 * Written as the last statement of the migration's transaction, so a marker
 * exists if and only if the migration's changes were committed.
 *
 * Database Table: migration_markers
 */
@Entity
@Table(name = "migration_markers")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MigrationMarker {

    @Id
    @Column(name = "migration_key", length = 100, updatable = false, nullable = false)
    private String migrationKey;

    @Column(name = "applied_at", nullable = false, updatable = false)
    private LocalDateTime appliedAt;
}
