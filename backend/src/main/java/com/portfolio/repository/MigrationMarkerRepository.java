package com.portfolio.repository;

import com.portfolio.entity.MigrationMarker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for migration markers, keyed by migration key.
 */
@Repository
public interface MigrationMarkerRepository extends JpaRepository<MigrationMarker, String> {
}
