package com.portfolio.repository;

import com.portfolio.entity.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Project aggregate roots.
 */
@Repository
public interface ProjectRepository extends JpaRepository<Project, String> {

    boolean existsByNameKey(String nameKey);

    /**
     * Check whether a project other than {@code id} already uses a name.
     *
     * @param nameKey lower-cased trimmed name
     * @param id the project being written
     * @return true if the name is taken by another project
     */
    boolean existsByNameKeyAndIdNot(String nameKey, String id);

    /**
     * All projects in creation order, ties broken by id.
     *
     * @return every project
     */
    List<Project> findAllByOrderByCreatedAtAscIdAsc();

    /**
     * Projects that still carry the pre-normalization stakeholder JSON.
     *
     * @return projects with a non-null legacy stakeholder column
     */
    List<Project> findByLegacyStakeholdersIsNotNullOrderByCreatedAtAscIdAsc();

    /**
     * Projects listing the given person as a stakeholder.
     *
     * @param personId the stakeholder's id
     * @return projects linked to that person
     */
    @Query("SELECT DISTINCT p FROM Project p JOIN p.stakeholders s WHERE s.id = :personId")
    List<Project> findByStakeholderId(@Param("personId") String personId);

    /**
     * Fills {@code name_key} on rows written before the column existed.
     *
     * @return number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE project SET name_key = LOWER(TRIM(name)) WHERE name_key IS NULL", nativeQuery = true)
    int backfillNameKeys();
}
