package com.portfolio.repository;

import com.portfolio.entity.Activity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Activity log entries.
 */
@Repository
public interface ActivityRepository extends JpaRepository<Activity, String> {

    Optional<Activity> findByIdAndProjectId(String id, String projectId);

    boolean existsByIdAndProjectIdNot(String id, String projectId);

    /**
     * Entries that carry an author name but were never linked to a person.
     *
     * @return unlinked entries with a non-blank author
     */
    @Query("SELECT a FROM Activity a WHERE a.authorPerson IS NULL "
            + "AND a.author IS NOT NULL AND TRIM(a.author) <> '' ORDER BY a.id")
    List<Activity> findUnlinkedAuthored();

    /**
     * Re-attribute every entry written by one person to another, updating the
     * display name to the surviving person's name.
     *
     * @param fromId person being merged away
     * @param toId surviving person
     * @param toName surviving person's canonical name
     * @return number of entries updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE activity SET author_id = :toId, author = :toName WHERE author_id = :fromId",
            nativeQuery = true)
    int reassignAuthor(@Param("fromId") String fromId, @Param("toId") String toId, @Param("toName") String toName);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE activity SET author_id = NULL WHERE author_id = :personId", nativeQuery = true)
    int clearAuthor(@Param("personId") String personId);
}
