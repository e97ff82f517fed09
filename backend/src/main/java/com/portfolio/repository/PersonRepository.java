package com.portfolio.repository;

import com.portfolio.entity.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Person entity operations.
 *
 * Lookups go through the normalized {@code name_key} / {@code email_key}
 * columns. Before the unique indexes exist a key may match several rows, so
 * single-row lookups pick the oldest one.
 */
@Repository
public interface PersonRepository extends JpaRepository<Person, String> {

    /**
     * Find the oldest person with the given normalized email.
     *
     * @param emailKey lower-cased trimmed email
     * @return Optional containing the person if found
     */
    Optional<Person> findFirstByEmailKeyOrderByCreatedAtAscIdAsc(String emailKey);

    /**
     * Find the oldest person with the given normalized name.
     *
     * @param nameKey lower-cased trimmed name
     * @return Optional containing the person if found
     */
    Optional<Person> findFirstByNameKeyOrderByCreatedAtAscIdAsc(String nameKey);

    /**
     * All people in "first record" order: creation time, then id.
     *
     * @return every person
     */
    List<Person> findAllByOrderByCreatedAtAscIdAsc();

    boolean existsByNameKeyAndIdNot(String nameKey, String id);

    boolean existsByEmailKeyAndIdNot(String emailKey, String id);

    /**
     * Inserts a person in the caller's transaction unless the id, name key or
     * email key is already taken. A conflicting insert by a concurrent
     * transaction is waited for; when that transaction commits, nothing is
     * inserted.
     *
     * <p>Pending changes are flushed first, so a rename made earlier in the same
     * transaction frees the old name. The persistence context is left intact.
     *
     * @return 1 if the row was inserted, 0 on conflict
     */
    @Modifying(flushAutomatically = true)
    @Query(value = "INSERT INTO person (id, name, name_key, team, email, email_key, created_at, updated_at) "
            + "VALUES (:id, :name, :nameKey, :team, CAST(:email AS VARCHAR), CAST(:email AS VARCHAR), :now, :now) "
            + "ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("id") String id,
                       @Param("name") String name,
                       @Param("nameKey") String nameKey,
                       @Param("team") String team,
                       @Param("email") String email,
                       @Param("now") LocalDateTime now);

    /**
     * Maps blank emails to null on rows written before emails were normalized.
     *
     * @return number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE person SET email = NULL, email_key = NULL "
            + "WHERE email IS NOT NULL AND TRIM(email) = ''", nativeQuery = true)
    int clearBlankEmails();

    /**
     * Fills {@code name_key} on rows written before the column existed.
     *
     * @return number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE person SET name_key = LOWER(TRIM(name)) WHERE name_key IS NULL", nativeQuery = true)
    int backfillNameKeys();

    /**
     * Lower-cases stored emails and fills {@code email_key} on rows written
     * before the column existed.
     *
     * @return number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE person SET email = LOWER(TRIM(email)), email_key = LOWER(TRIM(email)) "
            + "WHERE email IS NOT NULL AND email_key IS NULL", nativeQuery = true)
    int backfillEmailKeys();
}
