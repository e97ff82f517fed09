package com.portfolio.migration;

import com.portfolio.entity.MigrationMarker;
import com.portfolio.exception.MigrationFailureException;
import com.portfolio.repository.MigrationMarkerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Applies pending {@link DataMigration}s once all singletons exist, before the
 * web server accepts requests.
 *
 * Per migration, in {@code @Order} order:
 * 1. Skip it if its marker exists.
 * 2. Otherwise run it in a new transaction and insert its marker as the last
 *    statement of that transaction.
 * 3. On failure roll back, write no marker and abort startup with
 *    {@link MigrationFailureException}.
 *
 * Disabled with {@code app.migrations.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "app.migrations.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
@RequiredArgsConstructor
public class MigrationRunner implements SmartInitializingSingleton {

    private final List<DataMigration> migrations;
    private final MigrationMarkerRepository markerRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public void afterSingletonsInstantiated() {
        runMigrations();
    }

    /**
     * Apply every migration that has no marker yet.
     *
     * @return number of migrations applied by this call
     * @throws MigrationFailureException if a migration fails
     */
    public int runMigrations() {
        int applied = 0;
        for (DataMigration migration : migrations) {
            if (runMigration(migration)) {
                applied++;
            }
        }
        log.info("Data migrations complete: {} applied, {} already recorded", applied, migrations.size() - applied);
        return applied;
    }

    private boolean runMigration(DataMigration migration) {
        String key = migration.key();
        if (markerRepository.existsById(key)) {
            log.info("Skipping migration {}: already applied", key);
            return false;
        }

        log.info("Applying migration {}", key);
        long start = System.currentTimeMillis();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                migration.apply();
                markerRepository.saveAndFlush(new MigrationMarker(key, LocalDateTime.now()));
            });
        } catch (RuntimeException e) {
            log.error("Migration {} failed, no marker written: {}", key, e.getMessage(), e);
            throw MigrationFailureException.forMigration(key, e);
        }

        log.info("Migration {} applied in {} ms", key, System.currentTimeMillis() - start);
        return true;
    }
}
