package com.portfolio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Portfolio Tracker backend.
 *
 * This Spring Boot application keeps a portfolio of projects with their task
 * plans, activity logs and stakeholders, featuring:
 * - A canonical, deduplicated people directory fed by free-form references
 * - Whole-aggregate project upserts with replace-children semantics
 * - One-shot startup data migrations recorded in {@code migration_markers}
 * - PostgreSQL storage through Spring Data JPA
 *
 * @version 0.0.1-SNAPSHOT
 */
@SpringBootApplication
public class PortfolioTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioTrackerApplication.class, args);
    }
}
