package com.studioledger.backup.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.springframework.stereotype.Component;

/**
 * Applies any Flyway migrations newer than the restored schema history.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlywaySchemaSynchronizer implements SchemaSynchronizer {

    private final Flyway flyway;

    @Override
    public void synchronize() {
        MigrateResult result = flyway.migrate();
        log.info("Schema synchronized: {} migration(s) applied, now at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
    }
}
