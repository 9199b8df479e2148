package com.murmur.database.migration;

import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;

/** Reports the migration state of the event store, for health checks and operators. */
public class MigrationService {

    /**
     * A single migration as Flyway sees it.
     *
     * @param state Flyway's display name for the state, e.g. "Success" or "Pending"
     * @param installedOn ISO-8601 instant, null while pending
     */
    public record MigrationInfo(
            String database, String version, String description, String state, String installedOn) {}

    /**
     * @param currentVersion latest applied version, null before the first migration
     */
    public record DatabaseStatus(
            String database, String url, int appliedMigrations, int pendingMigrations, String currentVersion) {

        public boolean upToDate() {
            return pendingMigrations == 0;
        }
    }

    private final String database;
    private final String url;
    private final Flyway flyway;

    public MigrationService(String database, String url, Flyway flyway) {
        if (flyway == null) {
            throw new IllegalArgumentException("flyway must not be null");
        }
        this.database = database;
        this.url = url;
        this.flyway = flyway;
    }

    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        org.flywaydb.core.api.MigrationInfo current = info.current();
        String currentVersion = current == null || current.getVersion() == null
                ? null
                : current.getVersion().getVersion();
        return new DatabaseStatus(database, url, info.applied().length, info.pending().length, currentVersion);
    }

    public List<MigrationInfo> migrations() {
        return Arrays.stream(flyway.info().all())
                .map(migration -> toInfo(database, migration))
                .toList();
    }

    static MigrationInfo toInfo(String database, org.flywaydb.core.api.MigrationInfo migration) {
        return new MigrationInfo(
                database,
                migration.getVersion() == null ? null : migration.getVersion().getVersion(),
                migration.getDescription(),
                migration.getState().getDisplayName(),
                migration.getInstalledOn() == null ? null : migration.getInstalledOn().toInstant().toString());
    }
}
