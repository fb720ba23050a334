package com.entitystore.persistence.migration;

import com.entitystore.exception.MigrationRequiredException;
import com.entitystore.exception.ServerOutdatedException;
import com.entitystore.persistence.MetadataStore;
import com.entitystore.util.Version;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Checks the schema version a store last wrote to one database and gates opening it.
 *
 * One helper runs per store and per database, so document and vector schemas are versioned
 * independently. The runtime version is recorded only after every collection opened.
 */
@Slf4j
public class StoreMigrationHelper {

    private final String storeName;
    private final Version runtimeVersion;
    private final MetadataStore database;
    private final boolean allowMigration;

    @Getter
    private volatile MigrationState state = MigrationState.NOT_OPENED;

    public StoreMigrationHelper(String storeName, Version runtimeVersion, MetadataStore database, boolean allowMigration) {
        this.storeName = storeName;
        this.runtimeVersion = runtimeVersion;
        this.database = database;
        this.allowMigration = allowMigration;
    }

    public static String versionKey(String storeName) {
        return storeName + "_version";
    }

    /**
     * Check the persisted version, run {@code openCollections}, then record the runtime version.
     */
    public <T> Mono<T> open(Supplier<Mono<T>> openCollections) {
        return checkVersion()
                .then(Mono.defer(openCollections))
                .flatMap(opened -> database.upsertMetadata(versionKey(storeName), runtimeVersion.toString())
                        .doOnSuccess(ignored -> {
                            transition(MigrationState.OPEN);
                            log.info("{} opened at schema version {}", storeName, runtimeVersion);
                        })
                        .thenReturn(opened));
    }

    Mono<Void> checkVersion() {
        String key = versionKey(storeName);
        return database.readMetadata().flatMap(metadata -> {
            transition(MigrationState.VERSION_CHECKED);
            Object persisted = metadata.get(key);

            if (persisted == null) {
                transition(MigrationState.UP_TO_DATE);
                return database.upsertMetadata(key, runtimeVersion.toString());
            }

            Version persistedVersion = Version.fromString(persisted.toString());
            if (persistedVersion.isNewerThan(runtimeVersion)) {
                return Mono.error(new ServerOutdatedException(storeName, persistedVersion.toString(), runtimeVersion.toString()));
            }
            if (persistedVersion.equals(runtimeVersion)) {
                transition(MigrationState.UP_TO_DATE);
                return Mono.empty();
            }
            if (!allowMigration) {
                transition(MigrationState.MIGRATION_DISALLOWED);
                return Mono.error(new MigrationRequiredException(storeName, persistedVersion.toString(), runtimeVersion.toString()));
            }
            transition(MigrationState.MIGRATION_NEEDED);
            log.info("Migrating {} from schema version {} to {}", storeName, persistedVersion, runtimeVersion);
            return Mono.empty();
        });
    }

    private void transition(MigrationState next) {
        log.debug("{}: {} -> {}", storeName, state, next);
        state = next;
    }
}
