package com.entitystore.config;

import com.entitystore.util.IdPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Entity store settings, bound from {@code entitystore.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "entitystore")
public class EntityStoreProperties {

    public enum Backend {
        POSTGRES, JSON_FILE, TRANSIENT
    }

    @NotNull
    private Backend backend = Backend.TRANSIENT;

    /**
     * Upgrade documents written by older versions when a store opens.
     * When false, a version mismatch fails startup.
     */
    private boolean allowMigration = true;

    @Valid
    private JsonFile jsonFile = new JsonFile();

    @Valid
    private Postgres postgres = new Postgres();

    @Valid
    private StoreSettings cannedResponses = new StoreSettings(IdPolicy.CONTENT_ADDRESSED);

    @Valid
    private StoreSettings utterances = new StoreSettings(IdPolicy.RANDOM);

    @Valid
    private StoreSettings journeys = new StoreSettings(IdPolicy.RANDOM);

    @Data
    public static class JsonFile {
        @NotBlank
        private String path = "data/entity-store.json";
        @NotBlank
        private String vectorPath = "data/entity-store-vectors.json";
    }

    @Data
    public static class Postgres {
        @NotBlank
        private String metadataTable = "entitystore_metadata";
        @NotBlank
        private String vectorMetadataTable = "entitystore_vector_metadata";
    }

    @Data
    public static class StoreSettings {
        @NotNull
        private IdPolicy idPolicy;

        public StoreSettings() {
        }

        public StoreSettings(IdPolicy idPolicy) {
            this.idPolicy = idPolicy;
        }
    }
}
