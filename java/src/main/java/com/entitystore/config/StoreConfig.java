package com.entitystore.config;

import com.entitystore.nlp.Embedder;
import com.entitystore.persistence.DocumentDatabase;
import com.entitystore.persistence.VectorDatabase;
import com.entitystore.persistence.memory.InMemoryDocumentDatabase;
import com.entitystore.persistence.memory.InMemoryVectorDatabase;
import com.entitystore.persistence.memory.JsonFileDocumentDatabase;
import com.entitystore.persistence.memory.JsonFileVectorDatabase;
import com.entitystore.persistence.postgres.PgVectorDatabase;
import com.entitystore.persistence.postgres.PostgresDocumentDatabase;
import com.entitystore.service.AbstractEntityStore;
import com.entitystore.service.CannedResponseStore;
import com.entitystore.service.JourneyStore;
import com.entitystore.service.UtteranceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;

import java.nio.file.Path;

/**
 * Wires the backends selected by {@code entitystore.backend} and opens the stores on them.
 * A store that fails to open fails startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EntityStoreProperties.class)
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "entitystore.backend", havingValue = "transient", matchIfMissing = true)
    public DocumentDatabase transientDocumentDatabase(ObjectMapper objectMapper) {
        log.info("Using transient document database");
        return new InMemoryDocumentDatabase(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "entitystore.backend", havingValue = "json-file")
    public DocumentDatabase jsonFileDocumentDatabase(EntityStoreProperties properties, ObjectMapper objectMapper) {
        Path path = Path.of(properties.getJsonFile().getPath());
        log.info("Using JSON file document database at {}", path.toAbsolutePath());
        return new JsonFileDocumentDatabase(path, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "entitystore.backend", havingValue = "transient", matchIfMissing = true)
    public VectorDatabase transientVectorDatabase(ObjectMapper objectMapper) {
        return new InMemoryVectorDatabase(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "entitystore.backend", havingValue = "json-file")
    public VectorDatabase jsonFileVectorDatabase(EntityStoreProperties properties, ObjectMapper objectMapper) {
        Path path = Path.of(properties.getJsonFile().getVectorPath());
        log.info("Using JSON file vector database at {}", path.toAbsolutePath());
        return new JsonFileVectorDatabase(path, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "entitystore.backend", havingValue = "postgres")
    public DocumentDatabase postgresDocumentDatabase(DatabaseClient databaseClient,
                                                     EntityStoreProperties properties,
                                                     ObjectMapper objectMapper) {
        log.info("Using PostgreSQL document database");
        return new PostgresDocumentDatabase(databaseClient, objectMapper, properties.getPostgres().getMetadataTable());
    }

    @Bean
    @ConditionalOnProperty(name = "entitystore.backend", havingValue = "postgres")
    public VectorDatabase pgVectorDatabase(DatabaseClient databaseClient,
                                           EntityStoreProperties properties,
                                           ObjectMapper objectMapper) {
        log.info("Using pgvector vector database");
        return new PgVectorDatabase(databaseClient, objectMapper, properties.getPostgres().getVectorMetadataTable());
    }

    @Bean
    public CannedResponseStore cannedResponseStore(DocumentDatabase documentDatabase,
                                                   VectorDatabase vectorDatabase,
                                                   Embedder embedder,
                                                   EntityStoreProperties properties,
                                                   ObjectMapper objectMapper) {
        return opened(new CannedResponseStore(documentDatabase, vectorDatabase, embedder,
                properties.getCannedResponses().getIdPolicy(), properties.isAllowMigration(), objectMapper));
    }

    @Bean
    public UtteranceStore utteranceStore(DocumentDatabase documentDatabase,
                                         VectorDatabase vectorDatabase,
                                         Embedder embedder,
                                         EntityStoreProperties properties,
                                         ObjectMapper objectMapper) {
        return opened(new UtteranceStore(documentDatabase, vectorDatabase, embedder,
                properties.getUtterances().getIdPolicy(), properties.isAllowMigration(), objectMapper));
    }

    @Bean
    public JourneyStore journeyStore(DocumentDatabase documentDatabase,
                                     VectorDatabase vectorDatabase,
                                     Embedder embedder,
                                     EntityStoreProperties properties) {
        return opened(new JourneyStore(documentDatabase, vectorDatabase, embedder,
                properties.getJourneys().getIdPolicy(), properties.isAllowMigration()));
    }

    private static <S extends AbstractEntityStore<?, ?>> S opened(S store) {
        store.open().block();
        return store;
    }
}
