package com.entitystore.persistence.migration;

import com.entitystore.exception.UnmigratableDocumentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentMigrationHelperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final DocumentMigrationHelper helper = DocumentMigrationHelper.to("0.3.0")
            .from("0.1.0", document -> Mono.just(document.deepCopy().put("version", "0.2.0").put("step1", true)))
            .from("0.2.0", document -> "drop-me".equals(document.path("id").asText())
                    ? Mono.empty()
                    : Mono.just(document.deepCopy().put("version", "0.3.0").put("step2", true)))
            .build();

    private ObjectNode document(String id, String version) {
        return objectMapper.createObjectNode().put("id", id).put("version", version);
    }

    @Test
    void migrate_WalksTheWholeChain() {
        StepVerifier.create(helper.migrate(document("d1", "0.1.0")))
                .assertNext(migrated -> {
                    assertThat(migrated.path("version").asText()).isEqualTo("0.3.0");
                    assertThat(migrated.path("step1").asBoolean()).isTrue();
                    assertThat(migrated.path("step2").asBoolean()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void migrate_CurrentVersionUnchanged() {
        ObjectNode current = document("d1", "0.3.0");

        StepVerifier.create(helper.migrate(current))
                .expectNext(current)
                .verifyComplete();
    }

    @Test
    void migrate_ConverterDropsDocument() {
        StepVerifier.create(helper.migrate(document("drop-me", "0.2.0")))
                .verifyComplete();
    }

    @Test
    void migrate_UnregisteredVersion() {
        StepVerifier.create(helper.migrate(document("d1", "0.0.1")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(UnmigratableDocumentException.class);
                    assertThat(((UnmigratableDocumentException) error).getDocumentVersion()).isEqualTo("0.0.1");
                })
                .verify();
    }

    @Test
    void migrate_MissingVersion() {
        StepVerifier.create(helper.migrate(objectMapper.createObjectNode().put("id", "d1")))
                .expectError(UnmigratableDocumentException.class)
                .verify();
    }

    @Test
    void builder_RejectsDuplicateConverter() {
        DocumentMigrationHelper.Builder builder = DocumentMigrationHelper.to("0.2.0").from("0.1.0", Mono::just);

        assertThatThrownBy(() -> builder.from("0.1.0", Mono::just)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.from("0.2.0", Mono::just)).isInstanceOf(IllegalArgumentException.class);
    }
}
