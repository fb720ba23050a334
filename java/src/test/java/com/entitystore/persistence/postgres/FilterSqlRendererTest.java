package com.entitystore.persistence.postgres;

import com.entitystore.persistence.Filter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterSqlRendererTest {

    @Test
    void render_All() {
        SqlFragment fragment = FilterSqlRenderer.render(Filter.all(), 1);

        assertThat(fragment.getSql()).isEqualTo("TRUE");
        assertThat(fragment.getBindings()).isEmpty();
    }

    @Test
    void render_NestedConditionsNumberPlaceholdersFromOffset() {
        Filter filter = Filter.and(
                Filter.eq("entity_id", "e1"),
                Filter.or(Filter.ne("tag_id", "t1"), Filter.in("tag_id", List.of("t2", "t3"))));

        SqlFragment fragment = FilterSqlRenderer.render(filter, 2);

        assertThat(fragment.getSql()).isEqualTo(
                "(document->>'entity_id' = $2 AND "
                        + "((document->>'tag_id' IS NULL OR document->>'tag_id' <> $3) OR document->>'tag_id' IN ($4, $5)))");
        assertThat(fragment.getBindings()).containsExactly("e1", "t1", "t2", "t3");
    }

    @Test
    void render_EmptyIn() {
        assertThat(FilterSqlRenderer.render(Filter.in("id", List.of()), 1).getSql()).isEqualTo("FALSE");
    }

    @Test
    void render_RejectsUnsafeFieldNames() {
        assertThatThrownBy(() -> FilterSqlRenderer.render(Filter.eq("id'; DROP TABLE x; --", "1"), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
