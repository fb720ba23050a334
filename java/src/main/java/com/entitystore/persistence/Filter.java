package com.entitystore.persistence;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Backend-neutral filter over the top-level fields of a stored document.
 *
 * Rendered by each backend: matched in memory by {@code FilterMatcher},
 * translated to SQL by {@code FilterSqlRenderer}.
 */
public abstract class Filter {

    private static final Filter ALL = new All();

    Filter() {
    }

    public static Filter all() {
        return ALL;
    }

    public static Filter eq(String field, Object value) {
        return new Condition(field, Operator.EQ, Collections.singletonList(value));
    }

    public static Filter ne(String field, Object value) {
        return new Condition(field, Operator.NE, Collections.singletonList(value));
    }

    public static Filter in(String field, Collection<?> values) {
        return new Condition(field, Operator.IN, new ArrayList<>(values));
    }

    public static Filter and(Filter... filters) {
        return new Composite(Logic.AND, Arrays.asList(filters));
    }

    public static Filter and(List<Filter> filters) {
        return new Composite(Logic.AND, filters);
    }

    public static Filter or(Filter... filters) {
        return new Composite(Logic.OR, Arrays.asList(filters));
    }

    public static Filter or(List<Filter> filters) {
        return new Composite(Logic.OR, filters);
    }

    public enum Operator {
        EQ, NE, IN
    }

    public enum Logic {
        AND, OR
    }

    /**
     * Matches every document.
     */
    @ToString
    public static final class All extends Filter {
        private All() {
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Condition extends Filter {
        private final String field;
        private final Operator operator;
        private final List<Object> values;

        private Condition(String field, Operator operator, List<Object> values) {
            this.field = field;
            this.operator = operator;
            this.values = Collections.unmodifiableList(values);
        }

        public Object getValue() {
            return values.isEmpty() ? null : values.get(0);
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Composite extends Filter {
        private final Logic logic;
        private final List<Filter> filters;

        private Composite(Logic logic, List<Filter> filters) {
            this.logic = logic;
            this.filters = List.copyOf(filters);
        }
    }
}
