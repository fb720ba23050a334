package com.entitystore.persistence.memory;

import com.entitystore.persistence.Filter;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Evaluates a {@link Filter} against a JSON document held in memory.
 * Values are compared by their string form.
 */
public final class FilterMatcher {

    private FilterMatcher() {
    }

    public static boolean matches(Filter filter, JsonNode document) {
        if (filter instanceof Filter.All) {
            return true;
        }
        if (filter instanceof Filter.Composite) {
            Filter.Composite composite = (Filter.Composite) filter;
            if (composite.getLogic() == Filter.Logic.AND) {
                return composite.getFilters().stream().allMatch(f -> matches(f, document));
            }
            return composite.getFilters().stream().anyMatch(f -> matches(f, document));
        }
        Filter.Condition condition = (Filter.Condition) filter;
        JsonNode field = document.get(condition.getField());
        String actual = field == null || field.isNull() ? null : field.asText();

        switch (condition.getOperator()) {
            case EQ:
                return actual != null && actual.equals(String.valueOf(condition.getValue()));
            case NE:
                return actual == null || !actual.equals(String.valueOf(condition.getValue()));
            case IN:
                return actual != null && condition.getValues().stream()
                        .anyMatch(v -> actual.equals(String.valueOf(v)));
            default:
                throw new IllegalArgumentException("Unsupported operator " + condition.getOperator());
        }
    }
}
