package com.entitystore.persistence.postgres;

import com.entitystore.persistence.Filter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Translates a {@link Filter} into a SQL predicate over a JSONB {@code document} column.
 */
public final class FilterSqlRenderer {

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private FilterSqlRenderer() {
    }

    /**
     * @param filter       filter to render
     * @param firstIndex   number of the first placeholder to emit ({@code $firstIndex})
     */
    public static SqlFragment render(Filter filter, int firstIndex) {
        List<Object> bindings = new ArrayList<>();
        String sql = render(filter, firstIndex, bindings);
        return new SqlFragment(sql, bindings);
    }

    private static String render(Filter filter, int firstIndex, List<Object> bindings) {
        if (filter instanceof Filter.All) {
            return "TRUE";
        }
        if (filter instanceof Filter.Composite) {
            Filter.Composite composite = (Filter.Composite) filter;
            if (composite.getFilters().isEmpty()) {
                return composite.getLogic() == Filter.Logic.AND ? "TRUE" : "FALSE";
            }
            List<String> parts = new ArrayList<>();
            for (Filter child : composite.getFilters()) {
                parts.add(render(child, firstIndex, bindings));
            }
            String joiner = composite.getLogic() == Filter.Logic.AND ? " AND " : " OR ";
            return "(" + String.join(joiner, parts) + ")";
        }

        Filter.Condition condition = (Filter.Condition) filter;
        String column = column(condition.getField());
        switch (condition.getOperator()) {
            case EQ:
                return column + " = " + placeholder(condition.getValue(), firstIndex, bindings);
            case NE:
                return "(" + column + " IS NULL OR " + column + " <> "
                        + placeholder(condition.getValue(), firstIndex, bindings) + ")";
            case IN:
                if (condition.getValues().isEmpty()) {
                    return "FALSE";
                }
                List<String> placeholders = new ArrayList<>();
                for (Object value : condition.getValues()) {
                    placeholders.add(placeholder(value, firstIndex, bindings));
                }
                return column + " IN (" + String.join(", ", placeholders) + ")";
            default:
                throw new IllegalArgumentException("Unsupported operator " + condition.getOperator());
        }
    }

    private static String column(String field) {
        if (!FIELD_NAME.matcher(field).matches()) {
            throw new IllegalArgumentException("Invalid field name: " + field);
        }
        return "document->>'" + field + "'";
    }

    private static String placeholder(Object value, int firstIndex, List<Object> bindings) {
        bindings.add(String.valueOf(value));
        return "$" + (firstIndex + bindings.size() - 1);
    }
}
