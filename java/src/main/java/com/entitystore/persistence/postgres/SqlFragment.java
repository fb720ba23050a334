package com.entitystore.persistence.postgres;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.r2dbc.core.DatabaseClient;

import java.util.List;

/**
 * A piece of SQL with its positional ({@code $n}) bindings.
 */
@Getter
@ToString
@AllArgsConstructor
public class SqlFragment {

    private final String sql;
    private final List<Object> bindings;

    /**
     * Bind values to a spec whose earlier placeholders are already bound.
     *
     * @param firstBindIndex zero-based bind position of this fragment's first placeholder
     */
    public DatabaseClient.GenericExecuteSpec bindTo(DatabaseClient.GenericExecuteSpec spec, int firstBindIndex) {
        DatabaseClient.GenericExecuteSpec bound = spec;
        for (int i = 0; i < bindings.size(); i++) {
            bound = bound.bind(firstBindIndex + i, bindings.get(i));
        }
        return bound;
    }
}
