package com.embeddingstudio.vectordb.common.query;

import java.util.List;

/**
 * A SQL boolean expression with positional {@code ?} placeholders and their values, in order.
 */
public record SqlFragment(String sql, List<Object> parameters) {

    public SqlFragment {
        parameters = List.copyOf(parameters);
    }
}
