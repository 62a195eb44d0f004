package com.evoila.argus.common.indirection;

/**
 * A friendly-name column that does not exist in the analytical store.
 *
 * @param column Column as sent by clients, e.g. {@code pattern}
 * @param targetColumn Registry column the resolved ids are filtered on, e.g. {@code pattern_id}
 */
public record IndirectionRule(String column, String targetColumn) {}
