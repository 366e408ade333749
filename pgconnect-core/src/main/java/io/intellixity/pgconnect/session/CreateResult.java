package io.intellixity.pgconnect.session;

import io.intellixity.pgconnect.row.Row;

/**
 * Outcome of {@link DbSession#findOrCreate(String, Row, String)}.
 *
 * @param value value of the requested return column, or null
 * @param row the caller's row, overlaid with the stored row when one was found
 * @param created true when the row was inserted, false when an existing row matched
 */
public record CreateResult(Object value, Row row, boolean created) {}
