package io.sqltx;

/**
 * Outcome of a data-modifying statement.
 *
 * @param rowsAffected number of rows changed by the statement (0 for statements that only
 *                     return rows)
 * @param lastInsertId decimal id of the last inserted row on the executing connection; SQLite
 *                     reports the row id, MySQL the auto-increment value, PostgreSQL always
 *                     {@code null}
 */
public record ExecuteResult(long rowsAffected, String lastInsertId) {

    public ExecuteResult {
        if (rowsAffected < 0) {
            throw new IllegalArgumentException("rowsAffected must be >= 0");
        }
    }
}
