package com.studioledger.backup.exception;

/**
 * A PostgreSQL client tool (pg_dump, psql) exited with an error or timed out.
 */
public class DatabaseCommandException extends RuntimeException {

    public DatabaseCommandException(String message) {
        super(message);
    }

    public DatabaseCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
