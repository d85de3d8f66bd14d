package com.studioledger.backup.exception;

/**
 * A backup archive is corrupt or does not have the expected layout.
 */
public class ArchiveFormatException extends RuntimeException {

    public ArchiveFormatException(String message) {
        super(message);
    }

    public ArchiveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
