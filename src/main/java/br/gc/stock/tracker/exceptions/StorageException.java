package br.gc.stock.tracker.exceptions;

import lombok.Getter;

/**
 * Failure reported by the relational store. Never retried by the stores themselves.
 */
@Getter
public class StorageException extends StockTrackerException {

    public enum Kind {
        CONSTRAINT_VIOLATION,
        UNAVAILABLE
    }

    private final Kind kind;

    public StorageException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StorageException constraintViolation(String message) {
        return new StorageException(Kind.CONSTRAINT_VIOLATION, message);
    }

    public static StorageException constraintViolation(String message, Throwable cause) {
        return new StorageException(Kind.CONSTRAINT_VIOLATION, message, cause);
    }

    public static StorageException unavailable(String message, Throwable cause) {
        return new StorageException(Kind.UNAVAILABLE, message, cause);
    }
}
