package com.example.apo.pattern;

/**
 * Failure reported by a {@link PatternStore}.
 *
 * <ul>
 *   <li>{@link Kind#UNAVAILABLE} – the backing persistence could not be reached. The
 *       operation is aborted and the exception propagates to the caller.</li>
 *   <li>{@link Kind#CORRUPT} – a stored record failed validation on read. Stores skip such
 *       rows with a warning; the exception type exists so the skip can be reported and
 *       counted uniformly.</li>
 * </ul>
 */
public class StorageException extends RuntimeException {

    public enum Kind { UNAVAILABLE, CORRUPT }

    private final Kind kind;

    public StorageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StorageException unavailable(String message, Throwable cause) {
        return new StorageException(Kind.UNAVAILABLE, message, cause);
    }

    public static StorageException corrupt(String message, Throwable cause) {
        return new StorageException(Kind.CORRUPT, message, cause);
    }

    public Kind kind() {
        return kind;
    }
}
