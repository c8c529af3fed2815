package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Structured, non-fatal remark attached to a result.
 *
 * <p>
 * Every condition that is logged at {@code WARN} during an analysis is also
 * recorded as a note so that automated callers can branch on the
 * {@link #getCode() code} instead of parsing log output.
 * </p>
 *
 * @since 1.0.0
 */
public final class Note implements Serializable {

    private static final long serialVersionUID = 1L;

    private final NoteCode code;
    private final String message;

    public Note(NoteCode code, String message) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public static Note of(NoteCode code, String message) {
        return new Note(code, message);
    }

    public NoteCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Note note))
            return false;
        return code == note.code && message.equals(note.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
