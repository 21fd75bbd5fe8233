package io.crontask.core.history;

public final class InvalidQueryRangeException extends IllegalArgumentException {
    public InvalidQueryRangeException(String message) {
        super(message);
    }
}
