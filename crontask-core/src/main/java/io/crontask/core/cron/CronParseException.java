package io.crontask.core.cron;

public final class CronParseException extends IllegalArgumentException {
    public enum Kind {
        INVALID_FORMAT,
        INVALID_FIELD
    }

    private final Kind kind;

    public CronParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
