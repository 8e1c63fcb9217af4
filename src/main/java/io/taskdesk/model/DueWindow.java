package io.taskdesk.model;

/**
 * Due-date windows evaluated against the current calendar date.
 */
public enum DueWindow {
    ALL("all"),
    OVERDUE("overdue"),
    TODAY("today"),
    WEEK("week");

    public static final int WEEK_DAYS = 7;

    private final String param;

    DueWindow(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static DueWindow fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        for (DueWindow value : values()) {
            if (value.param.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return ALL;
    }
}
