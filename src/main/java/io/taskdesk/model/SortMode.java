package io.taskdesk.model;

public enum SortMode {
    DEFAULT("default"),
    DUE_DATE("due_date"),
    CREATED_AT("created_at"),
    PRIORITY("priority"),
    ALPHA("alpha");

    private final String param;

    SortMode(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static SortMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        for (SortMode value : values()) {
            if (value.param.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return DEFAULT;
    }
}
