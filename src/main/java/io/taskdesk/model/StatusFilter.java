package io.taskdesk.model;

public enum StatusFilter {
    ALL("all"),
    ACTIVE("active"),
    COMPLETED("completed");

    private final String param;

    StatusFilter(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static StatusFilter fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        for (StatusFilter value : values()) {
            if (value.param.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return ALL;
    }
}
