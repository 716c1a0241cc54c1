package com.novemberain.jobs.mongodb;

/**
 * Named priority levels. Higher values run first among due jobs.
 */
public enum Priority {

    LOWEST("lowest", -20),
    LOW("low", -10),
    NORMAL("normal", 0),
    HIGH("high", 10),
    HIGHEST("highest", 20);

    private final String label;
    private final int value;

    Priority(String label, int value) {
        this.label = label;
        this.value = value;
    }

    public String label() {
        return label;
    }

    public int value() {
        return value;
    }

    /**
     * Turns a priority given as a number, a {@link Priority} or a level name into a number.
     * Numbers outside the {@code int} range are clamped to it.
     *
     * @param priority number, level or level name
     * @return the numeric priority, {@code null} for anything that is neither a number nor a known level
     */
    public static Integer parse(Object priority) {
        if (priority instanceof Number) {
            return clamp((Number) priority);
        }
        if (priority instanceof Priority) {
            return ((Priority) priority).value;
        }
        if (priority instanceof String) {
            for (Priority level : values()) {
                if (level.label.equals(priority)) {
                    return level.value;
                }
            }
        }
        return null;
    }

    // numbers beyond the int range keep their sign instead of wrapping
    private static int clamp(Number priority) {
        if (priority instanceof Double || priority instanceof Float) {
            return priority.intValue();
        }
        long value = priority.longValue();
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    /**
     * Same as {@link #parse(Object)} but falls back to {@code 0}.
     */
    public static int parseOrDefault(Object priority) {
        Integer parsed = parse(priority);
        return parsed != null ? parsed : NORMAL.value;
    }
}
