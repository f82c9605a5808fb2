package com.chambua.standings.queue;

/**
 * Dequeue order; declared lowest first so {@link #ordinal()} grows with urgency.
 */
public enum JobPriority {
    LOW, NORMAL, HIGH;

    public static JobPriority max(JobPriority a, JobPriority b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static JobPriority parseOrDefault(String value, JobPriority fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return JobPriority.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority '" + value + "', expected LOW, NORMAL or HIGH");
        }
    }
}
