package com.example.roster.engine;

import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shift band. Declaration order (morning, afternoon, night) fixes the order of slots within a day.
 */
public enum ShiftType {
    MORNING("morning", LocalTime.of(6, 0), LocalTime.of(14, 0)),
    AFTERNOON("afternoon", LocalTime.of(14, 0), LocalTime.of(22, 0)),
    NIGHT("night", LocalTime.of(22, 0), LocalTime.of(6, 0));

    private static final Map<String, ShiftType> ALIASES = Map.of(
            "morning", MORNING,
            "afternoon", AFTERNOON,
            "noon", AFTERNOON,
            "evening", AFTERNOON,
            "night", NIGHT,
            "overnight", NIGHT);

    private final String key;
    private final LocalTime defaultStart;
    private final LocalTime defaultEnd;

    ShiftType(String key, LocalTime defaultStart, LocalTime defaultEnd) {
        this.key = key;
        this.defaultStart = defaultStart;
        this.defaultEnd = defaultEnd;
    }

    public String getKey() {
        return key;
    }

    public LocalTime getDefaultStart() {
        return defaultStart;
    }

    public LocalTime getDefaultEnd() {
        return defaultEnd;
    }

    /**
     * Resolves a shift key or one of its aliases, ignoring case and surrounding blanks.
     */
    public static Optional<ShiftType> fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(raw.trim().toLowerCase(Locale.ROOT)));
    }
}
