package com.example.roster.engine;

import com.example.roster.exception.ScheduleValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Time windows of every shift type for one deployment.
 */
public final class ShiftCatalog {

    static final long MAX_SHIFT_MINUTES = 16 * 60;

    private final Map<ShiftType, ShiftTemplate> templates;

    private ShiftCatalog(Map<ShiftType, ShiftTemplate> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    public static ShiftCatalog defaults() {
        EnumMap<ShiftType, ShiftTemplate> map = new EnumMap<>(ShiftType.class);
        for (ShiftType type : ShiftType.values()) {
            map.put(type, ShiftTemplate.defaultFor(type));
        }
        return new ShiftCatalog(map);
    }

    /**
     * Builds a catalog from explicit templates; missing types fall back to their defaults.
     */
    public static ShiftCatalog of(Collection<ShiftTemplate> overrides) {
        EnumMap<ShiftType, ShiftTemplate> map = new EnumMap<>(ShiftType.class);
        for (ShiftType type : ShiftType.values()) {
            map.put(type, ShiftTemplate.defaultFor(type));
        }
        for (ShiftTemplate template : overrides) {
            long minutes = template.durationMinutes();
            if (minutes <= 0 || minutes > MAX_SHIFT_MINUTES) {
                throw new ScheduleValidationException(ScheduleValidationException.INVALID_SHIFT_TEMPLATE,
                        "Shift " + template.type().getKey() + " must last between 0 and 16 hours, got "
                                + minutes + " minutes",
                        template.type());
            }
            map.put(template.type(), template);
        }
        return new ShiftCatalog(map);
    }

    public ShiftTemplate templateOf(ShiftType type) {
        return templates.get(type);
    }

    public long durationMinutes(ShiftType type) {
        return templates.get(type).durationMinutes();
    }

    public Map<ShiftType, ShiftTemplate> templates() {
        return templates;
    }
}
