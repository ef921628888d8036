package org.town.core.model;

import java.util.Locale;

public enum TileCategory {
    GROUND,
    BUILDING,
    PROP,
    WALL,
    MARKER;

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TileCategory fromJson(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category is null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
