package org.town.core.model;

import java.util.Locale;

public enum Anchor {
    TOP_LEFT,
    BOTTOM_CENTER,
    CENTER;

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Anchor fromJson(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Anchor is null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
