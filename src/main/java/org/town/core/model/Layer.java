package org.town.core.model;

import java.util.Locale;

public enum Layer {
    GROUND,
    OBJECT;

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Принимает и "object", и "objects" (ключ слоя в map.json). */
    public static Layer fromJson(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Layer is null");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "ground" -> GROUND;
            case "object", "objects" -> OBJECT;
            default -> throw new IllegalArgumentException("Unknown layer: " + value);
        };
    }
}
