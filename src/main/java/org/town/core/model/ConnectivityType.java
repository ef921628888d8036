package org.town.core.model;

import java.util.Locale;

/**
 * Как тайл встраивается в направленную сеть.
 *
 * PATH         - две противоположные стороны (прямая дорога)
 * CORNER       - две смежные стороны (поворот)
 * INTERSECTION - 3-4 стороны
 * CAP          - одна сторона (тупик)
 * EDGE         - край (вода/стена), 0 или 1 сторона
 * NONE         - без связей
 */
public enum ConnectivityType {
    NONE,
    PATH,
    EDGE,
    CORNER,
    INTERSECTION,
    CAP;

    /** Дорожные типы: именно они образуют RoadNetwork. */
    public boolean isRoad() {
        return switch (this) {
            case PATH, CORNER, INTERSECTION, CAP -> true;
            default -> false;
        };
    }

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConnectivityType fromJson(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Connectivity type is null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
