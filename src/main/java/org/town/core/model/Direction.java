package org.town.core.model;

import java.util.Locale;

/**
 * Стороны света для связности и соседства на сетке.
 * Ось y растёт вниз: north = (0, -1).
 */
public enum Direction {
    NORTH(0, -1),
    SOUTH(0, 1),
    EAST(1, 0),
    WEST(-1, 0);

    public final int dx;
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public Direction opposite() {
        return switch (this) {
            case NORTH -> SOUTH;
            case SOUTH -> NORTH;
            case EAST -> WEST;
            case WEST -> EAST;
        };
    }

    /** Направление от (fromX, fromY) к соседней клетке; null если клетки не смежные. */
    public static Direction between(int fromX, int fromY, int toX, int toY) {
        int dx = toX - fromX;
        int dy = toY - fromY;
        for (Direction d : values()) {
            if (d.dx == dx && d.dy == dy) return d;
        }
        return null;
    }

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Direction fromJson(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Direction is null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
