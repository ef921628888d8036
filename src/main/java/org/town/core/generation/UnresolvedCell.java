package org.town.core.generation;

import org.town.core.error.MapErrorCode;
import org.town.core.model.Direction;

import java.util.EnumSet;
import java.util.Set;

/** Клетка маршрута, которую не удалось заполнить. Не фатально. */
public final class UnresolvedCell {

    public final int x;
    public final int y;
    public final Set<Direction> required;
    public final MapErrorCode code;
    public final String message;

    public UnresolvedCell(int x, int y, Set<Direction> required, MapErrorCode code, String message) {
        this.x = x;
        this.y = y;
        this.required = required.isEmpty() ? EnumSet.noneOf(Direction.class) : EnumSet.copyOf(required);
        this.code = code;
        this.message = message;
    }

    @Override
    public String toString() {
        return message;
    }
}
