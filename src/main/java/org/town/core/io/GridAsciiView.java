package org.town.core.io;

import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileDefinition;

/**
 * Текстовый дамп слоёв: один символ на клетку.
 * Шапка - номера колонок (x % 10), слева - номер строки (y % 10).
 */
public final class GridAsciiView {

    private GridAsciiView() {}

    public static String ground(MapGrid grid) {
        StringBuilder sb = header(grid);
        for (int y = 0; y < grid.height; y++) {
            sb.append(y % 10).append(' ');
            for (int x = 0; x < grid.width; x++) {
                TileDefinition t = grid.tileAt(x, y, Layer.GROUND);
                if (t == null) sb.append('.');
                else sb.append(t.isRoad() ? 'R' : 'G');
            }
            sb.append('\n');
        }
        sb.append('\n').append("Legend: R=road, G=ground, .=empty");
        return sb.toString();
    }

    public static String objects(MapGrid grid) {
        StringBuilder sb = header(grid);
        for (int y = 0; y < grid.height; y++) {
            sb.append(y % 10).append(' ');
            for (int x = 0; x < grid.width; x++) {
                sb.append(objectChar(grid.tileAt(x, y, Layer.OBJECT)));
            }
            sb.append('\n');
        }
        sb.append('\n').append("Legend: B=building, P=prop, W=wall, M=marker, .=empty");
        return sb.toString();
    }

    private static char objectChar(TileDefinition t) {
        if (t == null) return '.';
        return switch (t.category) {
            case BUILDING -> 'B';
            case PROP -> 'P';
            case WALL -> 'W';
            case MARKER -> 'M';
            default -> '?';
        };
    }

    private static StringBuilder header(MapGrid grid) {
        StringBuilder sb = new StringBuilder("  ");
        for (int x = 0; x < grid.width; x++) sb.append(x % 10);
        return sb.append('\n');
    }
}
