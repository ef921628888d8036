package org.town.core.model;

import java.util.List;

/**
 * Связная компонента дорожной сети (4-соседство) и её ограничивающий прямоугольник.
 * Эфемерна: пересчитывается при каждой проверке.
 */
public final class Island {

    public final List<GridPoint> tiles;
    public final int minX;
    public final int maxX;
    public final int minY;
    public final int maxY;

    public Island(List<GridPoint> tiles) {
        if (tiles == null || tiles.isEmpty()) {
            throw new IllegalArgumentException("Island must contain at least one tile");
        }
        this.tiles = List.copyOf(tiles);

        int mnX = Integer.MAX_VALUE;
        int mxX = Integer.MIN_VALUE;
        int mnY = Integer.MAX_VALUE;
        int mxY = Integer.MIN_VALUE;
        for (GridPoint p : tiles) {
            mnX = Math.min(mnX, p.x());
            mxX = Math.max(mxX, p.x());
            mnY = Math.min(mnY, p.y());
            mxY = Math.max(mxY, p.y());
        }
        this.minX = mnX;
        this.maxX = mxX;
        this.minY = mnY;
        this.maxY = mxY;
    }

    public int size() {
        return tiles.size();
    }

    public boolean contains(int x, int y) {
        return tiles.contains(new GridPoint(x, y));
    }

    @Override
    public String toString() {
        return "Island{tiles=" + tiles.size() + ", bounds=[" + minX + ".." + maxX + ", " + minY + ".." + maxY + "]}";
    }
}
