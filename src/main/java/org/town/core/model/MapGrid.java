package org.town.core.model;

import org.town.core.error.OutOfBoundsException;

/**
 * Двухслойная сетка карты (ground + object).
 *
 * Один экземпляр на запуск генерации, один писатель, без блокировок.
 * Неудачный setTile не меняет ни одной клетки.
 */
public class MapGrid {

    public final int width;
    public final int height;
    public final TileCatalog catalog;

    // [y][x]
    private final Cell[][] ground;
    private final Cell[][] objects;

    public MapGrid(int width, int height, TileCatalog catalog) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid size must be positive, got " + width + "x" + height);
        }
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog is null");
        }
        this.width = width;
        this.height = height;
        this.catalog = catalog;
        this.ground = new Cell[height][width];
        this.objects = new Cell[height][width];
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    // ─────────────────────────────────────────────
    // Запись / чтение
    // ─────────────────────────────────────────────

    /**
     * Записывает тайл по id. Сначала проверяем id, потом границы, и только затем пишем.
     *
     * @throws org.town.core.error.UnknownTileException id нет в каталоге
     * @throws OutOfBoundsException                      (x, y) вне сетки
     */
    public void setTile(int x, int y, String tileId, Layer layer) {
        TileDefinition tile = catalog.resolve(tileId, layer);
        setTile(x, y, tile, layer);
    }

    /** Запись уже разрешённого тайла. Последняя запись побеждает. */
    public void setTile(int x, int y, TileDefinition tile, Layer layer) {
        if (!inBounds(x, y)) {
            throw new OutOfBoundsException(x, y, width, height);
        }
        TileDefinition own = ownHandle(tile, layer);
        layerArray(layer)[y][x] = new Cell(own, layer);
        // Мультиклеточные тайлы: пишем только якорь, остальное рисует рендер.
    }

    /** Свой handle берём как есть; handle из чужого каталога заменяем своим по id. */
    private TileDefinition ownHandle(TileDefinition tile, Layer layer) {
        if (tile != null && tile.index >= 0 && tile.index < catalog.size() && catalog.get(tile.index) == tile) {
            return tile;
        }
        return catalog.resolve(tile == null ? null : tile.id, layer);
    }

    /** null для пустой клетки или вне границ; никогда не бросает. */
    public Cell getTile(int x, int y, Layer layer) {
        if (!inBounds(x, y)) return null;
        return layerArray(layer)[y][x];
    }

    public void clearTile(int x, int y, Layer layer) {
        if (!inBounds(x, y)) return;
        layerArray(layer)[y][x] = null;
    }

    /** Дорога = клетка земляного слоя с дорожным типом связности. */
    public boolean isRoadAt(int x, int y) {
        Cell c = getTile(x, y, Layer.GROUND);
        return c != null && c.tile.isRoad();
    }

    public TileDefinition tileAt(int x, int y, Layer layer) {
        Cell c = getTile(x, y, layer);
        return c == null ? null : c.tile;
    }

    /** Поверхностная копия: клетки неизменяемые. */
    public MapGrid copy() {
        MapGrid out = new MapGrid(width, height, catalog);
        for (int y = 0; y < height; y++) {
            System.arraycopy(ground[y], 0, out.ground[y], 0, width);
            System.arraycopy(objects[y], 0, out.objects[y], 0, width);
        }
        return out;
    }

    /** Поячеечное сравнение раскладки (для round-trip проверок). */
    public boolean sameLayout(MapGrid other) {
        if (other == null || other.width != width || other.height != height) return false;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!sameCell(ground[y][x], other.ground[y][x])) return false;
                if (!sameCell(objects[y][x], other.objects[y][x])) return false;
            }
        }
        return true;
    }

    private static boolean sameCell(Cell a, Cell b) {
        if (a == null || b == null) return a == b;
        return a.tileId().equals(b.tileId()) && a.layer == b.layer;
    }

    private Cell[][] layerArray(Layer layer) {
        return layer == Layer.OBJECT ? objects : ground;
    }
}
