package org.town.core.model;

import java.util.Objects;

/**
 * Клетка слоя: ссылка на уже разрешённый тайл каталога + слой.
 * Неизменяемая, поэтому слои можно копировать поверхностно.
 */
public final class Cell {

    public final TileDefinition tile;
    public final Layer layer;

    public Cell(TileDefinition tile, Layer layer) {
        this.tile = Objects.requireNonNull(tile, "tile");
        this.layer = Objects.requireNonNull(layer, "layer");
    }

    public String tileId() {
        return tile.id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell other)) return false;
        return tile.index == other.tile.index && tile.id.equals(other.tile.id) && layer == other.layer;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tile.id, layer);
    }

    @Override
    public String toString() {
        return tile.id + "@" + layer.jsonName();
    }
}
