package org.town.core.render;

import org.town.core.model.TileDefinition;

import java.awt.image.BufferedImage;

/**
 * Источник спрайтов для рендера. Вызывается один раз на уникальный тайл,
 * может вызываться из нескольких потоков для разных тайлов.
 */
public interface SpriteExtractor {

    /**
     * @param tileSize       размер клетки атласа в пикселях
     * @param scaledTileSize размер клетки на выходном холсте
     * @return спрайт размером (w * scaledTileSize) x (h * scaledTileSize)
     */
    BufferedImage extract(TileDefinition tile, int tileSize, int scaledTileSize);
}
