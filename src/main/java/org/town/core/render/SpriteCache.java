package org.town.core.render;

import org.town.core.model.TileDefinition;

import java.awt.image.BufferedImage;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Спрайты, извлечённые по одному разу на уникальный id тайла.
 *
 * Извлечения независимы друг от друга, поэтому при parallel=true идут через parallel stream.
 * Ошибка любого извлечения (например, MissingAtlasRegionException) пробрасывается вызывающему.
 */
public final class SpriteCache {

    private final Map<String, BufferedImage> sprites;

    private SpriteCache(Map<String, BufferedImage> sprites) {
        this.sprites = sprites;
    }

    public static SpriteCache build(Collection<TileDefinition> used,
                                    SpriteExtractor extractor,
                                    int tileSize,
                                    int scaledTileSize,
                                    boolean parallel) {
        Map<String, BufferedImage> out = new ConcurrentHashMap<>();
        if (parallel) {
            used.parallelStream().forEach(t -> out.put(t.id, extractor.extract(t, tileSize, scaledTileSize)));
        } else {
            for (TileDefinition t : used) {
                out.put(t.id, extractor.extract(t, tileSize, scaledTileSize));
            }
        }
        return new SpriteCache(out);
    }

    public BufferedImage get(String tileId) {
        return sprites.get(tileId);
    }

    public int size() {
        return sprites.size();
    }
}
