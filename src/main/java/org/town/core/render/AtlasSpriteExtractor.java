package org.town.core.render;

import org.town.core.error.MissingAtlasRegionException;
import org.town.core.model.TileDefinition;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Вырезает регион тайла из атласа и масштабирует его без интерполяции (nearest neighbor),
 * чтобы пиксель-арт оставался чётким.
 */
public class AtlasSpriteExtractor implements SpriteExtractor {

    private final BufferedImage atlas;

    public AtlasSpriteExtractor(BufferedImage atlas) {
        if (atlas == null) {
            throw new IllegalArgumentException("Atlas image is null");
        }
        this.atlas = atlas;
    }

    @Override
    public BufferedImage extract(TileDefinition tile, int tileSize, int scaledTileSize) {
        int sx = tile.col * tileSize;
        int sy = tile.row * tileSize;
        int sw = tile.w * tileSize;
        int sh = tile.h * tileSize;

        if (sx < 0 || sy < 0 || sx + sw > atlas.getWidth() || sy + sh > atlas.getHeight()) {
            throw new MissingAtlasRegionException(tile.id, sx, sy, sw, sh, atlas.getWidth(), atlas.getHeight());
        }

        BufferedImage region = atlas.getSubimage(sx, sy, sw, sh);
        return scaleNearest(region, tile.w * scaledTileSize, tile.h * scaledTileSize);
    }

    /** Масштаб с интерполяцией NEAREST_NEIGHBOR: пиксели не смешиваются. */
    static BufferedImage scaleNearest(BufferedImage src, int outW, int outH) {
        int w = Math.max(1, outW);
        int h = Math.max(1, outH);
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
                    RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.setComposite(AlphaComposite.Src);
            g.drawImage(src, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
