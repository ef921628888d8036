package org.town.core.render;

public final class RenderResult {

    /** Закодированное изображение (png/jpeg). */
    public final byte[] image;
    public final int width;
    public final int height;
    public final double scale;
    public final int groundTilesRendered;
    public final int objectTilesRendered;
    public final int uniqueSpritesUsed;

    public RenderResult(byte[] image,
                        int width,
                        int height,
                        double scale,
                        int groundTilesRendered,
                        int objectTilesRendered,
                        int uniqueSpritesUsed) {
        this.image = image;
        this.width = width;
        this.height = height;
        this.scale = scale;
        this.groundTilesRendered = groundTilesRendered;
        this.objectTilesRendered = objectTilesRendered;
        this.uniqueSpritesUsed = uniqueSpritesUsed;
    }

    @Override
    public String toString() {
        return width + "x" + height + " scale=" + scale
                + " ground=" + groundTilesRendered
                + " objects=" + objectTilesRendered
                + " sprites=" + uniqueSpritesUsed;
    }
}
