package org.town.core.error;

/**
 * Прямоугольник тайла выходит за границы атласа: каталог и картинка не совпадают.
 * Для вызова рендера это фатально.
 */
public class MissingAtlasRegionException extends MapGenerationException {

    public MissingAtlasRegionException(String tileId, int x, int y, int w, int h, int atlasW, int atlasH) {
        super(MapErrorCode.MISSING_ATLAS_REGION,
                "Atlas region for tile \"" + tileId + "\" [" + x + "," + y + " " + w + "x" + h + "]"
                        + " exceeds atlas bounds " + atlasW + "x" + atlasH);
    }
}
