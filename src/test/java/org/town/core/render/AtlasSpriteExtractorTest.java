package org.town.core.render;

import org.junit.jupiter.api.Test;
import org.town.core.TestFixtures;
import org.town.core.error.MissingAtlasRegionException;
import org.town.core.model.TileCatalog;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AtlasSpriteExtractorTest {

    private final TileCatalog catalog = TestFixtures.catalog();

    /** Каждая клетка атласа залита своим цветом: 0xFF000000 | (col << 16) | (row << 8). */
    static BufferedImage gridAtlas(int cols, int rows, int tileSize) {
        BufferedImage img = new BufferedImage(cols * tileSize, rows * tileSize, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < img.getHeight(); y++) {
            for (int x = 0; x < img.getWidth(); x++) {
                img.setRGB(x, y, cellColor(x / tileSize, y / tileSize));
            }
        }
        return img;
    }

    static int cellColor(int col, int row) {
        return 0xFF000000 | (col * 20) << 16 | (row * 40) << 8 | 0x11;
    }

    @Test
    void extractsTheTileRegionAtTheRequestedSize() {
        AtlasSpriteExtractor ex = new AtlasSpriteExtractor(gridAtlas(8, 4, 16));

        BufferedImage grass = ex.extract(catalog.byId("grass"), 16, 8);
        assertEquals(8, grass.getWidth());
        assertEquals(8, grass.getHeight());
        assertEquals(cellColor(7, 1), grass.getRGB(4, 4));

        BufferedImage hall = ex.extract(catalog.byId("town_hall"), 16, 8);
        assertEquals(16, hall.getWidth());
        assertEquals(16, hall.getHeight());
        assertEquals(cellColor(2, 2), hall.getRGB(0, 0));
        assertEquals(cellColor(3, 3), hall.getRGB(15, 15));
    }

    @Test
    void regionOutsideAtlasIsReported() {
        AtlasSpriteExtractor ex = new AtlasSpriteExtractor(gridAtlas(2, 2, 16));
        ex.extract(catalog.byId("road_ns"), 16, 16);
        assertThrows(MissingAtlasRegionException.class, () -> ex.extract(catalog.byId("grass"), 16, 16));
    }

    @Test
    void nearestNeighborKeepsHardEdges() {
        BufferedImage src = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        int black = 0xFF000000;
        int white = 0xFFFFFFFF;
        src.setRGB(0, 0, black);
        src.setRGB(1, 0, white);
        src.setRGB(0, 1, white);
        src.setRGB(1, 1, black);

        BufferedImage up = AtlasSpriteExtractor.scaleNearest(src, 4, 4);
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                int expected = (x < 2) == (y < 2) ? black : white;
                assertEquals(expected, up.getRGB(x, y), "pixel " + x + "," + y);
            }
        }

        BufferedImage down = AtlasSpriteExtractor.scaleNearest(gridAtlas(2, 2, 4), 2, 2);
        assertEquals(cellColor(0, 0), down.getRGB(0, 0));
        assertEquals(cellColor(1, 1), down.getRGB(1, 1));
    }

    @Test
    void scalingKeepsTranslucentPixelsUnchanged() {
        BufferedImage src = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        src.setRGB(0, 0, 0x80FF0000);

        BufferedImage up = AtlasSpriteExtractor.scaleNearest(src, 3, 3);
        assertEquals(3, up.getWidth());
        assertEquals(0x80FF0000, up.getRGB(0, 0));
        assertEquals(0x80FF0000, up.getRGB(2, 2));
    }
}
