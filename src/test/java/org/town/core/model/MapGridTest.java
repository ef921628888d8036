package org.town.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.town.core.TestFixtures;
import org.town.core.error.MapErrorCode;
import org.town.core.error.OutOfBoundsException;
import org.town.core.error.UnknownTileException;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapGridTest {

    private TileCatalog catalog;
    private MapGrid grid;

    @BeforeEach
    void setUp() {
        catalog = TestFixtures.catalog();
        grid = new MapGrid(6, 4, catalog);
    }

    @Test
    void readReturnsWhatWasWritten() {
        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x < grid.width; x++) {
                grid.setTile(x, y, "grass", Layer.GROUND);
                Cell c = grid.getTile(x, y, Layer.GROUND);
                assertEquals("grass", c.tileId());
                assertEquals(Layer.GROUND, c.layer);
            }
        }
        grid.setTile(2, 1, "lamp_post", Layer.OBJECT);
        assertEquals("lamp_post", grid.getTile(2, 1, Layer.OBJECT).tileId());
        assertEquals("grass", grid.getTile(2, 1, Layer.GROUND).tileId());
    }

    @Test
    void lastWriteWins() {
        grid.setTile(1, 1, "grass", Layer.GROUND);
        grid.setTile(1, 1, "water", Layer.GROUND);
        assertEquals("water", grid.getTile(1, 1, Layer.GROUND).tileId());
    }

    @Test
    void outOfBoundsWriteFailsAndChangesNothing() {
        MapGrid filled = TestFixtures.grassGrid(catalog, 6, 4);
        MapGrid before = filled.copy();

        OutOfBoundsException left = assertThrows(OutOfBoundsException.class,
                () -> filled.setTile(-1, 0, "road_ew", Layer.GROUND));
        assertEquals(MapErrorCode.OUT_OF_BOUNDS, left.code());
        assertThrows(OutOfBoundsException.class, () -> filled.setTile(filled.width, 0, "road_ew", Layer.GROUND));
        assertThrows(OutOfBoundsException.class, () -> filled.setTile(0, filled.height, "road_ew", Layer.OBJECT));

        assertTrue(filled.sameLayout(before));
    }

    @Test
    void unknownTileFailsWithSuggestions() {
        UnknownTileException e = assertThrows(UnknownTileException.class,
                () -> grid.setTile(0, 0, "no_such_tile", Layer.GROUND));
        assertEquals(MapErrorCode.UNKNOWN_TILE, e.code());
        assertFalse(e.suggestions.isEmpty());
        assertNull(grid.getTile(0, 0, Layer.GROUND));
    }

    @Test
    void unknownObjectSuggestsObjectsFirst() {
        UnknownTileException e = assertThrows(UnknownTileException.class,
                () -> grid.setTile(0, 0, "fountain", Layer.OBJECT));
        assertEquals("town_hall", e.suggestions.get(0));
        assertNull(grid.getTile(0, 0, Layer.OBJECT));
    }

    @Test
    void ownHandleIsStoredAsIs() {
        TileDefinition road = catalog.byId("road_ew");
        grid.setTile(1, 1, road, Layer.GROUND);
        assertSame(road, grid.getTile(1, 1, Layer.GROUND).tile);
    }

    @Test
    void foreignHandleIsSwappedForOwnDefinition() {
        TileCatalog other = TestFixtures.catalog();
        TileDefinition foreign = other.byId("road_ew");
        assertNotSame(catalog.byId("road_ew"), foreign);

        grid.setTile(1, 1, foreign, Layer.GROUND);
        assertSame(catalog.byId("road_ew"), grid.getTile(1, 1, Layer.GROUND).tile);
    }

    @Test
    void foreignHandleWithUnknownIdIsRejected() {
        TileDefinition stranger = new TileDefinition(0, "road_ew_old", TileCategory.GROUND, "", 0, 0, 1, 1,
                Layer.GROUND, true, Anchor.TOP_LEFT, ConnectivityType.PATH,
                EnumSet.of(Direction.EAST, Direction.WEST), null, null);
        assertThrows(UnknownTileException.class, () -> grid.setTile(0, 0, stranger, Layer.GROUND));
        assertNull(grid.getTile(0, 0, Layer.GROUND));
    }

    @Test
    void readsOutsideBoundsReturnNull() {
        assertNull(grid.getTile(-1, 0, Layer.GROUND));
        assertNull(grid.getTile(0, 99, Layer.OBJECT));
        assertNull(grid.getTile(3, 3, Layer.GROUND));
    }

    @Test
    void clearIsNoOpOutsideBounds() {
        grid.setTile(0, 0, "grass", Layer.GROUND);
        grid.clearTile(-5, -5, Layer.GROUND);
        grid.clearTile(0, 0, Layer.OBJECT);
        assertEquals("grass", grid.getTile(0, 0, Layer.GROUND).tileId());

        grid.clearTile(0, 0, Layer.GROUND);
        assertNull(grid.getTile(0, 0, Layer.GROUND));
    }

    @Test
    void roadDetectionUsesGroundConnectivity() {
        grid.setTile(0, 0, "road_ew", Layer.GROUND);
        grid.setTile(1, 0, "grass", Layer.GROUND);
        assertTrue(grid.isRoadAt(0, 0));
        assertFalse(grid.isRoadAt(1, 0));
        assertFalse(grid.isRoadAt(2, 0));
        assertFalse(grid.isRoadAt(-1, 0));
    }

    @Test
    void rejectsEmptySize() {
        assertThrows(IllegalArgumentException.class, () -> new MapGrid(0, 5, catalog));
        assertThrows(IllegalArgumentException.class, () -> new MapGrid(5, -1, catalog));
    }
}
