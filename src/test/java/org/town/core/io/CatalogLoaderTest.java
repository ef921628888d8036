package org.town.core.io;

import org.junit.jupiter.api.Test;
import org.town.core.TestFixtures;
import org.town.core.error.CatalogFormatException;
import org.town.core.model.Anchor;
import org.town.core.model.ConnectivityType;
import org.town.core.model.Direction;
import org.town.core.model.Layer;
import org.town.core.model.TileCatalog;
import org.town.core.model.TileCategory;
import org.town.core.model.TileDefinition;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogLoaderTest {

    @Test
    void loadsHeaderAndSpritesInOrder() {
        TileCatalog c = TestFixtures.catalog();
        assertEquals("test town", c.theme);
        assertEquals(16, c.tileSize);
        assertEquals(8, c.columns);
        assertEquals(4, c.rows);
        assertEquals("A small test town", c.sceneDescription);
        assertEquals(22, c.size());
        assertEquals("road_ew", c.get(0).id);
        assertEquals(15, c.byId("grass").index);
    }

    @Test
    void missingPlacementAndConnectivityUseDefaults() {
        TileDefinition t = TestFixtures.catalog().byId("cobblestone");
        assertEquals(TileCategory.GROUND, t.category);
        assertEquals(1, t.w);
        assertEquals(1, t.h);
        assertEquals(Layer.GROUND, t.layer);
        assertTrue(t.walkable);
        assertEquals(Anchor.TOP_LEFT, t.anchor);
        assertEquals(ConnectivityType.NONE, t.connectivity);
        assertTrue(t.connects().isEmpty());
        assertNull(t.contentSide);
        assertFalse(t.isRoad());
    }

    @Test
    void readsFootprintEdgeAndPathMetadata() {
        TileCatalog c = TestFixtures.catalog();

        TileDefinition hall = c.byId("town_hall");
        assertEquals(2, hall.w);
        assertEquals(2, hall.h);
        assertEquals(Layer.OBJECT, hall.layer);

        TileDefinition wall = c.byId("stone_wall");
        assertEquals(ConnectivityType.EDGE, wall.connectivity);
        assertEquals(Direction.NORTH, wall.contentSide);

        assertEquals(EnumSet.of(Direction.EAST, Direction.WEST), c.byId("road_ew").connects());
        assertFalse(c.byId("water").walkable);
    }

    @Test
    void invalidJsonIsAFormatError() {
        assertThrows(CatalogFormatException.class, () -> CatalogLoader.fromJson("{\"sprites\": ["));
        assertThrows(CatalogFormatException.class, () -> CatalogLoader.fromJson("[]"));
        assertThrows(CatalogFormatException.class, () -> CatalogLoader.fromJson("{\"tileSize\": 16}"));
    }

    @Test
    void missingRequiredFieldNamesTheSprite() {
        String json = "{\"tileSize\": 16, \"sprites\": [{\"id\": \"crate\", \"col\": 0, \"row\": 0}]}";
        CatalogFormatException e = assertThrows(CatalogFormatException.class, () -> CatalogLoader.fromJson(json));
        assertTrue(e.getMessage().contains("Sprite #0 (crate)"), e.getMessage());
        assertTrue(e.getMessage().contains("category"), e.getMessage());
    }

    @Test
    void unknownEnumValueIsAFormatError() {
        String json = "{\"tileSize\": 16, \"sprites\": [{\"id\": \"x\", \"category\": \"spaceship\", \"col\": 0, \"row\": 0}]}";
        assertThrows(CatalogFormatException.class, () -> CatalogLoader.fromJson(json));
    }

    @Test
    void connectivityArityIsChecked() {
        String json = "{\"tileSize\": 16, \"sprites\": [{\"id\": \"bent\", \"category\": \"ground\", \"col\": 0, \"row\": 0,"
                + " \"connectivity\": {\"type\": \"path\", \"connects\": [\"north\", \"east\"]}}]}";
        CatalogFormatException e = assertThrows(CatalogFormatException.class, () -> CatalogLoader.fromJson(json));
        assertTrue(e.getMessage().contains("bent"));
    }

    @Test
    void duplicateIdsAreRejected() {
        String json = "{\"tileSize\": 16, \"sprites\": ["
                + "{\"id\": \"a\", \"category\": \"ground\", \"col\": 0, \"row\": 0},"
                + "{\"id\": \"a\", \"category\": \"ground\", \"col\": 1, \"row\": 0}]}";
        assertThrows(CatalogFormatException.class, () -> CatalogLoader.fromJson(json));
    }
}
