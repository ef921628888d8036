package org.town.core.io;

import org.junit.jupiter.api.Test;
import org.town.core.model.TileCatalog;
import org.town.core.model.TileCategory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StandardAtlasLayoutTest {

    @Test
    void layoutHasFiftyTwoSlots() {
        List<StandardAtlasLayout.AtlasSlot> slots = StandardAtlasLayout.buildSlots();
        assertEquals(52, slots.size());
        assertEquals(52, StandardAtlasLayout.slotCount());

        long buildings = slots.stream().filter(s -> s.category() == TileCategory.BUILDING).count();
        long props = slots.stream().filter(s -> s.category() == TileCategory.PROP).count();
        assertEquals(4, buildings);
        assertEquals(32, props);
    }

    @Test
    void slotsFitInsideTheAtlas() {
        for (StandardAtlasLayout.AtlasSlot s : StandardAtlasLayout.buildSlots()) {
            assertTrue(s.col() + s.w() <= StandardAtlasLayout.COLUMNS, s.hint());
            assertTrue(s.row() + s.h() <= StandardAtlasLayout.ROWS, s.hint());
        }
    }

    @Test
    void placeholderCatalogIsUsable() {
        TileCatalog c = StandardAtlasLayout.placeholderCatalog(32);
        assertEquals(52, c.size());
        assertEquals(32, c.tileSize);
        assertEquals(8, c.roadTiles().size());
        assertTrue(c.contains("road_t_south"));
        assertTrue(c.contains("building_3"));
        assertTrue(c.contains("prop_31"));

        assertTrue(c.byId("ground_0").walkable);
        assertFalse(c.byId("ground_7").walkable);
        assertTrue(c.byId("prop_11").walkable);
        assertFalse(c.byId("prop_0").walkable);
        assertEquals(6, c.byId("building_3").col);
    }
}
