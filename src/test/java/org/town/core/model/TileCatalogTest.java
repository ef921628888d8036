package org.town.core.model;

import org.junit.jupiter.api.Test;
import org.town.core.TestFixtures;
import org.town.core.error.CatalogFormatException;
import org.town.core.error.UnknownTileException;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TileCatalogTest {

    private static TileDefinition tile(int index, String id, ConnectivityType type, Set<Direction> connects) {
        return new TileDefinition(index, id, TileCategory.GROUND, "", index, 0, 1, 1,
                Layer.GROUND, true, Anchor.TOP_LEFT, type, connects, null, null);
    }

    @Test
    void rejectsDuplicateIds() {
        List<TileDefinition> tiles = List.of(
                tile(0, "road", ConnectivityType.PATH, EnumSet.of(Direction.EAST, Direction.WEST)),
                tile(1, "road", ConnectivityType.PATH, EnumSet.of(Direction.NORTH, Direction.SOUTH)));
        assertThrows(CatalogFormatException.class, () -> new TileCatalog("t", 16, 2, 1, null, tiles));
    }

    @Test
    void rejectsIntersectionWithTwoDirections() {
        List<TileDefinition> tiles = List.of(
                tile(0, "bad_cross", ConnectivityType.INTERSECTION, EnumSet.of(Direction.EAST, Direction.WEST)));
        CatalogFormatException e = assertThrows(CatalogFormatException.class,
                () -> new TileCatalog("t", 16, 1, 1, null, tiles));
        assertTrue(e.getMessage().contains("bad_cross"));
    }

    @Test
    void rejectsPathWithAdjacentDirections() {
        List<TileDefinition> tiles = List.of(
                tile(0, "bent_path", ConnectivityType.PATH, EnumSet.of(Direction.NORTH, Direction.EAST)));
        assertThrows(CatalogFormatException.class, () -> new TileCatalog("t", 16, 1, 1, null, tiles));
    }

    @Test
    void rejectsCornerWithOppositeDirections() {
        List<TileDefinition> tiles = List.of(
                tile(0, "straight_corner", ConnectivityType.CORNER, EnumSet.of(Direction.NORTH, Direction.SOUTH)));
        assertThrows(CatalogFormatException.class, () -> new TileCatalog("t", 16, 1, 1, null, tiles));
    }

    @Test
    void lookupsAndQueries() {
        TileCatalog catalog = TestFixtures.catalog();

        assertEquals("grass", catalog.byId("grass").id);
        assertNull(catalog.byId("nope"));
        assertThrows(UnknownTileException.class, () -> catalog.resolve("nope"));

        assertEquals(1, catalog.byCategory(TileCategory.BUILDING).size());
        assertEquals(4, catalog.byConnectivity(ConnectivityType.CAP).size());
        assertEquals(15, catalog.roadTiles().size());

        List<TileDefinition> t = catalog.withConnections(EnumSet.of(Direction.WEST, Direction.EAST, Direction.NORTH));
        assertEquals(1, t.size());
        assertEquals("road_t_north", t.get(0).id);
    }

    @Test
    void descriptionFilterMatchesAnyTermIgnoringCase() {
        TileCatalog catalog = TestFixtures.catalog();
        List<TileDefinition> hits = catalog.filterByDescription(catalog.tiles(), "CLOCK canal");
        assertEquals(2, hits.size());
        assertEquals("water", hits.get(0).id);
        assertEquals("town_hall", hits.get(1).id);
        assertTrue(catalog.filterByDescription(catalog.tiles(), "  ").isEmpty());
    }

    @Test
    void suggestionsStartWithTheRequestedLayer() {
        TileCatalog catalog = TestFixtures.catalog();

        assertEquals(List.of("town_hall", "lamp_post", "spawn_point", "stone_wall", "road_ew"),
                catalog.suggestIds(Layer.OBJECT, 5));
        assertEquals(List.of("road_ew", "road_ns", "road_ne"), catalog.suggestIds(Layer.GROUND, 3));

        UnknownTileException plain = assertThrows(UnknownTileException.class, () -> catalog.resolve("nope"));
        assertEquals("road_ew", plain.suggestions.get(0));

        UnknownTileException object = assertThrows(UnknownTileException.class,
                () -> catalog.resolve("statue", Layer.OBJECT));
        assertEquals("town_hall", object.suggestions.get(0));
        assertTrue(object.getMessage().contains("Available: town_hall, lamp_post"), object.getMessage());
    }
}
