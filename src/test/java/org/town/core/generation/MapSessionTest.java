package org.town.core.generation;

import org.junit.jupiter.api.Test;
import org.town.core.TestFixtures;
import org.town.core.error.MapErrorCode;
import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileCatalog;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapSessionTest {

    private final TileCatalog catalog = TestFixtures.catalog();

    private MapSession grassSession(int w, int h, int budget) {
        return new MapSession(TestFixtures.grassGrid(catalog, w, h), budget, false);
    }

    // ─────────────────────────────────────────────
    // drawRoad
    // ─────────────────────────────────────────────

    @Test
    void disconnectedRoadIsRejectedWithoutSideEffects() {
        MapSession s = grassSession(8, 8, 16);
        assertTrue(s.drawRoad(0, 0, 3, 0).success);
        assertEquals(12, s.budgetRemaining());

        MapGrid before = s.grid.copy();
        ActionResult r = s.drawRoad(0, 5, 3, 5);

        assertFalse(r.success);
        assertEquals(MapErrorCode.DISCONNECTED_PLACEMENT, r.code);
        assertTrue(r.suggestion.contains("(0, 0)"), r.suggestion);
        assertTrue(s.grid.sameLayout(before));
        assertEquals(12, s.budgetRemaining());
    }

    @Test
    void roadTouchingNetworkIsAccepted() {
        MapSession s = grassSession(8, 8, 16);
        s.drawRoad(0, 0, 3, 0);

        ActionResult r = s.drawRoad(3, 1, 3, 3);
        assertTrue(r.success, r.toString());
        assertEquals(3, r.tilesPlaced);
        assertEquals(9, r.budgetRemaining);
        assertEquals(7, s.trackedRoads().size());
    }

    @Test
    void firstRoadNeedsNoConnection() {
        MapSession s = grassSession(6, 6, 9);
        ActionResult r = s.drawRoad(5, 5, 2, 5);
        assertTrue(r.success);
        assertEquals(4, r.tilesPlaced);
    }

    @Test
    void budgetIsCheckedBeforePlacing() {
        MapSession s = grassSession(8, 8, 5);

        ActionResult tooLong = s.drawRoad(0, 0, 5, 0);
        assertEquals(MapErrorCode.BUDGET_EXCEEDED, tooLong.code);
        assertTrue(s.validate().islands.isEmpty());

        assertTrue(s.drawRoad(0, 0, 4, 0).success);
        assertEquals(0, s.budgetRemaining());
        assertEquals(MapErrorCode.BUDGET_EXCEEDED, s.placeRoad(5, 0, "road_end_w").code);
    }

    @Test
    void outOfBoundsEndpointsAreRejected() {
        MapSession s = grassSession(4, 4, 4);
        assertEquals(MapErrorCode.OUT_OF_BOUNDS, s.drawRoad(0, 0, 4, 0).code);
    }

    // ─────────────────────────────────────────────
    // placeRoad
    // ─────────────────────────────────────────────

    @Test
    void placeRoadChecksAdjacentRoads() {
        MapSession s = grassSession(5, 5, 10);

        ActionResult first = s.placeRoad(2, 2, "road_ew");
        assertTrue(first.success);
        assertEquals(2, first.warnings.size());
        assertEquals(9, first.budgetRemaining);

        ActionResult mismatch = s.placeRoad(3, 2, "road_ns");
        assertFalse(mismatch.success);
        assertEquals(MapErrorCode.NO_MATCHING_CONNECTIVITY, mismatch.code);
        assertEquals("Try \"road_end_w\" instead.", mismatch.suggestion);
        assertEquals("grass", s.grid.getTile(3, 2, Layer.GROUND).tileId());

        assertTrue(s.placeRoad(3, 2, "road_end_w").success);
        assertTrue(s.validate().connected);
    }

    @Test
    void placeRoadRejectsUnknownAndNonRoadTiles() {
        MapSession s = grassSession(3, 3, 4);

        ActionResult unknown = s.placeRoad(0, 0, "highway");
        assertEquals(MapErrorCode.UNKNOWN_TILE, unknown.code);
        assertTrue(unknown.suggestion.contains("road_ew"));

        assertEquals(MapErrorCode.INVALID_PLACEMENT, s.placeRoad(0, 0, "grass").code);
        assertEquals(MapErrorCode.OUT_OF_BOUNDS, s.placeRoad(3, 0, "road_ew").code);
    }

    // ─────────────────────────────────────────────
    // fillGround
    // ─────────────────────────────────────────────

    @Test
    void fillGroundClampsAndSkipsExisting() {
        MapSession s = new MapSession(new MapGrid(4, 4, catalog), 4, false);

        ActionResult all = s.fillGround(5, 5, -2, -2, "grass", false);
        assertTrue(all.success);
        assertEquals(16, all.tilesPlaced);

        ActionResult kept = s.fillGround(0, 0, 1, 1, "water", false);
        assertEquals(0, kept.tilesPlaced);
        assertEquals(4, kept.tilesSkipped);
        assertEquals("grass", s.grid.getTile(0, 0, Layer.GROUND).tileId());

        ActionResult over = s.fillGround(1, 1, 0, 0, "water", true);
        assertEquals(4, over.tilesPlaced);
        assertEquals("water", s.grid.getTile(1, 1, Layer.GROUND).tileId());
        assertEquals("grass", s.grid.getTile(2, 2, Layer.GROUND).tileId());
    }

    @Test
    void fillGroundAcceptsOnlyGroundTiles() {
        MapSession s = new MapSession(new MapGrid(4, 4, catalog), 4, false);

        assertEquals(MapErrorCode.INVALID_PLACEMENT, s.fillGround(0, 0, 3, 3, "lamp_post", false).code);
        ActionResult unknown = s.fillGround(0, 0, 3, 3, "lava", false);
        assertEquals(MapErrorCode.UNKNOWN_TILE, unknown.code);
        assertTrue(unknown.suggestion.startsWith("Available ground tiles: "));
        assertNull(s.grid.getTile(0, 0, Layer.GROUND));
    }

    // ─────────────────────────────────────────────
    // placeAsset / placeAssets
    // ─────────────────────────────────────────────

    @Test
    void objectsNeedGroundAndAFreeCell() {
        MapSession s = new MapSession(new MapGrid(4, 4, catalog), 4, false);

        assertEquals(MapErrorCode.INVALID_PLACEMENT, s.placeAsset(1, 1, "lamp_post", null).code);

        s.fillGround(0, 0, 3, 3, "grass", false);
        ActionResult hall = s.placeAsset(1, 1, "town_hall", null);
        assertTrue(hall.success);
        assertEquals("town_hall", s.grid.getTile(1, 1, Layer.OBJECT).tileId());
        assertEquals("grass", s.grid.getTile(1, 1, Layer.GROUND).tileId());

        assertEquals(MapErrorCode.INVALID_PLACEMENT, s.placeAsset(1, 1, "lamp_post", null).code);
        assertEquals(MapErrorCode.OUT_OF_BOUNDS, s.placeAsset(9, 9, "lamp_post", null).code);

        ActionResult unknown = s.placeAsset(0, 0, "castle", null);
        assertEquals(MapErrorCode.UNKNOWN_TILE, unknown.code);
        assertTrue(unknown.suggestion.contains("town_hall (building)"));
    }

    @Test
    void explicitLayerOverridesCatalogPlacement() {
        MapSession s = new MapSession(new MapGrid(2, 2, catalog), 1, false);
        assertTrue(s.placeAsset(0, 0, "water", Layer.GROUND).success);
        assertEquals("water", s.grid.getTile(0, 0, Layer.GROUND).tileId());
    }

    @Test
    void batchPlacementReportsEachItem() {
        MapSession s = grassSession(4, 4, 4);
        ActionResult r = s.placeAssets(List.of(
                new MapSession.AssetPlacement(0, 0, "lamp_post", null),
                new MapSession.AssetPlacement(0, 0, "lamp_post", null),
                new MapSession.AssetPlacement(2, 2, "spawn_point", null)));

        assertFalse(r.success);
        assertEquals(2, r.tilesPlaced);
        assertEquals(3, r.items.size());
        assertEquals(1, r.errors.size());
        assertFalse(r.items.get(1).success);
    }

    // ─────────────────────────────────────────────
    // connectRoads / viewMap
    // ─────────────────────────────────────────────

    @Test
    void connectRoadsJoinsIslands() {
        MapGrid grid = TestFixtures.grassGrid(catalog, 8, 8);
        for (int x = 0; x < 3; x++) grid.setTile(x, 0, "road_ew", Layer.GROUND);
        for (int x = 5; x < 8; x++) grid.setTile(x, 7, "road_ew", Layer.GROUND);
        MapSession s = new MapSession(grid, 16, false);

        ActionResult r = s.connectRoads();
        assertTrue(r.success);
        assertNotNull(r.repair);
        assertEquals(2, r.repair.previousIslandCount);
        assertTrue(s.validate().connected);
        assertEquals(15, s.trackedRoads().size());
    }

    @Test
    void viewMapShowsRequestedLayers() {
        MapSession s = grassSession(3, 2, 4);
        s.placeRoad(0, 0, "road_end_e");
        s.placeAsset(2, 1, "lamp_post", null);

        String ground = s.viewMap("ground");
        assertTrue(ground.contains("0 RGG"));
        assertFalse(ground.contains("Legend: B="));

        String objects = s.viewMap("objects");
        assertTrue(objects.contains("1 ..P"));

        String both = s.viewMap(null);
        assertTrue(both.contains("Legend: R=road") && both.contains("Legend: B=building"));
    }
}
