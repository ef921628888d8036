package org.town.core.generation;

import org.town.core.model.Cell;
import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileCategory;
import org.town.core.topology.NetworkReport;
import org.town.core.topology.RoadNetworkValidator;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

public class MapStats {

    public int width;
    public int height;
    public int totalCells;

    public int groundFilled;
    public int objectsFilled;
    public int walkableGround;

    // roads
    public int roadTiles;
    public int islandCount;
    public boolean connected;

    // category histogram (both layers)
    public final Map<TileCategory, Integer> categoryCounts = new EnumMap<>(TileCategory.class);

    // tile id histogram (both layers)
    public final Map<String, Integer> tileCounts = new HashMap<>();

    public static MapStats compute(MapGrid grid) {
        MapStats s = new MapStats();
        s.width = grid.width;
        s.height = grid.height;
        s.totalCells = grid.width * grid.height;

        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x < grid.width; x++) {
                Cell g = grid.getTile(x, y, Layer.GROUND);
                if (g != null) {
                    s.groundFilled++;
                    if (g.tile.walkable) s.walkableGround++;
                    count(s, g);
                }
                Cell o = grid.getTile(x, y, Layer.OBJECT);
                if (o != null) {
                    s.objectsFilled++;
                    count(s, o);
                }
            }
        }

        NetworkReport r = new RoadNetworkValidator().validate(grid);
        s.roadTiles = r.totalTiles;
        s.islandCount = r.islandCount;
        s.connected = r.connected;
        return s;
    }

    private static void count(MapStats s, Cell c) {
        s.categoryCounts.merge(c.tile.category, 1, Integer::sum);
        s.tileCounts.merge(c.tileId(), 1, Integer::sum);
    }
}
