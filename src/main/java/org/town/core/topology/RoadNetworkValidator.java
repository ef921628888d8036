package org.town.core.topology;

import org.town.core.model.Direction;
import org.town.core.model.GridPoint;
import org.town.core.model.Island;
import org.town.core.model.MapGrid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Проверка связности дорожной сети.
 *
 * Сеть не кэшируется: каждый вызов читает текущее состояние сетки,
 * потому что размещения могут заменить тайлы под дорогой.
 */
public class RoadNetworkValidator {

    /** Все клетки земляного слоя с дорожным типом, в построчном порядке. */
    public Set<GridPoint> roadPositions(MapGrid grid) {
        Set<GridPoint> out = new LinkedHashSet<>();
        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x < grid.width; x++) {
                if (grid.isRoadAt(x, y)) {
                    out.add(new GridPoint(x, y));
                }
            }
        }
        return out;
    }

    /**
     * Flood fill (BFS) по 4-соседству, без диагоналей.
     * Каждая непосещённая клетка начинает новый остров.
     */
    public List<Island> islands(MapGrid grid) {
        Set<GridPoint> roads = roadPositions(grid);
        Set<GridPoint> visited = new HashSet<>();
        List<Island> islands = new ArrayList<>();

        for (GridPoint seed : roads) {
            if (visited.contains(seed)) continue;

            List<GridPoint> members = new ArrayList<>();
            ArrayDeque<GridPoint> q = new ArrayDeque<>();
            q.add(seed);
            visited.add(seed);

            while (!q.isEmpty()) {
                GridPoint cur = q.poll();
                members.add(cur);
                for (Direction d : Direction.values()) {
                    GridPoint nb = cur.step(d);
                    if (roads.contains(nb) && visited.add(nb)) {
                        q.add(nb);
                    }
                }
            }
            islands.add(new Island(members));
        }
        return islands;
    }

    public NetworkReport validate(MapGrid grid) {
        List<Island> islands = islands(grid);
        int total = 0;
        for (Island i : islands) total += i.size();
        return new NetworkReport(total, islands);
    }
}
