package org.town.core.generation;

import org.town.core.model.GridPoint;
import org.town.core.model.Island;
import org.town.core.model.MapGrid;
import org.town.core.topology.NetworkReport;
import org.town.core.topology.RoadNetworkValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * Сшивка разрозненных островов дорожной сети.
 *
 * Острова соединяются последовательно: 1 с 0, 2 с 1 и т.д. в порядке отчёта валидатора.
 * Ремонт best-effort: не бросает, итог - флаг connected повторной проверки.
 */
public class RoadNetworkRepair {

    private final RoadNetworkValidator validator;
    private final PathPlacer placer;
    private final boolean verbose;

    public RoadNetworkRepair(RoadNetworkValidator validator, PathPlacer placer, boolean verbose) {
        this.validator = validator;
        this.placer = placer;
        this.verbose = verbose;
    }

    public RepairResult repair(MapGrid grid) {
        NetworkReport before = validator.validate(grid);
        if (before.connected) {
            return new RepairResult(true, true, before.islandCount, before.islandCount,
                    0, 0, List.of(), List.of());
        }

        if (verbose) {
            System.out.println("[connectRoads] Found " + before.islandCount + " disconnected road islands, connecting...");
        }

        int placed = 0;
        int upgraded = 0;
        List<RepairResult.Bridge> bridges = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        List<Island> islands = before.islands;
        for (int i = 1; i < islands.size(); i++) {
            RepairResult.Bridge bridge = nearestPair(islands.get(i - 1), islands.get(i));

            if (verbose) {
                System.out.println("[connectRoads] Connecting island " + (i - 1) + " to island " + i
                        + ": " + bridge.from() + " -> " + bridge.to());
            }

            PathPlacement r = placer.place(grid,
                    bridge.from().x(), bridge.from().y(),
                    bridge.to().x(), bridge.to().y(),
                    true);
            placed += r.tilesPlaced;
            upgraded += r.tilesUpgraded;
            for (UnresolvedCell u : r.unresolved) errors.add(u.message);
            bridges.add(bridge);
        }

        NetworkReport after = validator.validate(grid);
        if (verbose) {
            System.out.println("[connectRoads] Islands: " + before.islandCount + " -> " + after.islandCount
                    + " placed=" + placed + " upgraded=" + upgraded);
        }
        if (!after.connected) {
            System.out.println("[WARN] Road network still has " + after.islandCount + " islands after repair");
        }

        return new RepairResult(after.connected, false, before.islandCount, after.islandCount,
                placed, upgraded, bridges, errors);
    }

    /** Полный перебор пар; при равной дистанции остаётся первая найденная. */
    static RepairResult.Bridge nearestPair(Island a, Island b) {
        GridPoint bestFrom = a.tiles.get(0);
        GridPoint bestTo = b.tiles.get(0);
        int best = Integer.MAX_VALUE;
        for (GridPoint p : a.tiles) {
            for (GridPoint q : b.tiles) {
                int d = p.manhattan(q);
                if (d < best) {
                    best = d;
                    bestFrom = p;
                    bestTo = q;
                }
            }
        }
        return new RepairResult.Bridge(bestFrom, bestTo, best);
    }
}
