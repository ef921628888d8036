package org.town.core.generation;

import org.town.core.model.GridPoint;

import java.util.List;

public final class RepairResult {

    /** Одна перемычка между соседними (по порядку отчёта) островами. */
    public record Bridge(GridPoint from, GridPoint to, int distance) {
    }

    /** Итоговый флаг connected после повторной проверки. */
    public final boolean success;
    public final boolean alreadyConnected;
    public final int previousIslandCount;
    public final int finalIslandCount;
    public final int tilesPlaced;
    public final int tilesUpgraded;
    public final List<Bridge> bridges;
    public final List<String> errors;

    public RepairResult(boolean success,
                        boolean alreadyConnected,
                        int previousIslandCount,
                        int finalIslandCount,
                        int tilesPlaced,
                        int tilesUpgraded,
                        List<Bridge> bridges,
                        List<String> errors) {
        this.success = success;
        this.alreadyConnected = alreadyConnected;
        this.previousIslandCount = previousIslandCount;
        this.finalIslandCount = finalIslandCount;
        this.tilesPlaced = tilesPlaced;
        this.tilesUpgraded = tilesUpgraded;
        this.bridges = List.copyOf(bridges);
        this.errors = List.copyOf(errors);
    }
}
