package org.town.core.generation;

import org.town.core.model.GridPoint;

import java.util.List;

public final class PathPlacement {

    public final List<GridPoint> route;
    public final int tilesPlaced;
    public final int tilesUpgraded;
    public final List<UnresolvedCell> unresolved;

    public PathPlacement(List<GridPoint> route, int tilesPlaced, int tilesUpgraded, List<UnresolvedCell> unresolved) {
        this.route = List.copyOf(route);
        this.tilesPlaced = tilesPlaced;
        this.tilesUpgraded = tilesUpgraded;
        this.unresolved = List.copyOf(unresolved);
    }

    public boolean complete() {
        return unresolved.isEmpty();
    }
}
