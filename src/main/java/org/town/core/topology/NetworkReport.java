package org.town.core.topology;

import org.town.core.model.Island;

import java.util.List;

public final class NetworkReport {

    /** 0 или 1 остров: пустая сеть тоже считается связной. */
    public final boolean connected;
    public final int totalTiles;
    public final int islandCount;
    public final List<Island> islands;

    public NetworkReport(int totalTiles, List<Island> islands) {
        this.islands = List.copyOf(islands);
        this.totalTiles = totalTiles;
        this.islandCount = this.islands.size();
        this.connected = this.islandCount <= 1;
    }

    @Override
    public String toString() {
        return "NetworkReport{connected=" + connected + ", totalTiles=" + totalTiles + ", islands=" + islandCount + "}";
    }
}
