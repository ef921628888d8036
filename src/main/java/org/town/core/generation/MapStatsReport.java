package org.town.core.generation;

import org.town.core.model.TileCategory;

import java.util.Comparator;
import java.util.Map;

public class MapStatsReport {

    public static void print(MapStats s) {
        System.out.println();
        System.out.println("========= MAP STATS =========");
        System.out.println("Size: " + s.width + "x" + s.height + " (" + s.totalCells + " cells)");
        System.out.println("Ground: " + s.groundFilled + "/" + s.totalCells + " (" + pct(s.groundFilled, s.totalCells) + ")"
                + " walkable=" + s.walkableGround);
        System.out.println("Objects: " + s.objectsFilled);
        System.out.println("Roads: tiles=" + s.roadTiles + " islands=" + s.islandCount + " connected=" + s.connected);

        System.out.println();
        System.out.println("Categories:");
        for (TileCategory c : TileCategory.values()) {
            Integer n = s.categoryCounts.get(c);
            if (n == null) continue;
            System.out.println("  " + String.format("%-10s", c.jsonName()) + " : " + n);
        }

        System.out.println();
        System.out.println("Tiles (top):");
        s.tileCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(12)
                .forEach(e -> System.out.println("  " + String.format("%-24s", e.getKey()) + " : " + e.getValue()));
        System.out.println("=============================");
        System.out.println();
    }

    private static String pct(int part, int total) {
        if (total <= 0) return "0%";
        return String.format(java.util.Locale.US, "%.1f%%", part * 100.0 / total);
    }
}
