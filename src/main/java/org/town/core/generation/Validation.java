package org.town.core.generation;

import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.topology.NetworkReport;

public final class Validation {

    private Validation() {}

    public static void afterGround(MapContext ctx) {
        MapGrid grid = ctx.grid();
        int empty = 0;
        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x < grid.width; x++) {
                if (grid.getTile(x, y, Layer.GROUND) == null) empty++;
            }
        }
        if (empty > 0) {
            // Не ошибка: дороги могут лечь на пустые клетки. Но объекты туда уже не встанут.
            System.out.println("[WARN] " + empty + " ground cells still empty after Ground stage");
        }
    }

    public static void afterRoads(MapContext ctx) {
        NetworkReport r = ctx.session.validate();
        if (!r.connected) {
            System.out.println("[WARN] Road network has " + r.islandCount + " islands after Roads stage");
        }
    }

    public static void afterConnectRoads(MapContext ctx) {
        NetworkReport r = ctx.session.validate();
        if (!r.connected) {
            System.out.println("[WARN] Road network still disconnected after repair: islands=" + r.islandCount);
        }
    }

    /** Объект над пустой землёй рендер нарисует поверх фона - это ошибка плана. */
    public static void afterObjects(MapContext ctx) {
        MapGrid grid = ctx.grid();
        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x < grid.width; x++) {
                if (grid.getTile(x, y, Layer.OBJECT) != null && grid.getTile(x, y, Layer.GROUND) == null) {
                    throw new IllegalStateException("Object " + grid.getTile(x, y, Layer.OBJECT).tileId()
                            + " at (" + x + ", " + y + ") has no ground under it");
                }
            }
        }
    }
}
