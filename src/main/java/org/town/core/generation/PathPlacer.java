package org.town.core.generation;

import org.town.core.error.MapErrorCode;
import org.town.core.error.MapGenerationException;
import org.town.core.model.Direction;
import org.town.core.model.GridPoint;
import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileDefinition;
import org.town.core.topology.ConnectivityResolver;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Прокладка дороги между двумя клетками.
 *
 * Маршрут Манхэттенский: сначала по горизонтали до toX на строке fromY, потом по вертикали.
 * Для каждой точки тайл выбирается по связям с соседями по маршруту и с уже лежащими дорогами,
 * после чего соседние дороги апгрейдятся (прямая -> T-образный перекрёсток и т.п.).
 *
 * Бюджет и правило "новая дорога должна касаться сети" проверяет MapSession, не здесь.
 */
public class PathPlacer {

    private final ConnectivityResolver resolver;
    private final boolean verbose;
    private final String logTag;

    public PathPlacer(ConnectivityResolver resolver) {
        this(resolver, false, "drawRoad");
    }

    public PathPlacer(ConnectivityResolver resolver, boolean verbose, String logTag) {
        this.resolver = resolver;
        this.verbose = verbose;
        this.logTag = logTag;
    }

    public PathPlacement place(MapGrid grid, int fromX, int fromY, int toX, int toY) {
        return place(grid, fromX, fromY, toX, toY, false);
    }

    /**
     * @param skipExistingRoads true для ремонта сети: существующие дороги не перезаписываются,
     *                          но их связи могут быть расширены.
     */
    public PathPlacement place(MapGrid grid, int fromX, int fromY, int toX, int toY, boolean skipExistingRoads) {
        List<GridPoint> route = manhattanRoute(fromX, fromY, toX, toY);

        int placed = 0;
        int upgraded = 0;
        List<UnresolvedCell> unresolved = new ArrayList<>();

        for (int i = 0; i < route.size(); i++) {
            GridPoint p = route.get(i);
            Set<Direction> routeDirs = routeConnections(route, i);

            if (skipExistingRoads && grid.isRoadAt(p.x(), p.y())) {
                upgraded += linkExistingRoad(grid, p, routeDirs);
                continue;
            }

            Set<Direction> all = EnumSet.noneOf(Direction.class);
            all.addAll(routeDirs);
            all.addAll(adjacentRoadConnections(grid, p.x(), p.y()));

            // одиночный тайл без контекста - горизонтальная прямая
            if (all.isEmpty()) {
                all.add(Direction.EAST);
                all.add(Direction.WEST);
            }

            Optional<TileDefinition> match = resolver.findExactMatch(all);
            if (match.isEmpty()) {
                unresolved.add(new UnresolvedCell(p.x(), p.y(), all, MapErrorCode.NO_MATCHING_CONNECTIVITY,
                        "No road tile for connections " + names(all) + " at " + p));
                continue;
            }

            TileDefinition tile = match.get();
            try {
                grid.setTile(p.x(), p.y(), tile, Layer.GROUND);
            } catch (MapGenerationException e) {
                unresolved.add(new UnresolvedCell(p.x(), p.y(), all, e.code(),
                        "Failed to place at " + p + ": " + e.getMessage()));
                continue;
            }
            placed++;

            for (Direction d : all) {
                if (upgradeNeighbor(grid, p.x() + d.dx, p.y() + d.dy, d.opposite())) {
                    upgraded++;
                }
            }

            if (verbose) {
                System.out.println("[" + logTag + "] Placed " + tile.id + " at " + p + " with connections " + names(all));
            }
        }

        return new PathPlacement(route, placed, upgraded, unresolved);
    }

    /**
     * Манхэттенский маршрут, обе конечные точки включены.
     * Горизонталь раньше вертикали - одинаковый вход всегда даёт одинаковую "Г".
     */
    public static List<GridPoint> manhattanRoute(int fromX, int fromY, int toX, int toY) {
        List<GridPoint> route = new ArrayList<>();
        int x = fromX;
        int y = fromY;

        while (x != toX) {
            route.add(new GridPoint(x, y));
            x += x < toX ? 1 : -1;
        }
        while (y != toY) {
            route.add(new GridPoint(x, y));
            y += y < toY ? 1 : -1;
        }
        route.add(new GridPoint(toX, toY));
        return route;
    }

    /** Направления к предыдущей и следующей точке маршрута (0..2). */
    static Set<Direction> routeConnections(List<GridPoint> route, int index) {
        Set<Direction> out = EnumSet.noneOf(Direction.class);
        GridPoint cur = route.get(index);
        if (index > 0) {
            GridPoint prev = route.get(index - 1);
            Direction d = Direction.between(cur.x(), cur.y(), prev.x(), prev.y());
            if (d != null) out.add(d);
        }
        if (index + 1 < route.size()) {
            GridPoint next = route.get(index + 1);
            Direction d = Direction.between(cur.x(), cur.y(), next.x(), next.y());
            if (d != null) out.add(d);
        }
        return out;
    }

    /**
     * Направления к соседним дорогам, которые "смотрят" на эту клетку:
     * сосед с севера подходит, только если у него есть south.
     */
    public static Set<Direction> adjacentRoadConnections(MapGrid grid, int x, int y) {
        Set<Direction> out = EnumSet.noneOf(Direction.class);
        for (Direction d : Direction.values()) {
            TileDefinition nb = grid.tileAt(x + d.dx, y + d.dy, Layer.GROUND);
            if (nb == null || !nb.isRoad()) continue;
            if (nb.connectsTo(d.opposite())) {
                out.add(d);
            }
        }
        return out;
    }

    /** Расширяет связи дороги в (x, y) на newDirection, если в каталоге есть такой тайл. */
    boolean upgradeNeighbor(MapGrid grid, int x, int y, Direction newDirection) {
        TileDefinition current = grid.tileAt(x, y, Layer.GROUND);
        if (current == null || !current.isRoad()) return false;

        Optional<TileDefinition> up = resolver.upgrade(current, newDirection);
        if (up.isEmpty() || up.get().id.equals(current.id)) return false;

        grid.setTile(x, y, up.get(), Layer.GROUND);
        if (verbose) {
            System.out.println("[" + logTag + "] Upgraded " + current.id + " -> " + up.get().id + " at (" + x + ", " + y + ")");
        }
        return true;
    }

    /**
     * Точка маршрута уже дорога: не перезаписываем, только сшиваем её
     * с соседними дорогами по маршруту (в обе стороны).
     */
    private int linkExistingRoad(MapGrid grid, GridPoint p, Set<Direction> routeDirs) {
        int upgraded = 0;
        for (Direction d : routeDirs) {
            int nx = p.x() + d.dx;
            int ny = p.y() + d.dy;
            if (!grid.isRoadAt(nx, ny)) continue;
            if (upgradeNeighbor(grid, nx, ny, d.opposite())) upgraded++;
            if (upgradeNeighbor(grid, p.x(), p.y(), d)) upgraded++;
        }
        return upgraded;
    }

    static String names(Set<Direction> dirs) {
        List<String> out = new ArrayList<>();
        for (Direction d : dirs) out.add(d.jsonName());
        return "[" + String.join(", ", out) + "]";
    }
}
