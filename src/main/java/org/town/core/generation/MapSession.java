package org.town.core.generation;

import org.town.core.error.MapErrorCode;
import org.town.core.error.MapGenerationException;
import org.town.core.io.GridAsciiView;
import org.town.core.model.Direction;
import org.town.core.model.GridPoint;
import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileCatalog;
import org.town.core.model.TileCategory;
import org.town.core.model.TileDefinition;
import org.town.core.plan.PlanAction;
import org.town.core.topology.ConnectivityResolver;
import org.town.core.topology.NetworkReport;
import org.town.core.topology.RoadNetworkValidator;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Сессия генерации одной карты: сетка + действия размещения + состояние политик
 * (бюджет дорог, учёт проложенных клеток).
 *
 * Каждое действие - граница операции: исключения сетки ловятся и превращаются в ActionResult.
 */
public class MapSession {

    public final MapGrid grid;
    public final TileCatalog catalog;
    public final ConnectivityResolver resolver;
    public final RoadNetworkValidator validator;
    public final PathPlacer placer;
    public final RoadNetworkRepair repair;

    private final boolean verbose;
    private final int maxRoadTiles;

    // --- трекер дорог (на всю сессию) ---
    private int roadTilesPlaced;
    private final Set<GridPoint> trackedRoads = new LinkedHashSet<>();

    public MapSession(MapGrid grid, int maxRoadTiles, boolean verbose) {
        this.grid = grid;
        this.catalog = grid.catalog;
        this.maxRoadTiles = maxRoadTiles;
        this.verbose = verbose;
        this.resolver = new ConnectivityResolver(catalog);
        this.validator = new RoadNetworkValidator();
        this.placer = new PathPlacer(resolver, verbose, "drawRoad");
        this.repair = new RoadNetworkRepair(validator, new PathPlacer(resolver, verbose, "connectRoads"), verbose);
    }

    public int maxRoadTiles() {
        return maxRoadTiles;
    }

    public int budgetRemaining() {
        return maxRoadTiles - roadTilesPlaced;
    }

    public Set<GridPoint> trackedRoads() {
        return Set.copyOf(trackedRoads);
    }

    // ─────────────────────────────────────────────
    // fillGround
    // ─────────────────────────────────────────────

    /**
     * Заливка прямоугольника (углы включительно) наземным тайлом.
     * Координаты нормализуются и обрезаются по сетке; занятые клетки пропускаются, если не overwrite.
     */
    public ActionResult fillGround(int x1, int y1, int x2, int y2, String tileId, boolean overwrite) {
        TileDefinition tile = catalog.byId(tileId);
        if (tile == null) {
            return ActionResult.fail(MapErrorCode.UNKNOWN_TILE,
                    "Unknown tile: \"" + tileId + "\".",
                    "Available ground tiles: " + String.join(", ", ids(catalog.byCategory(TileCategory.GROUND), 5)));
        }
        if (tile.category != TileCategory.GROUND) {
            return ActionResult.fail(MapErrorCode.INVALID_PLACEMENT,
                    "\"" + tileId + "\" is not a ground tile (category: " + tile.category.jsonName() + ").",
                    "Use placeAsset for objects.");
        }

        int startX = Math.max(0, Math.min(x1, x2));
        int startY = Math.max(0, Math.min(y1, y2));
        int endX = Math.min(grid.width - 1, Math.max(x1, x2));
        int endY = Math.min(grid.height - 1, Math.max(y1, y2));

        ActionResult r = ActionResult.ok();
        for (int y = startY; y <= endY; y++) {
            for (int x = startX; x <= endX; x++) {
                if (!overwrite && grid.getTile(x, y, Layer.GROUND) != null) {
                    r.tilesSkipped++;
                    continue;
                }
                grid.setTile(x, y, tile, Layer.GROUND);
                if (!tile.isRoad()) {
                    trackedRoads.remove(new GridPoint(x, y));
                }
                r.tilesPlaced++;
            }
        }

        if (verbose) {
            System.out.println("[fillGround] " + tileId + " region=(" + startX + "," + startY + ")-(" + endX + "," + endY + ")"
                    + " filled=" + r.tilesPlaced + " skipped=" + r.tilesSkipped);
        }
        return r;
    }

    // ─────────────────────────────────────────────
    // placeAsset / placeAssets
    // ─────────────────────────────────────────────

    /**
     * @param layer null = слой из метаданных тайла
     */
    public ActionResult placeAsset(int x, int y, String tileId, Layer layer) {
        if (!grid.inBounds(x, y)) {
            return ActionResult.fail(MapErrorCode.OUT_OF_BOUNDS,
                    "Position (" + x + ", " + y + ") is out of bounds. Map is " + grid.width + "x" + grid.height + ".");
        }
        TileDefinition tile = catalog.byId(tileId);
        if (tile == null) {
            List<TileDefinition> objects = new ArrayList<>();
            objects.addAll(catalog.byCategory(TileCategory.BUILDING));
            objects.addAll(catalog.byCategory(TileCategory.PROP));
            objects.addAll(catalog.byCategory(TileCategory.MARKER));
            List<String> suggestions = new ArrayList<>();
            for (TileDefinition t : objects) {
                if (suggestions.size() >= 5) break;
                suggestions.add(t.id + " (" + t.category.jsonName() + ")");
            }
            return ActionResult.fail(MapErrorCode.UNKNOWN_TILE,
                    "Unknown asset: \"" + tileId + "\".",
                    "Available: " + String.join(", ", suggestions));
        }

        Layer target = layer != null ? layer : tile.layer;
        if (target == Layer.OBJECT) {
            if (grid.getTile(x, y, Layer.GROUND) == null) {
                return ActionResult.fail(MapErrorCode.INVALID_PLACEMENT,
                        "Cannot place object at (" + x + ", " + y + "): no ground tile exists.",
                        "Use fillGround first.");
            }
            if (grid.getTile(x, y, Layer.OBJECT) != null) {
                return ActionResult.fail(MapErrorCode.INVALID_PLACEMENT,
                        "Position (" + x + ", " + y + ") already has an object: "
                                + grid.getTile(x, y, Layer.OBJECT).tileId());
            }
        }

        try {
            grid.setTile(x, y, tile, target);
        } catch (MapGenerationException e) {
            return ActionResult.fail(e);
        }
        if (verbose) {
            System.out.println("[placeAsset] Placed " + tileId + " at (" + x + ", " + y + ") on " + target.jsonName() + " layer");
        }
        ActionResult r = ActionResult.ok();
        r.tilesPlaced = 1;
        return r;
    }

    public record AssetPlacement(int x, int y, String tileId, Layer layer) {
    }

    /** Пакетное размещение: успех, только если прошли все элементы. */
    public ActionResult placeAssets(List<AssetPlacement> placements) {
        List<ActionResult> results = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int placed = 0;
        for (AssetPlacement p : placements) {
            ActionResult item = placeAsset(p.x(), p.y(), p.tileId(), p.layer());
            results.add(item);
            if (item.success) {
                placed++;
            } else {
                errors.add(p.tileId() + " at (" + p.x() + ", " + p.y() + "): " + item.error);
            }
        }
        ActionResult r = ActionResult.partial(errors);
        r.tilesPlaced = placed;
        r.items.addAll(results);
        return r;
    }

    // ─────────────────────────────────────────────
    // placeRoad - точный тайл с проверкой связности
    // ─────────────────────────────────────────────

    public ActionResult placeRoad(int x, int y, String tileId) {
        if (!grid.inBounds(x, y)) {
            return ActionResult.fail(MapErrorCode.OUT_OF_BOUNDS,
                    "Position (" + x + ", " + y + ") is out of bounds. Map is " + grid.width + "x" + grid.height + ".");
        }
        if (roadTilesPlaced >= maxRoadTiles) {
            return ActionResult.fail(MapErrorCode.BUDGET_EXCEEDED,
                    "Road budget exhausted. Max " + maxRoadTiles + " tiles.");
        }
        TileDefinition tile = catalog.byId(tileId);
        if (tile == null) {
            return ActionResult.fail(MapErrorCode.UNKNOWN_TILE,
                    "Unknown tile: \"" + tileId + "\".",
                    "Available road tiles: " + String.join(", ", ids(catalog.roadTiles(), 8)));
        }
        if (!tile.isRoad()) {
            return ActionResult.fail(MapErrorCode.INVALID_PLACEMENT,
                    "\"" + tileId + "\" is not a road tile.", "Use placeAsset for other tiles.");
        }

        Set<Direction> expected = PathPlacer.adjacentRoadConnections(grid, x, y);
        Set<Direction> missing = EnumSet.noneOf(Direction.class);
        for (Direction d : expected) {
            if (!tile.connectsTo(d)) missing.add(d);
        }
        if (!missing.isEmpty()) {
            Optional<TileDefinition> correct = resolver.findExactMatch(expected);
            return ActionResult.fail(MapErrorCode.NO_MATCHING_CONNECTIVITY,
                    "Connectivity mismatch. \"" + tileId + "\" connects " + PathPlacer.names(tile.connects())
                            + " but needs to connect " + PathPlacer.names(expected) + " to match adjacent roads.",
                    correct.map(t -> "Try \"" + t.id + "\" instead.").orElse(null));
        }

        ActionResult r = ActionResult.ok();
        for (Direction d : tile.connects()) {
            TileDefinition nb = grid.tileAt(x + d.dx, y + d.dy, Layer.GROUND);
            if (nb != null && !nb.isRoad()) {
                r.warnings.add("Connection " + d.jsonName() + " points to non-road tile \"" + nb.id + "\"");
            }
        }

        grid.setTile(x, y, tile, Layer.GROUND);
        roadTilesPlaced++;
        trackedRoads.add(new GridPoint(x, y));
        r.tilesPlaced = 1;
        r.budgetRemaining = budgetRemaining();

        if (verbose) {
            System.out.println("[placeRoad] Placed " + tileId + " at (" + x + ", " + y + ") with connections "
                    + PathPlacer.names(tile.connects()));
        }
        return r;
    }

    // ─────────────────────────────────────────────
    // drawRoad - маршрут с автоподбором тайлов
    // ─────────────────────────────────────────────

    public ActionResult drawRoad(int fromX, int fromY, int toX, int toY) {
        if (!grid.inBounds(fromX, fromY) || !grid.inBounds(toX, toY)) {
            return ActionResult.fail(MapErrorCode.OUT_OF_BOUNDS,
                    "Coordinates out of bounds. Map is " + grid.width + "x" + grid.height + ".");
        }

        // После первой дороги новая обязана касаться сети хотя бы одним концом.
        Set<GridPoint> roads = validator.roadPositions(grid);
        if (!roads.isEmpty()) {
            boolean startOk = onOrAdjacent(roads, fromX, fromY);
            boolean endOk = onOrAdjacent(roads, toX, toY);
            if (!startOk && !endOk) {
                GridPoint nearest = nearestRoad(roads, fromX, fromY, toX, toY);
                return ActionResult.fail(MapErrorCode.DISCONNECTED_PLACEMENT,
                        "Road must connect to existing network. Start (" + fromX + "," + fromY + ") and end ("
                                + toX + "," + toY + ") are both disconnected.",
                        "Try starting from or ending at " + nearest + " which is on an existing road.");
            }
        }

        List<GridPoint> route = PathPlacer.manhattanRoute(fromX, fromY, toX, toY);
        int remaining = budgetRemaining();
        if (route.size() > remaining) {
            return ActionResult.fail(MapErrorCode.BUDGET_EXCEEDED,
                    "Road would exceed budget. Need " + route.size() + " tiles but only " + remaining + " remaining.");
        }

        PathPlacement p = placer.place(grid, fromX, fromY, toX, toY);
        roadTilesPlaced += p.tilesPlaced;
        for (GridPoint pt : p.route) {
            if (grid.isRoadAt(pt.x(), pt.y())) trackedRoads.add(pt);
        }

        List<String> errors = new ArrayList<>();
        for (UnresolvedCell u : p.unresolved) errors.add(u.message);
        ActionResult r = ActionResult.partial(errors);
        r.tilesPlaced = p.tilesPlaced;
        r.tilesUpgraded = p.tilesUpgraded;
        r.budgetRemaining = budgetRemaining();
        return r;
    }

    // ─────────────────────────────────────────────
    // connectRoads / validate / viewMap
    // ─────────────────────────────────────────────

    public ActionResult connectRoads() {
        RepairResult rr = repair.repair(grid);
        for (GridPoint p : validator.roadPositions(grid)) trackedRoads.add(p);
        ActionResult r = rr.success ? ActionResult.ok() : ActionResult.partial(
                rr.errors.isEmpty() ? List.of("Road network still has " + rr.finalIslandCount + " islands") : rr.errors);
        r.tilesPlaced = rr.tilesPlaced;
        r.tilesUpgraded = rr.tilesUpgraded;
        r.repair = rr;
        return r;
    }

    public NetworkReport validate() {
        return validator.validate(grid);
    }

    /** ASCII-вид слоя: "ground", "objects" или "both". */
    public String viewMap(String layer) {
        String v = layer == null ? "both" : layer.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "ground" -> GridAsciiView.ground(grid);
            case "objects", "object" -> GridAsciiView.objects(grid);
            default -> GridAsciiView.ground(grid) + "\n\n" + GridAsciiView.objects(grid);
        };
    }

    // ─────────────────────────────────────────────
    // Действие плана -> действие сессии
    // ─────────────────────────────────────────────

    public ActionResult execute(PlanAction a) {
        return switch (a.op) {
            case FILL_GROUND -> fillGround(a.x1, a.y1, a.x2, a.y2, a.tileId, a.overwrite);
            case DRAW_ROAD -> drawRoad(a.fromX, a.fromY, a.toX, a.toY);
            case PLACE_ROAD -> placeRoad(a.x, a.y, a.tileId);
            case PLACE_ASSET -> placeAsset(a.x, a.y, a.tileId, a.layer);
            case CONNECT_ROADS -> connectRoads();
        };
    }

    // ─────────────────────────────────────────────

    private static boolean onOrAdjacent(Set<GridPoint> roads, int x, int y) {
        GridPoint p = new GridPoint(x, y);
        if (roads.contains(p)) return true;
        for (Direction d : Direction.values()) {
            if (roads.contains(p.step(d))) return true;
        }
        return false;
    }

    private static GridPoint nearestRoad(Set<GridPoint> roads, int fromX, int fromY, int toX, int toY) {
        GridPoint from = new GridPoint(fromX, fromY);
        GridPoint to = new GridPoint(toX, toY);
        GridPoint best = null;
        int bestDist = Integer.MAX_VALUE;
        for (GridPoint r : roads) {
            int d = Math.min(r.manhattan(from), r.manhattan(to));
            if (d < bestDist) {
                bestDist = d;
                best = r;
            }
        }
        return best;
    }

    private static List<String> ids(List<TileDefinition> tiles, int limit) {
        List<String> out = new ArrayList<>();
        for (TileDefinition t : tiles) {
            if (out.size() >= limit) break;
            out.add(t.id);
        }
        return out;
    }
}
