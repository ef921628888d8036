package org.town.core.generation;

import org.town.core.model.MapGrid;
import org.town.core.model.TileCatalog;
import org.town.core.model.config.MapConfig;
import org.town.core.plan.MapPlan;
import org.town.core.plan.PlanAction;
import org.town.core.topology.NetworkReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Контекст одной генерации карты (один запуск = один контекст).
 * Сетка живёт внутри сессии и никуда больше не утекает.
 */
public class MapContext {

    public final MapPlan plan;
    public final MapConfig config;
    public final TileCatalog catalog;
    public final MapSession session;

    /** Выполненные действия плана, включая неудачные. */
    public int actionsRun;

    /** Неудачные действия плана (текст для отчёта). */
    public final List<String> failures = new ArrayList<>();

    /** Появляется после CONNECT_ROADS. До этого null. */
    public RepairResult repair;

    /** Появляется после VALIDATE. До этого null. */
    public NetworkReport network;

    public MapContext(MapPlan plan, TileCatalog catalog, MapConfig config) {
        this.plan = plan;
        this.config = config;
        this.catalog = catalog;
        MapGrid grid = new MapGrid(plan.width, plan.height, catalog);
        this.session = new MapSession(grid, config.maxRoadTiles(plan.width, plan.height), config.verbose);
    }

    /** Выполнить действие плана через сессию; неудачи копятся в failures, генерация продолжается. */
    public ActionResult run(PlanAction action) {
        ActionResult r = session.execute(action);
        actionsRun++;
        if (!r.success) {
            String line = action + " -> " + r;
            failures.add(line);
            System.out.println("[ACTION FAIL] " + line);
        } else if (config.verbose) {
            System.out.println("[ACTION OK]   " + action + " -> " + r);
        }
        for (String w : r.warnings) {
            System.out.println("[WARN] " + action + ": " + w);
        }
        return r;
    }

    public MapGrid grid() {
        return session.grid;
    }
}
