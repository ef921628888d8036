package org.town.core.generation.stages;

import org.town.core.generation.ActionResult;
import org.town.core.generation.GenerationStage;
import org.town.core.generation.MapContext;
import org.town.core.generation.StageId;
import org.town.core.plan.MapPlan;

public class ConnectRoadsStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.CONNECT_ROADS;
    }

    @Override
    public String name() {
        return "Connect road islands";
    }

    @Override
    public int plannedActions(MapPlan plan) {
        return 1;
    }

    @Override
    public void apply(MapContext ctx) {
        ActionResult r = ctx.session.connectRoads();
        ctx.actionsRun++;
        ctx.repair = r.repair;
        if (!r.success) {
            ctx.failures.add("connectRoads -> " + r);
        }
    }
}
