package org.town.core.generation.stages;

import org.town.core.generation.GenerationStage;
import org.town.core.generation.MapContext;
import org.town.core.generation.StageId;
import org.town.core.plan.PlanAction;
import org.town.core.plan.PlanOp;
import org.town.core.plan.MapPlan;

/**
 * Дороги в порядке плана. Ручной connectRoads из плана тоже выполняется здесь,
 * между теми дорогами, между которыми он стоит.
 */
public class RoadsStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.ROADS;
    }

    @Override
    public String name() {
        return "Roads";
    }

    @Override
    public int plannedActions(MapPlan plan) {
        return plan.actionsOf(PlanOp.DRAW_ROAD, PlanOp.PLACE_ROAD, PlanOp.CONNECT_ROADS).size();
    }

    @Override
    public void apply(MapContext ctx) {
        for (PlanAction a : ctx.plan.actionsOf(PlanOp.DRAW_ROAD, PlanOp.PLACE_ROAD, PlanOp.CONNECT_ROADS)) {
            ctx.run(a);
        }
    }
}
