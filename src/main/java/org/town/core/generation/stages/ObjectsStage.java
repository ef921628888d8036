package org.town.core.generation.stages;

import org.town.core.generation.GenerationStage;
import org.town.core.generation.MapContext;
import org.town.core.generation.StageId;
import org.town.core.plan.PlanAction;
import org.town.core.plan.PlanOp;
import org.town.core.plan.MapPlan;

public class ObjectsStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.OBJECTS;
    }

    @Override
    public String name() {
        return "Buildings and props";
    }

    @Override
    public int plannedActions(MapPlan plan) {
        return plan.actionsOf(PlanOp.PLACE_ASSET).size();
    }

    @Override
    public void apply(MapContext ctx) {
        for (PlanAction a : ctx.plan.actionsOf(PlanOp.PLACE_ASSET)) {
            ctx.run(a);
        }
    }
}
