package org.town.core.generation.stages;

import org.town.core.generation.GenerationStage;
import org.town.core.generation.MapContext;
import org.town.core.generation.StageId;
import org.town.core.plan.PlanAction;
import org.town.core.plan.PlanOp;
import org.town.core.plan.MapPlan;

public class GroundStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.GROUND;
    }

    @Override
    public String name() {
        return "Ground fill";
    }

    @Override
    public int plannedActions(MapPlan plan) {
        return plan.actionsOf(PlanOp.FILL_GROUND).size();
    }

    @Override
    public void apply(MapContext ctx) {
        for (PlanAction a : ctx.plan.actionsOf(PlanOp.FILL_GROUND)) {
            ctx.run(a);
        }
    }
}
