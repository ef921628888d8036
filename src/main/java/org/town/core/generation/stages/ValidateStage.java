package org.town.core.generation.stages;

import org.town.core.generation.GenerationStage;
import org.town.core.generation.MapContext;
import org.town.core.generation.StageId;
import org.town.core.plan.MapPlan;

public class ValidateStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.VALIDATE;
    }

    @Override
    public String name() {
        return "Road network check";
    }

    @Override
    public int plannedActions(MapPlan plan) {
        return 0;
    }

    @Override
    public void apply(MapContext ctx) {
        ctx.network = ctx.session.validate();
        System.out.println("[NETWORK] " + ctx.network);
    }
}
