package org.town.core.generation;

import org.town.core.plan.MapPlan;

public interface GenerationStage {
    StageId id();
    String name();

    /** Сколько действий плана стадия собирается выполнить. */
    int plannedActions(MapPlan plan);

    void apply(MapContext ctx);
}
