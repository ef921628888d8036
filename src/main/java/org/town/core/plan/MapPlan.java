package org.town.core.plan;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** План карты: размер + упорядоченный список действий. */
public class MapPlan {

    public int width;
    public int height;
    public final List<PlanAction> actions = new ArrayList<>();

    public MapPlan(int width, int height) {
        this.width = width;
        this.height = height;
    }

    /** Действия указанных типов в исходном порядке. */
    public List<PlanAction> actionsOf(PlanOp first, PlanOp... rest) {
        Set<PlanOp> ops = EnumSet.of(first, rest);
        List<PlanAction> out = new ArrayList<>();
        for (PlanAction a : actions) {
            if (ops.contains(a.op)) out.add(a);
        }
        return out;
    }
}
