package org.town.core.generation;

public class ConsoleStageListener implements StageListener {

    @Override
    public void onStageStart(StageId id, String name, int plannedActions) {
        System.out.println("[STAGE START] " + id + " - " + name + " (planned actions: " + plannedActions + ")");
    }

    @Override
    public void onStageEnd(StageId id, String name, long elapsedMs, StageSummary summary) {
        System.out.println("[STAGE END]   " + id + " - " + name + " (" + elapsedMs + " ms)"
                + " actions=" + summary.actionsRun()
                + " failed=" + summary.actionsFailed()
                + " roadBudget=" + summary.roadBudgetRemaining());
    }
}
