package org.town.core.generation;

/** Наблюдатель за стадиями генерации карты. */
public interface StageListener {

    void onStageStart(StageId id, String name, int plannedActions);

    void onStageEnd(StageId id, String name, long elapsedMs, StageSummary summary);
}
