package org.town.core.generation;

/**
 * Итог одной стадии: сколько действий плана она выполнила, сколько из них не прошло,
 * и сколько дорожного бюджета осталось после неё.
 */
public record StageSummary(int actionsRun, int actionsFailed, int roadBudgetRemaining) {
}
