package org.town.core.generation;

import org.town.core.generation.stages.ConnectRoadsStage;
import org.town.core.generation.stages.GroundStage;
import org.town.core.generation.stages.ObjectsStage;
import org.town.core.generation.stages.RoadsStage;
import org.town.core.generation.stages.ValidateStage;
import org.town.core.model.TileCatalog;
import org.town.core.model.config.MapConfig;
import org.town.core.plan.MapPlan;

import java.util.ArrayList;
import java.util.List;

public class GenerationPipeline {

    private final List<GenerationStage> stages = new ArrayList<>();
    private final StageProfile profile;
    private final boolean enableValidation;
    private final StageListener listener;

    /**
     * Полный конструктор.
     */
    public GenerationPipeline(StageProfile profile,
                              boolean enableValidation,
                              StageListener listener) {

        this.profile = profile;
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();

        // Фиксируем порядок стадий: земля -> дороги -> сшивка -> объекты -> проверка
        stages.add(new GroundStage());
        stages.add(new RoadsStage());
        stages.add(new ConnectRoadsStage());
        stages.add(new ObjectsStage());
        stages.add(new ValidateStage());
    }

    /**
     * Удобный конструктор по умолчанию:
     * - все стадии
     * - валидации включены
     * - вывод в консоль
     */
    public GenerationPipeline() {
        this(StageProfile.full(), true, new ConsoleStageListener());
    }

    public MapContext run(MapPlan plan, TileCatalog catalog, MapConfig config) {
        MapContext ctx = new MapContext(plan, catalog, config);

        for (GenerationStage stage : stages) {
            if (!profile.isEnabled(stage.id())) {
                System.out.println("[STAGE SKIP]  " + stage.id() + " - " + stage.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name(), stage.plannedActions(plan));
            int runBefore = ctx.actionsRun;
            int failedBefore = ctx.failures.size();

            try {
                stage.apply(ctx);

                if (enableValidation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (RuntimeException e) {
                throw new RuntimeException("Generation failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed, new StageSummary(
                        ctx.actionsRun - runBefore,
                        ctx.failures.size() - failedBefore,
                        ctx.session.budgetRemaining()));
            }
        }

        MapStats stats = MapStats.compute(ctx.grid());
        MapStatsReport.print(stats);
        if (!ctx.failures.isEmpty()) {
            System.out.println("[WARN] " + ctx.failures.size() + " plan actions failed");
        }
        return ctx;
    }

    private void runValidation(StageId id, MapContext ctx) {
        switch (id) {
            case GROUND -> Validation.afterGround(ctx);
            case ROADS -> Validation.afterRoads(ctx);
            case CONNECT_ROADS -> Validation.afterConnectRoads(ctx);
            case OBJECTS -> Validation.afterObjects(ctx);
            case VALIDATE -> {
                // сама стадия и есть проверка
            }
        }
    }
}
