package org.town.core.service;

import org.town.core.generation.GenerationPipeline;
import org.town.core.generation.MapContext;
import org.town.core.io.GridSerializer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileCatalog;
import org.town.core.model.config.MapConfig;
import org.town.core.plan.MapPlan;
import org.town.core.render.MapImageRenderer;
import org.town.core.render.RenderOptions;
import org.town.core.render.RenderResult;

import java.nio.file.Path;

public class MapGenerationService {

    private final TileCatalog catalog;          // загружен один раз, только чтение
    private final GenerationPipeline pipeline;
    private final MapConfig config;

    public MapGenerationService(TileCatalog catalog, GenerationPipeline pipeline, MapConfig config) {
        this.catalog = catalog;
        this.pipeline = pipeline;
        this.config = config;
    }

    // каждый запуск получает свою сетку и свою сессию
    public MapContext generate(MapPlan plan) {
        return pipeline.run(plan, catalog, config);
    }

    public String encodeMap(MapGrid grid) {
        return GridSerializer.toJson(grid);
    }

    public MapGrid decodeMap(String json) {
        return GridSerializer.fromJson(json, catalog);
    }

    public RenderResult render(MapGrid grid, Path atlas, Path out) {
        return new MapImageRenderer(config.verbose).renderToFile(grid, atlas, out, RenderOptions.fromConfig(config));
    }
}
