package org.town.app;

import org.town.core.generation.ConsoleStageListener;
import org.town.core.generation.GenerationPipeline;
import org.town.core.generation.MapContext;
import org.town.core.generation.StageProfile;
import org.town.core.io.CatalogLoader;
import org.town.core.io.GridAsciiView;
import org.town.core.io.GridSerializer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileCatalog;
import org.town.core.model.config.LocalMapConfigLoader;
import org.town.core.model.config.MapConfig;
import org.town.core.plan.MapPlan;
import org.town.core.plan.MapPlanLoader;
import org.town.core.render.RenderResult;
import org.town.core.service.MapGenerationService;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * generate <catalog.json> <plan.json> <out-map.json> [--profile full|withoutRepair|groundAndRoads] [--no-validation]
 * render   <catalog.json> <map.json> <atlas.png> <out.png> [scale] [--format png|jpeg]
 */
public class Main {

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(2);
            return;
        }

        MapConfig cfg = LocalMapConfigLoader.load();
        List<String> positional = collectPositionalArgs(args);
        String command = positional.isEmpty() ? "" : positional.get(0);

        try {
            switch (command) {
                case "generate" -> runGenerate(positional, args, cfg);
                case "render" -> runRender(positional, args, cfg);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                    System.exit(2);
                }
            }
        } catch (RuntimeException e) {
            System.err.println("[FAIL] " + command + ": " + e.getMessage());
            Throwable cause = e.getCause();
            while (cause != null) {
                System.err.println("  caused by: " + cause.getMessage());
                cause = cause.getCause();
            }
            System.exit(1);
        }
    }

    private static void runGenerate(List<String> positional, String[] args, MapConfig cfg) {
        if (positional.size() < 4) {
            printUsage();
            System.exit(2);
            return;
        }
        Path catalogPath = Paths.get(positional.get(1));
        Path planPath = Paths.get(positional.get(2));
        Path outPath = Paths.get(positional.get(3));

        TileCatalog catalog = CatalogLoader.load(catalogPath);
        MapPlan plan = MapPlanLoader.load(planPath, cfg);
        System.out.println("[generate] Catalog \"" + catalog.theme + "\": " + catalog.size() + " tiles, plan "
                + plan.width + "x" + plan.height + " with " + plan.actions.size() + " actions");

        StageProfile profile = StageProfile.byName(findOptionValue(args, "--profile"));
        boolean validation = !hasFlag(args, "--no-validation");
        GenerationPipeline pipeline = new GenerationPipeline(profile, validation, new ConsoleStageListener());
        MapGenerationService service = new MapGenerationService(catalog, pipeline, cfg);

        MapContext ctx = service.generate(plan);
        GridSerializer.write(ctx.grid(), outPath);

        System.out.println(GridAsciiView.ground(ctx.grid()));
        System.out.println();
        System.out.println(GridAsciiView.objects(ctx.grid()));
        System.out.println("[generate] Map saved: " + outPath + " (failed actions: " + ctx.failures.size() + ")");
    }

    private static void runRender(List<String> positional, String[] args, MapConfig cfg) {
        if (positional.size() < 5) {
            printUsage();
            System.exit(2);
            return;
        }
        Path catalogPath = Paths.get(positional.get(1));
        Path mapPath = Paths.get(positional.get(2));
        Path atlasPath = Paths.get(positional.get(3));
        Path outPath = Paths.get(positional.get(4));
        if (positional.size() >= 6) {
            cfg.renderScale = Double.parseDouble(positional.get(5));
        }
        cfg.renderFormat = pick(findOptionValue(args, "--format"), cfg.renderFormat);

        if (!Files.exists(atlasPath)) {
            throw new IllegalArgumentException("Atlas image not found: " + atlasPath);
        }

        TileCatalog catalog = CatalogLoader.load(catalogPath);
        MapGenerationService service = new MapGenerationService(catalog, new GenerationPipeline(), cfg);
        MapGrid grid = GridSerializer.read(mapPath, catalog);

        RenderResult r = service.render(grid, atlasPath, outPath);
        System.out.println("[render] " + outPath + ": " + r);
    }

    private static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String a : args) {
            if (flag.equals(a)) return true;
        }
        return false;
    }

    private static List<String> collectPositionalArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (isOptionWithValue(token)) {
                i++;
                continue;
            }
            if (token.startsWith("--")) {
                continue;
            }
            out.add(token);
        }
        return out;
    }

    private static boolean isOptionWithValue(String token) {
        return "--profile".equals(token)
                || "--format".equals(token);
    }

    private static String pick(String candidate, String fallback) {
        if (candidate == null) return fallback;
        String trimmed = candidate.trim();
        return trimmed.isEmpty() ? fallback : trimmed;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  generate <catalog.json> <plan.json> <out-map.json> [--profile full|withoutRepair|groundAndRoads] [--no-validation]");
        System.out.println("  render   <catalog.json> <map.json> <atlas.png> <out.png> [scale] [--format png|jpeg]");
    }
}
