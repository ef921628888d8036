package org.town.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public final class LocalMapConfigLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "town.local.properties");

    private LocalMapConfigLoader() {
    }

    /** Полная сборка: дефолты, локальный файл, затем system/env. */
    public static MapConfig load() {
        MapConfig cfg = new MapConfig();
        apply(cfg);
        cfg.applyOverridesFromSystem();
        return cfg;
    }

    public static void apply(MapConfig cfg) {
        apply(cfg, resolvePath());
    }

    public static void apply(MapConfig cfg, Path path) {
        if (!Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local map config: " + path.toAbsolutePath(), e);
        }

        cfg.mapWidth = MapConfig.pickInt(props.getProperty("map.width"), null, cfg.mapWidth);
        cfg.mapHeight = MapConfig.pickInt(props.getProperty("map.height"), null, cfg.mapHeight);
        cfg.roadBudgetRatio = MapConfig.pickDouble(props.getProperty("roads.budgetRatio"), null, cfg.roadBudgetRatio);
        cfg.verbose = MapConfig.pickBoolean(props.getProperty("verbose"), null, cfg.verbose);
        cfg.renderScale = MapConfig.pickDouble(props.getProperty("render.scale"), null, cfg.renderScale);
        cfg.renderFormat = pick(props.getProperty("render.format"), cfg.renderFormat);
        cfg.renderQuality = MapConfig.pickInt(props.getProperty("render.quality"), null, cfg.renderQuality);
        cfg.renderBackground = pick(props.getProperty("render.background"), cfg.renderBackground);
        cfg.renderParallel = MapConfig.pickBoolean(props.getProperty("render.parallel"), null, cfg.renderParallel);
    }

    private static Path resolvePath() {
        String override = pick(
                System.getProperty("town.config.path"),
                System.getenv("TOWN_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
