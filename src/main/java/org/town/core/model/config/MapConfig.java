package org.town.core.model.config;

import java.util.Locale;

/**
 * Настройки одного запуска генерации/рендера.
 * Порядок: дефолты -> local/town.local.properties -> system properties / env.
 */
public class MapConfig {
    public static final int DEFAULT_MAP_SIZE = 10;
    public static final double DEFAULT_ROAD_BUDGET_RATIO = 0.25;

    public int mapWidth = DEFAULT_MAP_SIZE;
    public int mapHeight = DEFAULT_MAP_SIZE;

    /** Доля клеток карты, которую можно занять дорогами. */
    public double roadBudgetRatio = DEFAULT_ROAD_BUDGET_RATIO;
    public boolean verbose = false;

    // --- Render ---
    public double renderScale = 0.25;
    public String renderFormat = "png";
    public int renderQuality = 90;
    public String renderBackground = "#000000";
    public boolean renderParallel = true;

    public int maxRoadTiles() {
        return maxRoadTiles(mapWidth, mapHeight);
    }

    /** Бюджет дорог для карты произвольного размера (план может задать свой). */
    public int maxRoadTiles(int width, int height) {
        return (int) Math.floor(width * height * roadBudgetRatio);
    }

    public void applyOverridesFromSystem() {
        mapWidth = pickInt(
                System.getProperty("town.map.width"),
                System.getenv("TOWN_MAP_WIDTH"),
                mapWidth
        );
        mapHeight = pickInt(
                System.getProperty("town.map.height"),
                System.getenv("TOWN_MAP_HEIGHT"),
                mapHeight
        );
        roadBudgetRatio = pickDouble(
                System.getProperty("town.roads.budgetRatio"),
                System.getenv("TOWN_ROADS_BUDGET_RATIO"),
                roadBudgetRatio
        );
        verbose = pickBoolean(
                System.getProperty("town.verbose"),
                System.getenv("TOWN_VERBOSE"),
                verbose
        );
        renderScale = pickDouble(
                System.getProperty("town.render.scale"),
                System.getenv("TOWN_RENDER_SCALE"),
                renderScale
        );
        String format = pick(
                System.getProperty("town.render.format"),
                System.getenv("TOWN_RENDER_FORMAT"),
                renderFormat
        );
        renderFormat = format == null ? "png" : format.toLowerCase(Locale.ROOT);
        renderQuality = pickInt(
                System.getProperty("town.render.quality"),
                System.getenv("TOWN_RENDER_QUALITY"),
                renderQuality
        );
        String bg = pick(
                System.getProperty("town.render.background"),
                System.getenv("TOWN_RENDER_BACKGROUND"),
                renderBackground
        );
        renderBackground = bg == null ? "#000000" : bg;
        renderParallel = pickBoolean(
                System.getProperty("town.render.parallel"),
                System.getenv("TOWN_RENDER_PARALLEL"),
                renderParallel
        );
    }

    static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value != null) {
                String trimmed = value.trim();
                if (!trimmed.isEmpty()) {
                    return trimmed;
                }
            }
        }
        return null;
    }

    static int pickInt(String prop, String env, int fallback) {
        String v = pick(prop, env);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected integer, got '" + v + "'", e);
        }
    }

    static double pickDouble(String prop, String env, double fallback) {
        String v = pick(prop, env);
        if (v == null) return fallback;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected number, got '" + v + "'", e);
        }
    }

    static boolean pickBoolean(String prop, String env, boolean fallback) {
        String v = pick(prop, env);
        return v == null ? fallback : Boolean.parseBoolean(v);
    }
}
