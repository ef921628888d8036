package org.town.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.town.core.model.Layer;
import org.town.core.model.config.MapConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Чтение плана карты (plan.json):
 * { "width": 10, "height": 10,
 *   "actions": [ { "op": "fillGround", "x1": 0, "y1": 0, "x2": 9, "y2": 9, "tileId": "grass" },
 *                { "op": "drawRoad", "fromX": 0, "fromY": 5, "toX": 9, "toY": 5 }, ... ] }
 *
 * Размер можно не указывать - тогда берётся из MapConfig.
 */
public final class MapPlanLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MapPlanLoader() {}

    public static MapPlan load(Path file, MapConfig cfg) {
        try (InputStream in = Files.newInputStream(file)) {
            return fromTree(MAPPER.readTree(in), cfg);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read plan: " + file, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(file + ": " + e.getMessage(), e);
        }
    }

    public static MapPlan fromJson(String json, MapConfig cfg) {
        try {
            return fromTree(MAPPER.readTree(json), cfg);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Plan JSON is not valid: " + e.getOriginalMessage(), e);
        }
    }

    public static MapPlan fromTree(JsonNode root, MapConfig cfg) {
        MapPlan plan = new MapPlan(
                root.path("width").asInt(cfg.mapWidth),
                root.path("height").asInt(cfg.mapHeight));

        int i = 0;
        for (JsonNode n : root.path("actions")) {
            try {
                plan.actions.add(readAction(n));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Action #" + i + ": " + e.getMessage(), e);
            }
            i++;
        }
        return plan;
    }

    private static PlanAction readAction(JsonNode n) {
        PlanAction a = new PlanAction();
        a.op = PlanOp.fromJson(n.path("op").asText(null));

        // координаты обязательны, но только те, что нужны самой операции
        switch (a.op) {
            case FILL_GROUND -> {
                a.x1 = requireInt(n, "x1");
                a.y1 = requireInt(n, "y1");
                a.x2 = requireInt(n, "x2");
                a.y2 = requireInt(n, "y2");
            }
            case DRAW_ROAD -> {
                a.fromX = requireInt(n, "fromX");
                a.fromY = requireInt(n, "fromY");
                a.toX = requireInt(n, "toX");
                a.toY = requireInt(n, "toY");
            }
            case PLACE_ROAD, PLACE_ASSET -> {
                a.x = requireInt(n, "x");
                a.y = requireInt(n, "y");
            }
            case CONNECT_ROADS -> {
            }
        }

        a.tileId = n.hasNonNull("tileId") ? n.get("tileId").asText() : n.path("assetId").asText(null);
        a.layer = n.hasNonNull("layer") ? Layer.fromJson(n.get("layer").asText()) : null;
        a.overwrite = n.path("overwrite").asBoolean(false);

        if (a.tileId == null && a.op != PlanOp.DRAW_ROAD && a.op != PlanOp.CONNECT_ROADS) {
            throw new IllegalArgumentException(a.op.jsonName() + " requires tileId");
        }
        return a;
    }

    private static int requireInt(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) {
            throw new IllegalArgumentException("missing field \"" + field + "\"");
        }
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new IllegalArgumentException("field \"" + field + "\" must be an integer, got " + v);
        }
        return v.asInt();
    }
}
