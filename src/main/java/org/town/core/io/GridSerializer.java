package org.town.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.town.core.model.Cell;
import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileCatalog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * map.json - единственный контракт между генерацией и рендером.
 *
 * Формат:
 * { "width": W, "height": H,
 *   "layers": { "ground":  [[cell|null, ...], ...],
 *               "objects": [[cell|null, ...], ...] } }
 * cell = { "assetId": "...", "layer": "ground"|"object" }
 *
 * При чтении принимается и ключ "tileId" вместо "assetId".
 */
public final class GridSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private GridSerializer() {}

    public static ObjectNode toTree(MapGrid grid) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("width", grid.width);
        root.put("height", grid.height);

        ObjectNode layers = root.putObject("layers");
        layers.set("ground", layerToArray(grid, Layer.GROUND));
        layers.set("objects", layerToArray(grid, Layer.OBJECT));
        return root;
    }

    public static String toJson(MapGrid grid) {
        try {
            return MAPPER.writeValueAsString(toTree(grid));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize map " + grid.width + "x" + grid.height, e);
        }
    }

    public static void write(MapGrid grid, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, toJson(grid), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write map: " + file, e);
        }
    }

    private static ArrayNode layerToArray(MapGrid grid, Layer layer) {
        ArrayNode rows = MAPPER.createArrayNode();
        for (int y = 0; y < grid.height; y++) {
            ArrayNode row = rows.addArray();
            for (int x = 0; x < grid.width; x++) {
                Cell c = grid.getTile(x, y, layer);
                if (c == null) {
                    row.addNull();
                    continue;
                }
                ObjectNode cell = row.addObject();
                cell.put("assetId", c.tileId());
                cell.put("layer", c.layer.jsonName());
            }
        }
        return rows;
    }

    // ─────────────────────────────────────────────
    // Чтение
    // ─────────────────────────────────────────────

    public static MapGrid fromJson(String json, TileCatalog catalog) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Map JSON is not valid: " + e.getOriginalMessage(), e);
        }
        return fromTree(root, catalog);
    }

    public static MapGrid read(Path file, TileCatalog catalog) {
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8), catalog);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read map: " + file, e);
        }
    }

    /**
     * Неизвестный id в клетке - UnknownTileException из сетки: карта и каталог не совпадают.
     */
    public static MapGrid fromTree(JsonNode root, TileCatalog catalog) {
        int width = root.path("width").asInt(0);
        int height = root.path("height").asInt(0);
        MapGrid grid = new MapGrid(width, height, catalog);

        JsonNode layers = root.path("layers");
        readLayer(grid, layers.path("ground"), Layer.GROUND);
        readLayer(grid, layers.path("objects"), Layer.OBJECT);
        return grid;
    }

    private static void readLayer(MapGrid grid, JsonNode rows, Layer layer) {
        if (!rows.isArray()) return;
        int y = 0;
        for (JsonNode row : rows) {
            if (y >= grid.height) break;
            int x = 0;
            for (JsonNode cell : row) {
                if (x >= grid.width) break;
                if (cell != null && !cell.isNull()) {
                    String id = cell.hasNonNull("assetId")
                            ? cell.get("assetId").asText()
                            : cell.path("tileId").asText(null);
                    // слой определяется массивом, тег в клетке только дублирует его
                    grid.setTile(x, y, id, layer);
                }
                x++;
            }
            y++;
        }
    }
}
