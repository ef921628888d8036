package org.town.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.town.core.error.CatalogFormatException;
import org.town.core.model.Anchor;
import org.town.core.model.ConnectivityType;
import org.town.core.model.Direction;
import org.town.core.model.Layer;
import org.town.core.model.TileCatalog;
import org.town.core.model.TileCategory;
import org.town.core.model.TileDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Загрузка каталога тайлов (spritesheet-metadata.json).
 *
 * {
 *   "theme": "...", "tileSize": 256, "columns": 8, "rows": 8, "sceneDescription": "...",
 *   "sprites": [ { "id", "category", "col", "row", "w", "h", "description",
 *                  "placement": { "layer", "walkable", "anchor" },
 *                  "connectivity": { "type", "connects": [...], "contentSide" },
 *                  "variants": [...] } ]
 * }
 *
 * Значения по умолчанию: w = h = 1, layer = ground, walkable = true, anchor = top_left,
 * connectivity = none без направлений.
 */
public final class CatalogLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CatalogLoader() {}

    public static TileCatalog load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return fromTree(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read tile catalog: " + file, e);
        } catch (CatalogFormatException e) {
            throw new CatalogFormatException(file + ": " + e.getMessage(), e);
        }
    }

    public static TileCatalog fromJson(String json) {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new CatalogFormatException("Catalog JSON is not valid: " + e.getOriginalMessage(), e);
        }
    }

    public static TileCatalog fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new CatalogFormatException("Catalog root must be a JSON object");
        }
        JsonNode sprites = root.path("sprites");
        if (!sprites.isArray()) {
            throw new CatalogFormatException("Catalog has no \"sprites\" array");
        }

        List<TileDefinition> tiles = new ArrayList<>();
        int index = 0;
        for (JsonNode s : sprites) {
            tiles.add(readTile(index++, s));
        }

        return new TileCatalog(
                root.path("theme").asText(""),
                root.path("tileSize").asInt(0),
                root.path("columns").asInt(0),
                root.path("rows").asInt(0),
                root.hasNonNull("sceneDescription") ? root.get("sceneDescription").asText() : null,
                tiles
        );
    }

    private static TileDefinition readTile(int index, JsonNode s) {
        String id = s.path("id").asText(null);
        try {
            JsonNode placement = s.path("placement");
            JsonNode connectivity = s.path("connectivity");

            Set<Direction> connects = EnumSet.noneOf(Direction.class);
            for (JsonNode d : connectivity.path("connects")) {
                connects.add(Direction.fromJson(d.asText()));
            }

            List<String> variants = new ArrayList<>();
            for (JsonNode v : s.path("variants")) {
                variants.add(v.asText());
            }

            return new TileDefinition(
                    index,
                    id,
                    TileCategory.fromJson(require(s, "category").asText()),
                    s.path("description").asText(""),
                    require(s, "col").asInt(),
                    require(s, "row").asInt(),
                    s.path("w").asInt(1),
                    s.path("h").asInt(1),
                    Layer.fromJson(placement.path("layer").asText("ground")),
                    placement.path("walkable").asBoolean(true),
                    Anchor.fromJson(placement.path("anchor").asText("top_left")),
                    ConnectivityType.fromJson(connectivity.path("type").asText("none")),
                    connects,
                    connectivity.hasNonNull("contentSide") ? Direction.fromJson(connectivity.get("contentSide").asText()) : null,
                    variants
            );
        } catch (IllegalArgumentException e) {
            throw new CatalogFormatException("Sprite #" + index + " (" + id + "): " + e.getMessage(), e);
        }
    }

    private static JsonNode require(JsonNode s, String field) {
        JsonNode n = s.get(field);
        if (n == null || n.isNull()) {
            throw new IllegalArgumentException("missing field \"" + field + "\"");
        }
        return n;
    }
}
