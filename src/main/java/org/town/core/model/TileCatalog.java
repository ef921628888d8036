package org.town.core.model;

import org.town.core.error.CatalogFormatException;
import org.town.core.error.UnknownTileException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Каталог тайлов (spritesheet metadata). Загружается один раз, дальше только читается.
 *
 * Строковые id разрешаются здесь, на границе; всё, что дальше, работает с TileDefinition.
 * Порядок каталога важен: при одинаковой связности выигрывает первый тайл.
 */
public class TileCatalog {

    public final String theme;
    public final int tileSize;
    public final int columns;
    public final int rows;
    public final String sceneDescription;

    private final List<TileDefinition> tiles;
    private final Map<String, TileDefinition> byId = new HashMap<>();

    public TileCatalog(String theme,
                       int tileSize,
                       int columns,
                       int rows,
                       String sceneDescription,
                       List<TileDefinition> tiles) {
        if (tileSize <= 0) {
            throw new CatalogFormatException("tileSize must be > 0, got " + tileSize);
        }
        this.theme = theme == null ? "" : theme;
        this.tileSize = tileSize;
        this.columns = columns;
        this.rows = rows;
        this.sceneDescription = sceneDescription;
        this.tiles = List.copyOf(tiles);

        for (int i = 0; i < this.tiles.size(); i++) {
            TileDefinition t = this.tiles.get(i);
            if (t.index != i) {
                throw new CatalogFormatException("Tile \"" + t.id + "\" has index " + t.index + " but sits at position " + i);
            }
            if (t.id == null || t.id.isBlank()) {
                throw new CatalogFormatException("Tile at position " + i + " has empty id");
            }
            if (t.w < 1 || t.h < 1) {
                throw new CatalogFormatException("Tile \"" + t.id + "\" has invalid footprint " + t.w + "x" + t.h);
            }
            validateArity(t);
            if (byId.put(t.id, t) != null) {
                throw new CatalogFormatException("Duplicate tile id: " + t.id);
            }
        }
    }

    /**
     * Строгая проверка соответствия типа связности и набора направлений.
     * path = 2 противоположных, corner = 2 смежных, intersection = 3..4, cap = 1, none = 0, edge = 0..1.
     */
    static void validateArity(TileDefinition t) {
        Set<Direction> c = t.connects();
        int n = c.size();
        boolean ok = switch (t.connectivity) {
            case NONE -> n == 0;
            case EDGE -> n <= 1;
            case CAP -> n == 1;
            case PATH -> n == 2 && isOpposite(c);
            case CORNER -> n == 2 && !isOpposite(c);
            case INTERSECTION -> n == 3 || n == 4;
        };
        if (!ok) {
            throw new CatalogFormatException("Tile \"" + t.id + "\" declares connectivity "
                    + t.connectivity.jsonName() + " but connects " + c);
        }
    }

    private static boolean isOpposite(Set<Direction> c) {
        return (c.contains(Direction.NORTH) && c.contains(Direction.SOUTH))
                || (c.contains(Direction.EAST) && c.contains(Direction.WEST));
    }

    // ─────────────────────────────────────────────
    // Lookup
    // ─────────────────────────────────────────────

    public List<TileDefinition> tiles() {
        return tiles;
    }

    public int size() {
        return tiles.size();
    }

    public TileDefinition get(int index) {
        return tiles.get(index);
    }

    /** null, если такого id нет. */
    public TileDefinition byId(String id) {
        return id == null ? null : byId.get(id);
    }

    public boolean contains(String id) {
        return byId(id) != null;
    }

    /**
     * Разрешение id с подсказками: сначала наземные тайлы, потом объекты.
     */
    public TileDefinition resolve(String id) {
        return resolve(id, Layer.GROUND);
    }

    /**
     * То же, но подсказки начинаются с тайлов нужного слоя:
     * для OBJECT сначала объекты, для GROUND сначала наземные.
     */
    public TileDefinition resolve(String id, Layer family) {
        TileDefinition t = byId(id);
        if (t == null) {
            throw new UnknownTileException(id, suggestIds(family, 5));
        }
        return t;
    }

    /** До limit id: тайлы слоя family в порядке каталога, затем остальные. */
    public List<String> suggestIds(Layer family, int limit) {
        List<String> out = new ArrayList<>();
        for (TileDefinition t : tiles) {
            if (out.size() >= limit) return out;
            if (t.layer == family) out.add(t.id);
        }
        for (TileDefinition t : tiles) {
            if (out.size() >= limit) break;
            if (t.layer != family) out.add(t.id);
        }
        return out;
    }

    // ─────────────────────────────────────────────
    // Семантические запросы
    // ─────────────────────────────────────────────

    public List<TileDefinition> byCategory(TileCategory category) {
        List<TileDefinition> out = new ArrayList<>();
        for (TileDefinition t : tiles) {
            if (t.category == category) out.add(t);
        }
        return out;
    }

    public List<TileDefinition> byConnectivity(ConnectivityType type) {
        List<TileDefinition> out = new ArrayList<>();
        for (TileDefinition t : tiles) {
            if (t.connectivity == type) out.add(t);
        }
        return out;
    }

    /** Тайлы, у которых набор связей в точности равен directions (порядок не важен). */
    public List<TileDefinition> withConnections(Set<Direction> directions) {
        List<TileDefinition> out = new ArrayList<>();
        for (TileDefinition t : tiles) {
            if (t.connects().equals(directions)) out.add(t);
        }
        return out;
    }

    /** Наземные тайлы с дорожной связностью. */
    public List<TileDefinition> roadTiles() {
        List<TileDefinition> out = new ArrayList<>();
        for (TileDefinition t : tiles) {
            if (t.isGroundRoad()) out.add(t);
        }
        return out;
    }

    /** Регистронезависимый поиск: тайл подходит, если описание содержит хотя бы одно слово. */
    public List<TileDefinition> filterByDescription(List<TileDefinition> source, String keywords) {
        List<TileDefinition> out = new ArrayList<>();
        if (keywords == null || keywords.isBlank()) return out;
        List<String> terms = Arrays.asList(keywords.toLowerCase(Locale.ROOT).trim().split("\\s+"));
        for (TileDefinition t : source) {
            String d = t.description.toLowerCase(Locale.ROOT);
            for (String term : terms) {
                if (d.contains(term)) {
                    out.add(t);
                    break;
                }
            }
        }
        return out;
    }
}
