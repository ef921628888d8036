package org.town.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Каноническая модель тайла из каталога спрайтов.
 *
 * Правила проекта:
 * - index = позиция в каталоге; это и есть "handle", по нему работают алгоритмы.
 * - connects никогда не null (пустой набор для NONE).
 * - Мультиклеточные тайлы (w/h > 1) занимают на сетке только якорную клетку.
 */
public class TileDefinition {

    // --- Идентификация ---
    public final int index;
    public final String id;
    public final TileCategory category;
    public final String description;

    // --- Позиция в атласе (в клетках атласа) ---
    public final int col;
    public final int row;
    /** ширина в клетках, >= 1 */
    public final int w;
    /** высота в клетках, >= 1 */
    public final int h;

    // --- Размещение ---
    public final Layer layer;
    public final boolean walkable;
    public final Anchor anchor;

    // --- Связность ---
    public final ConnectivityType connectivity;
    private final Set<Direction> connects;
    /** Для EDGE: с какой стороны "содержимое" (вода, стена). Может быть null. */
    public final Direction contentSide;

    public final List<String> variants;

    public TileDefinition(int index,
                          String id,
                          TileCategory category,
                          String description,
                          int col,
                          int row,
                          int w,
                          int h,
                          Layer layer,
                          boolean walkable,
                          Anchor anchor,
                          ConnectivityType connectivity,
                          Set<Direction> connects,
                          Direction contentSide,
                          List<String> variants) {
        this.index = index;
        this.id = id;
        this.category = category;
        this.description = description == null ? "" : description;
        this.col = col;
        this.row = row;
        this.w = w;
        this.h = h;
        this.layer = layer;
        this.walkable = walkable;
        this.anchor = anchor;
        this.connectivity = connectivity == null ? ConnectivityType.NONE : connectivity;
        this.connects = (connects == null || connects.isEmpty())
                ? EnumSet.noneOf(Direction.class)
                : EnumSet.copyOf(connects);
        this.contentSide = contentSide;
        this.variants = variants == null ? List.of() : List.copyOf(variants);
    }

    /** Неизменяемый вид набора связей. */
    public Set<Direction> connects() {
        return Collections.unmodifiableSet(connects);
    }

    public boolean connectsTo(Direction d) {
        return connects.contains(d);
    }

    public boolean isRoad() {
        return connectivity.isRoad();
    }

    /** Дорога на земляном слое: только такие тайлы подбирает резолвер. */
    public boolean isGroundRoad() {
        return category == TileCategory.GROUND && isRoad();
    }

    @Override
    public String toString() {
        return id + "(" + connectivity.jsonName() + " " + connects + ")";
    }
}
