package org.town.core.io;

import org.town.core.model.Anchor;
import org.town.core.model.ConnectivityType;
import org.town.core.model.Direction;
import org.town.core.model.Layer;
import org.town.core.model.TileCatalog;
import org.town.core.model.TileCategory;
import org.town.core.model.TileDefinition;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Фиксированная раскладка атласа 8x8: позиции, размеры, категории и связность заданы здесь,
 * снаружи приходят только id и описания.
 *
 * Строка 0 - 8 дорог, строка 1 - 8 поверхностей, строки 2-3 - 4 здания 2x2, строки 4-7 - 32 пропа.
 */
public final class StandardAtlasLayout {

    public static final int COLUMNS = 8;
    public static final int ROWS = 8;

    public record AtlasSlot(int col,
                            int row,
                            int w,
                            int h,
                            TileCategory category,
                            Layer layer,
                            boolean walkable,
                            Anchor anchor,
                            ConnectivityType connectivity,
                            Set<Direction> connects,
                            String hint) {
    }

    private record RoadSlot(String id, ConnectivityType type, Set<Direction> connects, String hint) {
    }

    private static final List<RoadSlot> ROADS = List.of(
            new RoadSlot("road_ew", ConnectivityType.PATH, EnumSet.of(Direction.EAST, Direction.WEST), "horizontal road"),
            new RoadSlot("road_ns", ConnectivityType.PATH, EnumSet.of(Direction.NORTH, Direction.SOUTH), "vertical road"),
            new RoadSlot("road_ne", ConnectivityType.CORNER, EnumSet.of(Direction.NORTH, Direction.EAST), "road corner NE"),
            new RoadSlot("road_nw", ConnectivityType.CORNER, EnumSet.of(Direction.NORTH, Direction.WEST), "road corner NW"),
            new RoadSlot("road_se", ConnectivityType.CORNER, EnumSet.of(Direction.SOUTH, Direction.EAST), "road corner SE"),
            new RoadSlot("road_sw", ConnectivityType.CORNER, EnumSet.of(Direction.SOUTH, Direction.WEST), "road corner SW"),
            new RoadSlot("road_cross", ConnectivityType.INTERSECTION, EnumSet.allOf(Direction.class), "4-way intersection"),
            new RoadSlot("road_t_south", ConnectivityType.INTERSECTION,
                    EnumSet.of(Direction.SOUTH, Direction.EAST, Direction.WEST), "T-junction (south)")
    );

    private static final String[] GROUND_HINTS = {
            "primary walkable surface",
            "secondary walkable surface",
            "decorative/accent ground",
            "pathway/trail surface",
            "rough/uneven terrain",
            "damaged/worn surface",
            "natural growth (moss/grass)",
            "hazard zone (water/lava/void)"
    };

    private static final String[] BUILDING_HINTS = {
            "main/important building",
            "secondary building",
            "small shop or house",
            "utility or special building"
    };

    private static final String[] PROP_HINTS = {
            // 4: инфраструктура
            "light source (lamp/torch/lantern)", "small container (bin/pot/urn)", "seating (bench/stool/log)",
            "signage (post/marker/banner)", "utility object A", "utility object B", "tall infrastructure",
            "wall-mounted or pipe",
            // 5: растительность
            "small tree or large plant", "bush or shrub", "potted plant or flowers", "ground cover (grass/leaves)",
            "small rock or stone", "large rock or boulder", "water feature (puddle/pond)", "natural growth (moss/fungi)",
            // 6: контейнеры / барьеры
            "storage container (crate/chest)", "barrel or drum", "large container (dumpster/cart)", "stacked items",
            "small barrier (cone/post)", "large barrier (fence/wall)", "ground detail (manhole/grate)",
            "floor decoration",
            // 7: интерактив / декор
            "vending/service machine", "communication device (booth/terminal)", "statue or monument",
            "fountain or water feature", "market stall or stand", "wheeled transport (cart/wagon)", "parked vehicle",
            "storage rack or holder"
    };

    /** Плоские пропы, по которым можно ходить. */
    private static final Set<Integer> WALKABLE_PROPS = Set.of(11, 14, 22, 23);

    private StandardAtlasLayout() {}

    public static List<AtlasSlot> buildSlots() {
        List<AtlasSlot> slots = new ArrayList<>();

        for (int col = 0; col < ROADS.size(); col++) {
            RoadSlot r = ROADS.get(col);
            slots.add(new AtlasSlot(col, 0, 1, 1, TileCategory.GROUND, Layer.GROUND, true, Anchor.TOP_LEFT,
                    r.type(), r.connects(), r.hint()));
        }

        for (int col = 0; col < GROUND_HINTS.length; col++) {
            boolean walkable = col != GROUND_HINTS.length - 1;
            slots.add(new AtlasSlot(col, 1, 1, 1, TileCategory.GROUND, Layer.GROUND, walkable, Anchor.TOP_LEFT,
                    ConnectivityType.NONE, EnumSet.noneOf(Direction.class), GROUND_HINTS[col]));
        }

        for (int i = 0; i < BUILDING_HINTS.length; i++) {
            slots.add(new AtlasSlot(i * 2, 2, 2, 2, TileCategory.BUILDING, Layer.OBJECT, false, Anchor.BOTTOM_CENTER,
                    ConnectivityType.NONE, EnumSet.noneOf(Direction.class), BUILDING_HINTS[i]));
        }

        for (int i = 0; i < PROP_HINTS.length; i++) {
            slots.add(new AtlasSlot(i % COLUMNS, 4 + i / COLUMNS, 1, 1, TileCategory.PROP, Layer.OBJECT,
                    WALKABLE_PROPS.contains(i), Anchor.BOTTOM_CENTER,
                    ConnectivityType.NONE, EnumSet.noneOf(Direction.class), PROP_HINTS[i]));
        }
        return slots;
    }

    public static int slotCount() {
        return buildSlots().size();
    }

    /**
     * Каталог-заглушка на стандартной раскладке: id сгенерированы, описание = подсказка слота.
     * Годится для рендера атласа-плейсхолдера и для прогонов без внешнего каталога.
     */
    public static TileCatalog placeholderCatalog(int tileSize) {
        List<AtlasSlot> slots = buildSlots();
        List<TileDefinition> tiles = new ArrayList<>(slots.size());
        int building = 0;
        int prop = 0;
        for (int i = 0; i < slots.size(); i++) {
            AtlasSlot s = slots.get(i);
            String id;
            if (s.row() == 0) {
                id = ROADS.get(s.col()).id();
            } else if (s.category() == TileCategory.GROUND) {
                id = "ground_" + s.col();
            } else if (s.category() == TileCategory.BUILDING) {
                id = "building_" + building++;
            } else {
                id = "prop_" + prop++;
            }
            tiles.add(new TileDefinition(i, id, s.category(), s.hint(), s.col(), s.row(), s.w(), s.h(),
                    s.layer(), s.walkable(), s.anchor(), s.connectivity(), s.connects(), null, List.of()));
        }
        return new TileCatalog("placeholder", tileSize, COLUMNS, ROWS, null, tiles);
    }
}
