package org.town.core.plan;

import java.util.Locale;

public enum PlanOp {
    FILL_GROUND("fillGround"),
    DRAW_ROAD("drawRoad"),
    PLACE_ROAD("placeRoad"),
    CONNECT_ROADS("connectRoads"),
    PLACE_ASSET("placeAsset");

    private final String jsonName;

    PlanOp(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public static PlanOp fromJson(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Plan op is null");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (PlanOp op : values()) {
            if (op.jsonName.toLowerCase(Locale.ROOT).equals(v)) return op;
        }
        throw new IllegalArgumentException("Unknown plan op: " + value);
    }
}
