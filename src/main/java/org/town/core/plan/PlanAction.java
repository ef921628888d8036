package org.town.core.plan;

import org.town.core.model.Layer;

/**
 * Одно действие плана. Какие поля заполнены, зависит от op:
 * fillGround  - x1, y1, x2, y2, tileId, overwrite
 * drawRoad    - fromX, fromY, toX, toY
 * placeRoad   - x, y, tileId
 * placeAsset  - x, y, tileId, layer (null = из каталога)
 * connectRoads - без полей
 */
public class PlanAction {

    public PlanOp op;

    public int x;
    public int y;

    public int x1;
    public int y1;
    public int x2;
    public int y2;

    public int fromX;
    public int fromY;
    public int toX;
    public int toY;

    public String tileId;
    public Layer layer;
    public boolean overwrite;

    @Override
    public String toString() {
        return switch (op) {
            case FILL_GROUND -> op.jsonName() + " " + tileId + " (" + x1 + "," + y1 + ")-(" + x2 + "," + y2 + ")"
                    + (overwrite ? " overwrite" : "");
            case DRAW_ROAD -> op.jsonName() + " (" + fromX + "," + fromY + ")->(" + toX + "," + toY + ")";
            case PLACE_ROAD, PLACE_ASSET -> op.jsonName() + " " + tileId + " at (" + x + "," + y + ")";
            case CONNECT_ROADS -> op.jsonName();
        };
    }
}
