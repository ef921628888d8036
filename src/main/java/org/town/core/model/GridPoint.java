package org.town.core.model;

public record GridPoint(int x, int y) {

    public GridPoint step(Direction d) {
        return new GridPoint(x + d.dx, y + d.dy);
    }

    public int manhattan(GridPoint other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
