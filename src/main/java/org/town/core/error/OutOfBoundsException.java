package org.town.core.error;

public class OutOfBoundsException extends MapGenerationException {

    public final int x;
    public final int y;

    public OutOfBoundsException(int x, int y, int width, int height) {
        super(MapErrorCode.OUT_OF_BOUNDS,
                "Position (" + x + ", " + y + ") is out of bounds. Map is " + width + "x" + height + ".");
        this.x = x;
        this.y = y;
    }
}
