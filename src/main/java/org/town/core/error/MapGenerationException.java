package org.town.core.error;

/**
 * Базовая ошибка генерации карты. Код позволяет вызывающему решать,
 * пропустить клетку или прервать генерацию.
 */
public class MapGenerationException extends RuntimeException {

    private final MapErrorCode code;

    public MapGenerationException(MapErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public MapGenerationException(MapErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public MapErrorCode code() {
        return code;
    }
}
