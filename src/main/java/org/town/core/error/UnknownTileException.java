package org.town.core.error;

import java.util.List;

public class UnknownTileException extends MapGenerationException {

    public final String tileId;
    /** Подсказки из каталога: сначала id того же слоя, затем остальные. */
    public final List<String> suggestions;

    public UnknownTileException(String tileId, List<String> suggestions) {
        super(MapErrorCode.UNKNOWN_TILE, buildMessage(tileId, suggestions));
        this.tileId = tileId;
        this.suggestions = List.copyOf(suggestions);
    }

    private static String buildMessage(String tileId, List<String> suggestions) {
        String msg = "Unknown tile: \"" + tileId + "\".";
        if (suggestions != null && !suggestions.isEmpty()) {
            msg += " Available: " + String.join(", ", suggestions);
        }
        return msg;
    }
}
