package org.town.core.generation;

import org.town.core.error.MapErrorCode;
import org.town.core.error.MapGenerationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат действия над картой. Ошибки низкого уровня сюда приходят
 * как код + текст, наружу не пробрасываются.
 */
public final class ActionResult {

    public final boolean success;
    public final MapErrorCode code;
    public final String error;
    public final String suggestion;

    // детали (заполняются тем действием, которому они нужны)
    public int tilesPlaced;
    public int tilesUpgraded;
    public int tilesSkipped;
    public int budgetRemaining = -1;
    public final List<String> warnings = new ArrayList<>();
    public final List<String> errors = new ArrayList<>();
    public final List<ActionResult> items = new ArrayList<>();
    public RepairResult repair;

    private ActionResult(boolean success, MapErrorCode code, String error, String suggestion) {
        this.success = success;
        this.code = code;
        this.error = error;
        this.suggestion = suggestion;
    }

    public static ActionResult ok() {
        return new ActionResult(true, null, null, null);
    }

    /** Частичный успех: действие выполнено, но с ошибками по отдельным клеткам. */
    public static ActionResult partial(List<String> errors) {
        ActionResult r = new ActionResult(errors.isEmpty(), null, null, null);
        r.errors.addAll(errors);
        return r;
    }

    public static ActionResult fail(MapErrorCode code, String error) {
        return new ActionResult(false, code, error, null);
    }

    public static ActionResult fail(MapErrorCode code, String error, String suggestion) {
        return new ActionResult(false, code, error, suggestion);
    }

    public static ActionResult fail(MapGenerationException e) {
        return new ActionResult(false, e.code(), e.getMessage(), null);
    }

    @Override
    public String toString() {
        if (success) {
            return "OK placed=" + tilesPlaced + " upgraded=" + tilesUpgraded + " skipped=" + tilesSkipped
                    + (warnings.isEmpty() ? "" : " warnings=" + warnings);
        }
        return "FAIL " + (code == null ? "" : code + ": ") + (error != null ? error : errors)
                + (suggestion == null ? "" : " (" + suggestion + ")");
    }
}
