package org.town.core.render;

import org.town.core.model.Layer;
import org.town.core.model.config.MapConfig;

import java.util.EnumSet;
import java.util.Set;

/** Параметры рендера карты. */
public class RenderOptions {

    /** Множитель размера тайла атласа (0.25 = 256px -> 64px). */
    public double scale = 0.25;
    /** "png" или "jpeg". */
    public String format = "png";
    /** Качество JPEG, 1..100. Для png игнорируется. */
    public int quality = 90;
    /** #RRGGBB или #RRGGBBAA. */
    public String backgroundColor = "#000000";
    public Set<Layer> layers = EnumSet.allOf(Layer.class);
    /** Извлекать спрайты параллельно (по одному заданию на уникальный тайл). */
    public boolean parallel = true;

    public static RenderOptions fromConfig(MapConfig cfg) {
        RenderOptions o = new RenderOptions();
        o.scale = cfg.renderScale;
        o.format = cfg.renderFormat;
        o.quality = cfg.renderQuality;
        o.backgroundColor = cfg.renderBackground;
        o.parallel = cfg.renderParallel;
        return o;
    }

    public int scaledTileSize(int tileSize) {
        return (int) Math.round(tileSize * scale);
    }
}
