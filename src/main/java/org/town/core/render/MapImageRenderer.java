package org.town.core.render;

import org.town.core.model.Cell;
import org.town.core.model.Layer;
import org.town.core.model.MapGrid;
import org.town.core.model.TileDefinition;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Рендер готовой карты в растровое изображение.
 *
 * Порядок:
 * 1) собрать уникальные тайлы выбранных слоёв;
 * 2) извлечь и отмасштабировать каждый один раз (SpriteCache);
 * 3) залить холст фоном;
 * 4) наложить сначала ground, потом objects (объекты всегда поверх земли).
 */
public class MapImageRenderer {

    private final boolean verbose;

    public MapImageRenderer() {
        this(false);
    }

    public MapImageRenderer(boolean verbose) {
        this.verbose = verbose;
    }

    public RenderResult render(MapGrid grid, Path atlasFile, RenderOptions options) {
        BufferedImage atlas;
        try {
            atlas = ImageIO.read(atlasFile.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read atlas image: " + atlasFile, e);
        }
        if (atlas == null) {
            throw new IllegalStateException("Unsupported atlas image format: " + atlasFile);
        }
        return render(grid, new AtlasSpriteExtractor(atlas), options);
    }

    public RenderResult render(MapGrid grid, SpriteExtractor extractor, RenderOptions options) {
        int tileSize = grid.catalog.tileSize;
        int scaled = options.scaledTileSize(tileSize);
        if (scaled <= 0) {
            throw new IllegalArgumentException("Scale " + options.scale + " gives empty tiles for tileSize " + tileSize);
        }
        int canvasW = grid.width * scaled;
        int canvasH = grid.height * scaled;

        if (verbose) {
            System.out.println("[render] Map " + grid.width + "x" + grid.height + " -> " + canvasW + "x" + canvasH
                    + " (scale " + options.scale + ", " + scaled + "px per tile)");
        }

        Map<String, TileDefinition> used = new LinkedHashMap<>();
        for (Layer layer : Layer.values()) {
            if (!options.layers.contains(layer)) continue;
            collectUsed(grid, layer, used);
        }

        SpriteCache cache = SpriteCache.build(used.values(), extractor, tileSize, scaled, options.parallel);

        BufferedImage canvas = new BufferedImage(canvasW, canvasH, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        int groundCount = 0;
        int objectCount = 0;
        try {
            g.setColor(parseColor(options.backgroundColor));
            g.fillRect(0, 0, canvasW, canvasH);

            if (options.layers.contains(Layer.GROUND)) {
                groundCount = drawLayer(g, grid, Layer.GROUND, cache, scaled);
            }
            if (options.layers.contains(Layer.OBJECT)) {
                objectCount = drawLayer(g, grid, Layer.OBJECT, cache, scaled);
            }
        } finally {
            g.dispose();
        }

        byte[] bytes = encode(canvas, options);

        if (verbose) {
            System.out.println("[render] ground=" + groundCount + " objects=" + objectCount
                    + " sprites=" + cache.size() + " bytes=" + bytes.length);
        }
        return new RenderResult(bytes, canvasW, canvasH, options.scale, groundCount, objectCount, cache.size());
    }

    public RenderResult renderToFile(MapGrid grid, Path atlasFile, Path outFile, RenderOptions options) {
        RenderResult r = render(grid, atlasFile, options);
        try {
            Path parent = outFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(outFile, r.image);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write image: " + outFile, e);
        }
        return r;
    }

    private static void collectUsed(MapGrid grid, Layer layer, Map<String, TileDefinition> used) {
        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x < grid.width; x++) {
                Cell c = grid.getTile(x, y, layer);
                if (c != null) used.putIfAbsent(c.tileId(), c.tile);
            }
        }
    }

    private static int drawLayer(Graphics2D g, MapGrid grid, Layer layer, SpriteCache cache, int scaled) {
        int count = 0;
        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x < grid.width; x++) {
                Cell c = grid.getTile(x, y, layer);
                if (c == null) continue;
                BufferedImage sprite = cache.get(c.tileId());
                if (sprite == null) continue;
                g.drawImage(sprite, x * scaled, y * scaled, null);
                count++;
            }
        }
        return count;
    }

    // ─────────────────────────────────────────────
    // Кодирование
    // ─────────────────────────────────────────────

    static byte[] encode(BufferedImage canvas, RenderOptions options) {
        String format = options.format == null ? "png" : options.format.trim().toLowerCase(Locale.ROOT);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            switch (format) {
                case "png" -> ImageIO.write(canvas, "png", out);
                case "jpeg", "jpg" -> writeJpeg(toRgb(canvas), options.quality, out);
                default -> throw new IllegalArgumentException("Unsupported output format: " + options.format);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + format + " image", e);
        }
        return out.toByteArray();
    }

    private static void writeJpeg(BufferedImage img, int quality, ByteArrayOutputStream out) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IllegalStateException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            int q = Math.max(1, Math.min(100, quality));
            param.setCompressionQuality(q / 100f);
            writer.write(null, new IIOImage(img, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    /** JPEG без альфы: рисуем на RGB-холст. */
    private static BufferedImage toRgb(BufferedImage src) {
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /** #RGB, #RRGGBB или #RRGGBBAA. */
    static Color parseColor(String value) {
        if (value == null || value.isBlank()) return Color.BLACK;
        String hex = value.trim();
        if (hex.startsWith("#")) hex = hex.substring(1);
        try {
            if (hex.length() == 3) {
                hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
            }
            if (hex.length() == 6) {
                return new Color(Integer.parseInt(hex, 16));
            }
            if (hex.length() == 8) {
                int r = Integer.parseInt(hex.substring(0, 2), 16);
                int gr = Integer.parseInt(hex.substring(2, 4), 16);
                int b = Integer.parseInt(hex.substring(4, 6), 16);
                int a = Integer.parseInt(hex.substring(6, 8), 16);
                return new Color(r, gr, b, a);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad background color: " + value, e);
        }
        throw new IllegalArgumentException("Bad background color: " + value);
    }
}
