package com.flowmable.stitcher;

import java.awt.image.BufferedImage;

/**
 * Read-only color lookup derived from an input image.
 * <p>
 * Each cell holds a packed 24-bit {@code 0xRRGGBB} color, or {@link #EMPTY} for pixels
 * whose alpha is not fully opaque. Empty cells never take part in any graph.
 */
public final class RasterGrid {

    public static final int EMPTY = -1;

    private final int width;
    private final int height;
    private final int[] colors;

    private RasterGrid(int width, int height, int[] colors) {
        this.width = width;
        this.height = height;
        this.colors = colors;
    }

    /**
     * Snapshot an image. Pixels with alpha != 255 become {@link #EMPTY}.
     *
     * @throws IllegalArgumentException if the image is null or has zero area
     */
    public static RasterGrid from(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Image must not be null");
        }
        int w = image.getWidth();
        int h = image.getHeight();
        if (w <= 0 || h <= 0) {
            throw new IllegalArgumentException("Image has zero area: " + w + "x" + h);
        }
        int[] colors = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                int a = (argb >>> 24) & 0xFF;
                colors[y * w + x] = a == 0xFF ? argb & 0xFFFFFF : EMPTY;
            }
        }
        return new RasterGrid(w, h, colors);
    }

    /**
     * Build a grid from rows of packed colors, {@link #EMPTY} for holes. Row {@code y} is {@code rows[y]}.
     */
    public static RasterGrid of(int[][] rows) {
        if (rows == null || rows.length == 0 || rows[0].length == 0) {
            throw new IllegalArgumentException("Grid has zero area");
        }
        int h = rows.length;
        int w = rows[0].length;
        int[] colors = new int[w * h];
        for (int y = 0; y < h; y++) {
            if (rows[y].length != w) {
                throw new IllegalArgumentException("Row " + y + " has " + rows[y].length + " cells, expected " + w);
            }
            for (int x = 0; x < w; x++) {
                int c = rows[y][x];
                colors[y * w + x] = c == EMPTY ? EMPTY : c & 0xFFFFFF;
            }
        }
        return new RasterGrid(w, h, colors);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Color at {@code (x, y)}, or {@link #EMPTY} if transparent or out of bounds.
     */
    public int colorAt(int x, int y) {
        return inBounds(x, y) ? colors[y * width + x] : EMPTY;
    }

    public boolean isSolid(int x, int y) {
        return colorAt(x, y) != EMPTY;
    }
}
