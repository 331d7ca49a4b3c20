package com.flowmable.stitcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * One continuous stitch route for a color grouping: an ordered sequence of
 * {@link Rect} cells with {@link StitchPath} connectors between cells that are not
 * adjacent.
 * <p>
 * Mutable only through {@link #setShapes(List)} and the {@code walk} methods;
 * each instance belongs to exactly one layer.
 */
public final class Partition {

    private final int color;
    private String name;
    private List<Shape> shapes;

    public Partition(List<? extends Shape> shapes, String name, int color) {
        this.shapes = new ArrayList<>(shapes);
        this.name = name;
        this.color = color & 0xFFFFFF;
    }

    public int color() {
        return color;
    }

    /** Fill color as {@code #rrggbb}. */
    public String hexColor() {
        return ColorSpaceUtils.toHex(color);
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<Shape> shapes() {
        return Collections.unmodifiableList(shapes);
    }

    public void setShapes(List<? extends Shape> shapes) {
        this.shapes = new ArrayList<>(shapes);
    }

    /** Pixel cells in stitch order, connectors skipped. */
    public List<Coord> pixels() {
        List<Coord> pixels = new ArrayList<>(shapes.size());
        for (Shape s : shapes) {
            if (s instanceof Rect r) {
                pixels.add(r.coord());
            }
        }
        return pixels;
    }

    public int pixelCount() {
        int n = 0;
        for (Shape s : shapes) {
            if (s instanceof Rect) n++;
        }
        return n;
    }

    public int jumpStitchCount() {
        return countJumpStitches(pixels());
    }

    /**
     * Re-order the cells with the {@link DirectionalWalker}. Per-cell angle overrides follow
     * their cell. Old connectors are dropped and every pair of consecutive cells that are not
     * adjacent gets a straight connector.
     */
    public void walk(WalkMode mode, Coord start) {
        reorder(mode, start, PartitionOrderer::straightConnector);
    }

    /**
     * Like {@link #walk(WalkMode, Coord)}, but connectors are routed by {@code pathFinder},
     * falling back to a straight connector where no route exists.
     */
    public void walk(WalkMode mode, Coord start, GridPathFinder pathFinder, boolean useWeights) {
        reorder(mode, start, (from, to) -> pathFinder.findConnector(color, from, to, useWeights)
                .orElseGet(() -> PartitionOrderer.straightConnector(from, to)));
    }

    private void reorder(WalkMode mode, Coord start, BiFunction<Coord, Coord, List<Coord>> connector) {
        Map<Coord, Rect> cells = new HashMap<>();
        List<Coord> mask = new ArrayList<>();
        for (Shape s : shapes) {
            if (s instanceof Rect r) {
                cells.put(r.coord(), r);
                mask.add(r.coord());
            }
        }
        List<Coord> order = DirectionalWalker.walk(mask, start, mode);
        List<Shape> reordered = new ArrayList<>(order.size() * 2);
        for (int i = 0; i < order.size(); i++) {
            Coord c = order.get(i);
            if (i > 0 && order.get(i - 1).chebyshevDistance(c) > 1) {
                reordered.add(new StitchPath(connector.apply(order.get(i - 1), c)));
            }
            reordered.add(cells.get(c));
        }
        this.shapes = reordered;
    }

    public Partition copy() {
        return new Partition(shapes, name, color);
    }

    /**
     * Order-adjacent pixel pairs whose Chebyshev distance exceeds 1.
     */
    public static int countJumpStitches(List<Coord> order) {
        int jumps = 0;
        for (int i = 1; i < order.size(); i++) {
            if (order.get(i - 1).chebyshevDistance(order.get(i)) > 1) {
                jumps++;
            }
        }
        return jumps;
    }

    @Override
    public String toString() {
        return "Partition[" + name + ", " + hexColor() + ", shapes=" + shapes.size() + "]";
    }
}
