package com.flowmable.stitcher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups same-colored, 8-connected pixels into one {@link AdjacencyGraph} per color.
 * <p>
 * Deterministic: pixels are scanned column by column (x outer, y inner), so colors, nodes and
 * components appear in column-major order, and neighbor lists always follow the same
 * direction order.
 */
public final class ColorGraphBuilder {

    // NW, N, NE, E, SE, S, SW, W
    private static final int[] DX = {-1, 0, 1, 1, 1, 0, -1, -1};
    private static final int[] DY = {-1, -1, -1, 0, 1, 1, 1, 0};

    private final int[] order;

    public ColorGraphBuilder() {
        this(0);
    }

    /**
     * @param directionRotation rotates the direction order left by {@code |r|} positions,
     *                          reversing it when negative. Range −8..7.
     */
    public ColorGraphBuilder(int directionRotation) {
        if (directionRotation < -8 || directionRotation > 7) {
            throw new IllegalArgumentException("directionRotation out of range [-8, 7]: " + directionRotation);
        }
        this.order = directionOrder(directionRotation);
    }

    static int[] directionOrder(int rotation) {
        int n = DX.length;
        int shift = Math.abs(rotation) % n;
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = (i + shift) % n;
        }
        if (rotation < 0) {
            for (int i = 0, j = n - 1; i < j; i++, j--) {
                int tmp = order[i];
                order[i] = order[j];
                order[j] = tmp;
            }
        }
        return order;
    }

    /**
     * @return color → adjacency graph; empty when the grid has no opaque pixel
     */
    public Map<Integer, AdjacencyGraph> build(RasterGrid grid) {
        int w = grid.width();
        int h = grid.height();
        Map<Integer, Map<Coord, List<Coord>>> byColor = new LinkedHashMap<>();

        for (int x = 0; x < w; x++) {
            for (int y = 0; y < h; y++) {
                int color = grid.colorAt(x, y);
                if (color == RasterGrid.EMPTY) continue;

                List<Coord> neighbors = new ArrayList<>(8);
                for (int d : order) {
                    int nx = x + DX[d];
                    int ny = y + DY[d];
                    if (grid.inBounds(nx, ny) && grid.colorAt(nx, ny) == color) {
                        neighbors.add(new Coord(nx, ny));
                    }
                }
                byColor.computeIfAbsent(color, k -> new LinkedHashMap<>()).put(new Coord(x, y), neighbors);
            }
        }

        Map<Integer, AdjacencyGraph> result = new LinkedHashMap<>();
        for (Map.Entry<Integer, Map<Coord, List<Coord>>> e : byColor.entrySet()) {
            result.put(e.getKey(), new AdjacencyGraph(e.getKey(), e.getValue()));
        }
        return result;
    }
}
