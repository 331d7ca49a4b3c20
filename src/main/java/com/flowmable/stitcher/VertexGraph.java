package com.flowmable.stitcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Graph over pixel-grid corners for one route color.
 * <p>
 * Corner {@code (x, y)} with {@code 0 ≤ x ≤ width}, {@code 0 ≤ y ≤ height} has index
 * {@code y * (width + 1) + x}. The horizontal edge {@code (x, y)–(x+1, y)} borders pixels
 * {@code (x, y-1)} and {@code (x, y)}; the vertical edge {@code (x, y)–(x, y+1)} borders
 * pixels {@code (x-1, y)} and {@code (x, y)}. A stored weight of 0 means no edge.
 */
final class VertexGraph {

    static final long INFINITE = Long.MAX_VALUE;

    private final int cols;
    private final int rows;
    private final long[] right;
    private final long[] down;
    private final boolean[] present;
    private final int edgeCount;

    private VertexGraph(int cols, int rows, long[] right, long[] down) {
        this.cols = cols;
        this.rows = rows;
        this.right = right;
        this.down = down;
        this.present = new boolean[cols * rows];
        int edges = 0;
        for (int i = 0; i < right.length; i++) {
            if (right[i] > 0) {
                present[i] = true;
                present[i + 1] = true;
                edges++;
            }
            if (down[i] > 0) {
                present[i] = true;
                present[i + cols] = true;
                edges++;
            }
        }
        this.edgeCount = edges;
    }

    static VertexGraph build(RasterGrid grid, int color, boolean weighted,
                             PlannerSettings.RouteSurface surface, EdgeWeighting weighting) {
        int cols = grid.width() + 1;
        int rows = grid.height() + 1;
        long[] right = new long[cols * rows];
        long[] down = new long[cols * rows];

        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int idx = y * cols + x;
                if (x + 1 < cols && usable(grid, color, surface, x, y - 1, x, y)) {
                    right[idx] = weighted
                            ? Math.min(pixelWeight(grid, color, weighting, x, y - 1), pixelWeight(grid, color, weighting, x, y))
                            : 1;
                }
                if (y + 1 < rows && usable(grid, color, surface, x - 1, y, x, y)) {
                    down[idx] = weighted
                            ? Math.min(pixelWeight(grid, color, weighting, x - 1, y), pixelWeight(grid, color, weighting, x, y))
                            : 1;
                }
            }
        }
        return new VertexGraph(cols, rows, right, down);
    }

    private static boolean usable(RasterGrid grid, int color, PlannerSettings.RouteSurface surface,
                                  int x1, int y1, int x2, int y2) {
        if (surface == PlannerSettings.RouteSurface.SAME_COLOR) {
            return grid.colorAt(x1, y1) == color || grid.colorAt(x2, y2) == color;
        }
        return grid.isSolid(x1, y1) || grid.isSolid(x2, y2);
    }

    private static long pixelWeight(RasterGrid grid, int color, EdgeWeighting weighting, int x, int y) {
        int c = grid.colorAt(x, y);
        if (c == RasterGrid.EMPTY) {
            return INFINITE;
        }
        return Math.max(1L, weighting.weight(ColorSpaceUtils.deltaE2000(color, c)));
    }

    int edgeCount() {
        return edgeCount;
    }

    boolean contains(Coord corner) {
        int idx = index(corner);
        return idx >= 0 && present[idx];
    }

    long weight(Coord a, Coord b) {
        int ia = index(a);
        int ib = index(b);
        if (ia < 0 || ib < 0) return 0;
        int lo = Math.min(ia, ib);
        int hi = Math.max(ia, ib);
        if (hi == lo + 1 && lo % cols != cols - 1) return right[lo];
        if (hi == lo + cols) return down[lo];
        return 0;
    }

    private int index(Coord c) {
        if (c.x() < 0 || c.x() >= cols || c.y() < 0 || c.y() >= rows) return -1;
        return c.y() * cols + c.x();
    }

    private Coord corner(int idx) {
        return new Coord(idx % cols, idx / cols);
    }

    /**
     * Neighbors of {@code idx} in ascending index order: up, left, right, down.
     * Writes into {@code out} and returns how many were written; weights go to {@code costs}.
     */
    private int neighbors(int idx, int[] out, long[] costs) {
        int n = 0;
        if (idx >= cols && down[idx - cols] > 0) {
            out[n] = idx - cols;
            costs[n++] = down[idx - cols];
        }
        if (idx % cols > 0 && right[idx - 1] > 0) {
            out[n] = idx - 1;
            costs[n++] = right[idx - 1];
        }
        if (right[idx] > 0) {
            out[n] = idx + 1;
            costs[n++] = right[idx];
        }
        if (down[idx] > 0) {
            out[n] = idx + cols;
            costs[n++] = down[idx];
        }
        return n;
    }

    /** Fewest-edges route; null when unreachable. */
    List<Coord> breadthFirst(Coord start, Coord end) {
        int s = index(start);
        int t = index(end);
        int[] parent = new int[cols * rows];
        Arrays.fill(parent, -1);
        boolean[] seen = new boolean[cols * rows];
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(s);
        seen[s] = true;
        int[] nbr = new int[4];
        long[] cost = new long[4];

        while (!queue.isEmpty()) {
            int cur = queue.poll();
            if (cur == t) {
                return reconstruct(parent, s, t);
            }
            int n = neighbors(cur, nbr, cost);
            for (int i = 0; i < n; i++) {
                if (!seen[nbr[i]]) {
                    seen[nbr[i]] = true;
                    parent[nbr[i]] = cur;
                    queue.add(nbr[i]);
                }
            }
        }
        return null;
    }

    private record QueueEntry(long dist, int node) {}

    /** Minimum-cost route; ties settle on the lower corner index. Null when unreachable. */
    List<Coord> dijkstra(Coord start, Coord end) {
        int s = index(start);
        int t = index(end);
        long[] dist = new long[cols * rows];
        Arrays.fill(dist, INFINITE);
        int[] parent = new int[cols * rows];
        Arrays.fill(parent, -1);
        boolean[] done = new boolean[cols * rows];
        PriorityQueue<QueueEntry> pq = new PriorityQueue<>((a, b) -> {
            int c = Long.compare(a.dist(), b.dist());
            return c != 0 ? c : Integer.compare(a.node(), b.node());
        });
        dist[s] = 0;
        pq.add(new QueueEntry(0, s));
        int[] nbr = new int[4];
        long[] cost = new long[4];

        while (!pq.isEmpty()) {
            QueueEntry e = pq.poll();
            int cur = e.node();
            if (done[cur]) continue;
            done[cur] = true;
            if (cur == t) {
                return reconstruct(parent, s, t);
            }
            int n = neighbors(cur, nbr, cost);
            for (int i = 0; i < n; i++) {
                int next = nbr[i];
                if (done[next]) continue;
                long candidate = saturatingAdd(dist[cur], cost[i]);
                if (candidate < dist[next] || (dist[next] == INFINITE && parent[next] == -1)) {
                    dist[next] = candidate;
                    parent[next] = cur;
                    pq.add(new QueueEntry(candidate, next));
                }
            }
        }
        return null;
    }

    private static long saturatingAdd(long a, long b) {
        return a > INFINITE - b ? INFINITE : a + b;
    }

    private List<Coord> reconstruct(int[] parent, int s, int t) {
        List<Coord> path = new ArrayList<>();
        for (int cur = t; cur != -1; cur = cur == s ? -1 : parent[cur]) {
            path.add(corner(cur));
        }
        Collections.reverse(path);
        return path;
    }
}
