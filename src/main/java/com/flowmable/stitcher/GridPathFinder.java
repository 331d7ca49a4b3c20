package com.flowmable.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connector routing over pixel-grid corners.
 * <p>
 * One {@link VertexGraph} is built lazily per {@code (color, weighted)} pair and cached for the
 * lifetime of the finder. Building is guarded per key, so concurrent callers share one graph.
 */
public final class GridPathFinder {

    private static final Logger logger = LoggerFactory.getLogger(GridPathFinder.class);

    private record GraphKey(int color, boolean weighted) {}

    private final RasterGrid grid;
    private final PlannerSettings.RouteSurface surface;
    private final EdgeWeighting weighting;
    private final Map<GraphKey, VertexGraph> cache = new ConcurrentHashMap<>();

    public GridPathFinder(RasterGrid grid) {
        this(grid, PlannerSettings.RouteSurface.ANY_OPAQUE, EdgeWeighting.TRUNCATED_SQUARE);
    }

    public GridPathFinder(RasterGrid grid, PlannerSettings.RouteSurface surface, EdgeWeighting weighting) {
        if (grid == null || surface == null || weighting == null) {
            throw new IllegalArgumentException("grid, surface and weighting must not be null");
        }
        this.grid = grid;
        this.surface = surface;
        this.weighting = weighting;
    }

    VertexGraph graph(int color, boolean weighted) {
        return cache.computeIfAbsent(new GraphKey(color & 0xFFFFFF, weighted), key -> {
            VertexGraph g = VertexGraph.build(grid, key.color(), key.weighted(), surface, weighting);
            logger.debug("Built vertex graph for {} (weighted={}): {} edges",
                    ColorSpaceUtils.toHex(key.color()), key.weighted(), g.edgeCount());
            return g;
        });
    }

    int cachedGraphCount() {
        return cache.size();
    }

    /**
     * Route between two grid corners.
     *
     * @param useWeights Dijkstra over perceptual weights when true, fewest edges (BFS) otherwise
     * @return corners from {@code start} to {@code end} inclusive, or empty when either corner
     * borders no usable pixel or the two are not connected
     */
    public Optional<List<Coord>> findPath(int color, Coord start, Coord end, boolean useWeights) {
        VertexGraph g = graph(color, useWeights);
        if (!g.contains(start) || !g.contains(end)) {
            logger.warn("Start or end corner not in vertex graph. Start: {}, End: {}", start, end);
            return Optional.empty();
        }
        List<Coord> path = useWeights ? g.dijkstra(start, end) : g.breadthFirst(start, end);
        if (path == null) {
            logger.debug("No route between {} and {}", start, end);
        }
        return Optional.ofNullable(path);
    }

    /**
     * Connector between two pixels: routed from the top-left corner of {@code from} to the
     * top-left corner of {@code to}, then trimmed and simplified.
     */
    public Optional<List<Coord>> findConnector(int color, Coord from, Coord to, boolean useWeights) {
        return findPath(color, from, to, useWeights)
                .map(GridPathFinder::trimToPixelBounds)
                .map(GridPathFinder::simplify);
    }

    /**
     * Drops leading corners that still belong to the start pixel and trailing corners that
     * already belong to the end pixel, keeping the last exit corner and the first entry corner.
     * The start and end pixels are the ones whose top-left corners are the path's endpoints.
     * Degenerate results (start index not before end index) return the input unchanged, or its
     * single point when both endpoints coincide.
     */
    public static List<Coord> trimToPixelBounds(List<Coord> path) {
        if (path.size() < 2) {
            return path;
        }
        Set<Coord> startCorners = pixelCorners(path.get(0));
        Set<Coord> endCorners = pixelCorners(path.get(path.size() - 1));

        int startIdx = 0;
        for (int i = 0; i < path.size(); i++) {
            if (!startCorners.contains(path.get(i))) break;
            startIdx = i;
        }
        int endIdx = path.size() - 1;
        for (int i = path.size() - 1; i >= 0; i--) {
            if (!endCorners.contains(path.get(i))) break;
            endIdx = i;
        }

        if (startIdx >= endIdx) {
            if (path.get(0).equals(path.get(path.size() - 1))) {
                return List.of(path.get(0));
            }
            return path;
        }
        return new ArrayList<>(path.subList(startIdx, endIdx + 1));
    }

    private static Set<Coord> pixelCorners(Coord topLeft) {
        return Set.of(topLeft, topLeft.offset(1, 0), topLeft.offset(0, 1), topLeft.offset(1, 1));
    }

    /**
     * Keeps the first point, the last point and every point where the step direction changes.
     */
    public static List<Coord> simplify(List<Coord> path) {
        if (path.size() < 2) {
            return new ArrayList<>(path);
        }
        List<Coord> simplified = new ArrayList<>();
        simplified.add(path.get(0));
        for (int i = 1; i < path.size() - 1; i++) {
            Coord prev = path.get(i - 1);
            Coord cur = path.get(i);
            Coord next = path.get(i + 1);
            int dx1 = cur.x() - prev.x();
            int dy1 = cur.y() - prev.y();
            int dx2 = next.x() - cur.x();
            int dy2 = next.y() - cur.y();
            if (dx1 != dx2 || dy1 != dy2) {
                simplified.add(cur);
            }
        }
        simplified.add(path.get(path.size() - 1));
        return simplified;
    }
}
