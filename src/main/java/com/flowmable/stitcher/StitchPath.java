package com.flowmable.stitcher;

import java.util.List;

/**
 * A connector between two non-adjacent pixels, as a polyline over pixel-grid corners.
 *
 * @param points corners in travel order; copied on construction
 */
public record StitchPath(List<Coord> points) implements Shape {

    public StitchPath {
        points = List.copyOf(points);
    }

    public static StitchPath of(Coord... points) {
        return new StitchPath(List.of(points));
    }

    public Coord first() {
        return points.get(0);
    }

    public Coord last() {
        return points.get(points.size() - 1);
    }
}
