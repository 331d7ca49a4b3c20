package com.flowmable.stitcher;

/**
 * Integer grid coordinate, origin top-left.
 * <p>
 * Used both for pixel positions (adjacency graphs, Rect shapes) and for pixel-grid
 * corners (vertex graph, connector paths). Pixel {@code (x, y)} has corners
 * {@code (x, y)}, {@code (x+1, y)}, {@code (x, y+1)} and {@code (x+1, y+1)}.
 *
 * @param x column
 * @param y row
 */
public record Coord(int x, int y) implements Comparable<Coord> {

    public static Coord of(int x, int y) {
        return new Coord(x, y);
    }

    public Coord offset(int dx, int dy) {
        return new Coord(x + dx, y + dy);
    }

    /**
     * Chebyshev distance: 1 for any of the 8 surrounding pixels.
     */
    public int chebyshevDistance(Coord other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    /** Row-major order: y first, then x. */
    @Override
    public int compareTo(Coord other) {
        int c = Integer.compare(y, other.y);
        return c != 0 ? c : Integer.compare(x, other.x);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
