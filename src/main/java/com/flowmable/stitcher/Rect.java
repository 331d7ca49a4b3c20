package com.flowmable.stitcher;

/**
 * A single embroidered pixel.
 *
 * @param x             pixel column
 * @param y             pixel row
 * @param angleOverride fill angle in degrees for this cell, or null to use the checkerboard angles
 */
public record Rect(int x, int y, Integer angleOverride) implements Shape {

    public Rect(int x, int y) {
        this(x, y, null);
    }

    public static Rect at(Coord c) {
        return new Rect(c.x(), c.y());
    }

    public Coord coord() {
        return new Coord(x, y);
    }

    public Rect withAngle(Integer angle) {
        return new Rect(x, y, angle);
    }

    /**
     * Stitch angle for this cell: the override if present, else even/odd by {@code (x + y)} parity.
     */
    public int angle(EmbroideryParameters params) {
        if (angleOverride != null) {
            return angleOverride;
        }
        return Math.floorMod(x + y, 2) == 0
                ? params.evenPixelAngleDegrees()
                : params.oddPixelAngleDegrees();
    }
}
