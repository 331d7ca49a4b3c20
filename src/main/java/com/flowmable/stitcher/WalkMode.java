package com.flowmable.stitcher;

/**
 * Visiting patterns of the {@link DirectionalWalker}.
 * <p>
 * Clockwise modes rotate through S, W, N, E; counter-clockwise ones through S, E, N, W.
 * Spiral modes expand the highest-priority neighbor first, snake modes the lowest.
 * <p>
 * Only spiral modes push candidates in reverse priority order; snake modes push them in
 * priority order, so the last-pushed (lowest-priority) neighbor is popped first. The snake
 * orders depend on this.
 */
public enum WalkMode {
    SPIRAL_CW(true, true),
    SPIRAL_CCW(false, true),
    SNAKE_CW(true, false),
    SNAKE_CCW(false, false);

    private final boolean clockwise;
    private final boolean spiral;

    WalkMode(boolean clockwise, boolean spiral) {
        this.clockwise = clockwise;
        this.spiral = spiral;
    }

    public boolean clockwise() {
        return clockwise;
    }

    public boolean spiral() {
        return spiral;
    }
}
