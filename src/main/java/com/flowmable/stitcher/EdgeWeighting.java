package com.flowmable.stitcher;

/**
 * Maps the CIEDE2000 difference between a route's color and a bordering pixel to a vertex-graph edge cost.
 * Costs must be at least 1.
 */
@FunctionalInterface
public interface EdgeWeighting {

    /** {@code 1 + 0.1·ΔE²}, truncated to an integer. */
    EdgeWeighting TRUNCATED_SQUARE = deltaE -> (long) (1 + 0.1 * deltaE * deltaE);

    /** {@code 1 + 0.1·ΔE²}, rounded to the nearest integer. */
    EdgeWeighting ROUNDED_SQUARE = deltaE -> Math.round(1 + 0.1 * deltaE * deltaE);

    long weight(double deltaE);
}
