package com.flowmable.stitcher;

/**
 * Knobs of the pixel-to-stitch-path pipeline.
 *
 * @param grouping          one partition per color, or one per connected component
 * @param sawThreshold      components strictly smaller than this try the self-avoiding walk first
 * @param sawStepLimit      maximum backtracking steps per self-avoiding-walk attempt
 * @param tieBreak          order in which the depth-first traversal expands neighbors
 * @param weightedBridges   route connectors with Dijkstra over perceptual weights instead of BFS
 * @param routeSurface      which pixels make a grid edge usable for connectors
 * @param directionRotation rotation of the 8-neighbor direction order, −8..7
 * @param edgeWeighting     ΔE → edge cost for weighted routing
 */
public record PlannerSettings(
        Grouping grouping,
        int sawThreshold,
        long sawStepLimit,
        NeighborTieBreak tieBreak,
        boolean weightedBridges,
        RouteSurface routeSurface,
        int directionRotation,
        EdgeWeighting edgeWeighting
) {

    public enum Grouping {
        PER_COLOR,
        PER_COMPONENT
    }

    public enum NeighborTieBreak {
        /** Neighbors in the adjacency graph's direction order. */
        DIRECTION_ORDER,
        /** Neighbors sorted by descending row-major coordinate. */
        DESCENDING
    }

    public enum RouteSurface {
        /** An edge is usable when either bordering pixel is opaque. */
        ANY_OPAQUE,
        /** An edge is usable when either bordering pixel has the route's color. */
        SAME_COLOR
    }

    public static final PlannerSettings DEFAULT = new PlannerSettings(
            Grouping.PER_COLOR,
            40,
            2_000_000L,
            NeighborTieBreak.DIRECTION_ORDER,
            false,
            RouteSurface.ANY_OPAQUE,
            0,
            EdgeWeighting.TRUNCATED_SQUARE
    );

    public PlannerSettings {
        if (grouping == null || tieBreak == null || routeSurface == null || edgeWeighting == null) {
            throw new IllegalArgumentException("PlannerSettings fields must not be null");
        }
        if (sawThreshold < 0) {
            throw new IllegalArgumentException("sawThreshold must be >= 0: " + sawThreshold);
        }
        if (sawStepLimit <= 0) {
            throw new IllegalArgumentException("sawStepLimit must be > 0: " + sawStepLimit);
        }
        if (directionRotation < -8 || directionRotation > 7) {
            throw new IllegalArgumentException("directionRotation out of range [-8, 7]: " + directionRotation);
        }
    }

    public PlannerSettings withGrouping(Grouping value) {
        return new PlannerSettings(value, sawThreshold, sawStepLimit, tieBreak, weightedBridges,
                routeSurface, directionRotation, edgeWeighting);
    }

    public PlannerSettings withSawThreshold(int value) {
        return new PlannerSettings(grouping, value, sawStepLimit, tieBreak, weightedBridges,
                routeSurface, directionRotation, edgeWeighting);
    }

    public PlannerSettings withTieBreak(NeighborTieBreak value) {
        return new PlannerSettings(grouping, sawThreshold, sawStepLimit, value, weightedBridges,
                routeSurface, directionRotation, edgeWeighting);
    }

    public PlannerSettings withWeightedBridges(boolean value) {
        return new PlannerSettings(grouping, sawThreshold, sawStepLimit, tieBreak, value,
                routeSurface, directionRotation, edgeWeighting);
    }

    public PlannerSettings withRouteSurface(RouteSurface value) {
        return new PlannerSettings(grouping, sawThreshold, sawStepLimit, tieBreak, weightedBridges,
                value, directionRotation, edgeWeighting);
    }
}
