package com.flowmable.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns one color's adjacency graph into stitch partitions.
 * <p>
 * Each connected component gets a visiting order: a self-avoiding walk when the component
 * is smaller than {@link PlannerSettings#sawThreshold()} and one exists within the step limit,
 * a stack-based depth-first traversal otherwise. Consecutive pixels that are not graph
 * neighbors are bridged with a {@link StitchPath} routed by the {@link GridPathFinder}.
 */
public final class PartitionOrderer {

    private static final Logger logger = LoggerFactory.getLogger(PartitionOrderer.class);

    private final GridPathFinder pathFinder;
    private final PlannerSettings settings;

    public PartitionOrderer(RasterGrid grid, PlannerSettings settings) {
        this(new GridPathFinder(grid, settings.routeSurface(), settings.edgeWeighting()), settings);
    }

    public PartitionOrderer(GridPathFinder pathFinder, PlannerSettings settings) {
        this.pathFinder = pathFinder;
        this.settings = settings;
    }

    /**
     * Partitions for one color: a single one named {@code #rrggbb} when grouping per color,
     * one per component named {@code #rrggbb_<index>} otherwise.
     */
    public List<Partition> order(AdjacencyGraph colorGraph) {
        String hex = ColorSpaceUtils.toHex(colorGraph.color());
        List<AdjacencyGraph> components = colorGraph.components();
        List<Partition> result = new ArrayList<>();

        if (settings.grouping() == PlannerSettings.Grouping.PER_COLOR) {
            List<Coord> order = new ArrayList<>(colorGraph.size());
            for (AdjacencyGraph component : components) {
                order.addAll(visitingOrder(component));
            }
            result.add(toPartition(colorGraph, order, hex));
        } else {
            for (int i = 0; i < components.size(); i++) {
                AdjacencyGraph component = components.get(i);
                result.add(toPartition(component, visitingOrder(component), hex + "_" + i));
            }
        }
        return result;
    }

    private Partition toPartition(AdjacencyGraph graph, List<Coord> order, String name) {
        int jumps = Partition.countJumpStitches(order);
        logger.debug("Partition {}: {} pixels, {} jump stitches", name, order.size(), jumps);
        return new Partition(emitShapes(graph, order), name, graph.color());
    }

    /**
     * Order in which one connected component is stitched, starting at its
     * {@linkplain AdjacencyGraph#startingNode() starting node}.
     */
    public List<Coord> visitingOrder(AdjacencyGraph component) {
        Coord start = component.startingNode();
        if (component.size() <= 1) {
            return start == null ? List.of() : List.of(start);
        }

        if (component.size() < settings.sawThreshold()) {
            SelfAvoidingWalk.Result saw = SelfAvoidingWalk.search(component, start, settings.sawStepLimit());
            if (saw.complete()) {
                logger.debug("Component of {} pixels from {}: self-avoiding walk in {} steps",
                        component.size(), start, saw.steps());
                return saw.walk();
            }
            if (saw.limitHit()) {
                logger.warn("Self-avoiding walk hit its step limit of {} on a component of {} pixels, longest walk {}",
                        settings.sawStepLimit(), component.size(), saw.longest().size());
            } else {
                logger.debug("No self-avoiding walk covers the component of {} pixels (longest {}), using DFS",
                        component.size(), saw.longest().size());
            }
        }

        logger.debug("Component of {} pixels from {}: depth-first traversal", component.size(), start);
        return depthFirst(component, start);
    }

    /**
     * Iterative DFS that pushes every neighbor and skips already visited pixels on pop.
     */
    List<Coord> depthFirst(AdjacencyGraph graph, Coord start) {
        Set<Coord> visited = new HashSet<>();
        List<Coord> order = new ArrayList<>(graph.size());
        Deque<Coord> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            Coord node = stack.pop();
            if (!visited.add(node)) continue;
            order.add(node);
            List<Coord> neighbors = graph.neighbors(node);
            if (settings.tieBreak() == PlannerSettings.NeighborTieBreak.DESCENDING) {
                neighbors = new ArrayList<>(neighbors);
                neighbors.sort(Comparator.reverseOrder());
            }
            for (Coord n : neighbors) {
                stack.push(n);
            }
        }
        return order;
    }

    /**
     * One {@link Rect} per pixel in {@code order}, with a connector after every pixel whose
     * successor is not one of its graph neighbors.
     */
    public List<Shape> emitShapes(AdjacencyGraph graph, List<Coord> order) {
        List<Shape> shapes = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            Coord current = order.get(i);
            shapes.add(Rect.at(current));
            if (i + 1 < order.size()) {
                Coord next = order.get(i + 1);
                if (!graph.areNeighbors(current, next)) {
                    shapes.add(new StitchPath(bridge(graph.color(), current, next)));
                }
            }
        }
        return shapes;
    }

    private List<Coord> bridge(int color, Coord from, Coord to) {
        Optional<List<Coord>> route = pathFinder.findConnector(color, from, to, settings.weightedBridges());
        if (route.isPresent()) {
            return route.get();
        }
        logger.debug("No connector route from {} to {}, using a straight connector", from, to);
        return straightConnector(from, to);
    }

    /**
     * Direct line when the two share a row or column, otherwise one right-angle bend.
     */
    static List<Coord> straightConnector(Coord from, Coord to) {
        if (from.x() == to.x() || from.y() == to.y()) {
            return List.of(from, to);
        }
        return List.of(from, new Coord(to.x(), from.y()), to);
    }
}
