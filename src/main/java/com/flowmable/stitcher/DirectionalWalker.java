package com.flowmable.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Re-orders a known set of pixels from a chosen start pixel, 4-connected, with a rotating
 * neighbor priority.
 * <p>
 * Every step looks at the four cardinal neighbors ordered so that the one opposite the
 * current heading comes first, then the rest of the cycle in the mode's rotation. Each
 * pushed neighbor carries the heading it was reached with. Pixels the walk cannot reach
 * are appended afterwards in their original relative order.
 */
public final class DirectionalWalker {

    private static final Logger logger = LoggerFactory.getLogger(DirectionalWalker.class);

    enum Heading {
        S(0, 1), W(-1, 0), N(0, -1), E(1, 0);

        final int dx;
        final int dy;

        Heading(int dx, int dy) {
            this.dx = dx;
            this.dy = dy;
        }
    }

    private static final Heading[] CLOCKWISE = {Heading.S, Heading.W, Heading.N, Heading.E};
    private static final Heading[] COUNTER_CLOCKWISE = {Heading.S, Heading.E, Heading.N, Heading.W};

    private record Step(Coord coord, Heading heading) {}

    private DirectionalWalker() {}

    /**
     * @param mask  pixels that may be visited, in their current order
     * @param start first pixel of the walk; must be part of the mask
     * @param mode  visiting pattern
     * @return every pixel of the mask exactly once
     * @throws IllegalArgumentException if {@code start} is not in the mask
     */
    public static List<Coord> walk(Collection<Coord> mask, Coord start, WalkMode mode) {
        Set<Coord> valid = new LinkedHashSet<>(mask);
        if (!valid.contains(start)) {
            throw new IllegalArgumentException("Start " + start + " is not part of the walk mask");
        }

        Set<Coord> visited = new HashSet<>();
        List<Coord> result = new ArrayList<>(valid.size());
        Deque<Step> stack = new ArrayDeque<>();
        stack.push(new Step(start, Heading.N));

        while (!stack.isEmpty()) {
            Step step = stack.pop();
            if (!visited.add(step.coord())) continue;
            result.add(step.coord());

            Heading[] priority = priority(step.heading(), mode.clockwise());
            List<Step> candidates = new ArrayList<>(4);
            for (Heading h : priority) {
                Coord next = step.coord().offset(h.dx, h.dy);
                if (valid.contains(next) && !visited.contains(next)) {
                    candidates.add(new Step(next, h));
                }
            }
            if (mode.spiral()) {
                for (int i = candidates.size() - 1; i >= 0; i--) {
                    stack.push(candidates.get(i));
                }
            } else {
                for (Step c : candidates) {
                    stack.push(c);
                }
            }
        }

        if (result.size() < valid.size()) {
            logger.debug("Walk from {} reached {} of {} pixels, appending the rest", start, result.size(), valid.size());
            for (Coord c : valid) {
                if (!visited.contains(c)) {
                    result.add(c);
                }
            }
        }
        return result;
    }

    /**
     * The four headings starting with the one opposite {@code heading}, in the given rotation.
     */
    static Heading[] priority(Heading heading, boolean clockwise) {
        Heading[] cycle = clockwise ? CLOCKWISE : COUNTER_CLOCKWISE;
        Heading opposite = opposite(heading);
        int first = 0;
        while (cycle[first] != opposite) first++;
        Heading[] rotated = new Heading[cycle.length];
        for (int i = 0; i < cycle.length; i++) {
            rotated[i] = cycle[(first + i) % cycle.length];
        }
        return rotated;
    }

    static Heading opposite(Heading h) {
        switch (h) {
            case N: return Heading.S;
            case S: return Heading.N;
            case E: return Heading.W;
            default: return Heading.E;
        }
    }
}
