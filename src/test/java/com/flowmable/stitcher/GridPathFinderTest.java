package com.flowmable.stitcher;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.flowmable.stitcher.TestImages.*;
import static org.junit.jupiter.api.Assertions.*;

class GridPathFinderTest {

    private static GridPathFinder finder(int[][] rows) {
        return new GridPathFinder(RasterGrid.of(rows));
    }

    private static List<Coord> pts(int... xy) {
        Coord[] c = new Coord[xy.length / 2];
        for (int i = 0; i < c.length; i++) c[i] = Coord.of(xy[2 * i], xy[2 * i + 1]);
        return List.of(c);
    }

    @Test
    void straightStripRoutesThroughFourCornersAndSimplifiesToTwo() {
        GridPathFinder f = finder(new int[][]{{RED, RED, RED, RED}});
        List<Coord> route = f.findPath(RED, Coord.of(0, 0), Coord.of(3, 0), false).orElseThrow();
        assertEquals(pts(0, 0, 1, 0, 2, 0, 3, 0), route);
        assertEquals(pts(0, 0, 3, 0), GridPathFinder.simplify(route));
    }

    @Test
    void lShapeKeepsCorner() {
        assertEquals(pts(0, 0, 1, 0, 1, 1), GridPathFinder.simplify(pts(0, 0, 1, 0, 1, 1)));
        assertEquals(pts(0, 0, 2, 0, 2, 3),
                GridPathFinder.simplify(pts(0, 0, 1, 0, 2, 0, 2, 1, 2, 2, 2, 3)));
    }

    @Test
    void simplifyIsIdempotent() {
        List<Coord> route = pts(0, 0, 1, 0, 1, 1, 1, 2, 2, 2, 3, 2, 3, 3);
        List<Coord> once = GridPathFinder.simplify(route);
        assertEquals(pts(0, 0, 1, 0, 1, 2, 3, 2, 3, 3), once);
        assertEquals(once, GridPathFinder.simplify(once));
    }

    @Test
    void simplifyKeepsShortPaths() {
        assertEquals(pts(4, 4), GridPathFinder.simplify(pts(4, 4)));
        assertEquals(List.of(), GridPathFinder.simplify(List.of()));
    }

    @Test
    void cornerOutsideGraphHasNoRoute() {
        GridPathFinder f = finder(new int[][]{
                {RED, CLEAR, CLEAR},
                {CLEAR, CLEAR, CLEAR},
                {CLEAR, CLEAR, CLEAR}
        });
        assertEquals(Optional.empty(), f.findPath(RED, Coord.of(0, 0), Coord.of(3, 3), false));
    }

    @Test
    void transparentGapDisconnects() {
        GridPathFinder f = finder(new int[][]{{RED, CLEAR, CLEAR, RED}});
        assertTrue(f.findPath(RED, Coord.of(0, 0), Coord.of(3, 0), false).isEmpty());
        assertTrue(f.findPath(RED, Coord.of(0, 0), Coord.of(3, 0), true).isEmpty());
    }

    @Test
    void weightedRouteAvoidsDissimilarPixel() {
        int[][] rows = {
                {RED, GREEN, RED},
                {RED, RED, RED}
        };
        GridPathFinder f = finder(rows);
        List<Coord> plain = f.findPath(RED, Coord.of(0, 0), Coord.of(3, 0), false).orElseThrow();
        assertEquals(pts(0, 0, 1, 0, 2, 0, 3, 0), plain);

        List<Coord> weighted = f.findPath(RED, Coord.of(0, 0), Coord.of(3, 0), true).orElseThrow();
        assertEquals(6, weighted.size());
        assertEquals(Coord.of(0, 0), weighted.get(0));
        assertEquals(Coord.of(3, 0), weighted.get(5));
        for (int i = 1; i < weighted.size(); i++) {
            boolean topOfGreen = weighted.get(i - 1).y() == 0 && weighted.get(i).y() == 0
                    && Math.min(weighted.get(i - 1).x(), weighted.get(i).x()) == 1;
            assertFalse(topOfGreen, "weighted route should not run along the green pixel: " + weighted);
        }
    }

    @Test
    void weightedRouteIsRepeatable() {
        GridPathFinder f = new GridPathFinder(RasterGrid.from(noisy(12, 12, 3L)));
        Optional<List<Coord>> first = f.findPath(BLUE, Coord.of(0, 0), Coord.of(12, 12), true);
        Optional<List<Coord>> second = new GridPathFinder(RasterGrid.from(noisy(12, 12, 3L)))
                .findPath(BLUE, Coord.of(0, 0), Coord.of(12, 12), true);
        assertEquals(first, second);
    }

    @Test
    void sameColorSurfaceIgnoresOtherColors() {
        int[][] rows = {{RED, BLUE, RED}};
        GridPathFinder any = new GridPathFinder(RasterGrid.of(rows));
        GridPathFinder same = new GridPathFinder(RasterGrid.of(rows),
                PlannerSettings.RouteSurface.SAME_COLOR, EdgeWeighting.TRUNCATED_SQUARE);
        assertTrue(any.findPath(RED, Coord.of(0, 0), Coord.of(3, 0), false).isPresent());
        assertTrue(same.findPath(RED, Coord.of(0, 0), Coord.of(3, 0), false).isEmpty());
    }

    @Test
    void graphsAreCachedPerColorAndWeighting() {
        GridPathFinder f = finder(new int[][]{{RED, BLUE}});
        f.findPath(RED, Coord.of(0, 0), Coord.of(2, 0), false);
        f.findPath(RED, Coord.of(0, 1), Coord.of(2, 1), false);
        assertEquals(1, f.cachedGraphCount());
        f.findPath(RED, Coord.of(0, 0), Coord.of(2, 0), true);
        f.findPath(BLUE, Coord.of(0, 0), Coord.of(2, 0), false);
        assertEquals(3, f.cachedGraphCount());
        assertSame(f.graph(RED, true), f.graph(RED, true));
    }

    @Test
    void trimDropsCornersOfStartAndEndPixels() {
        assertEquals(pts(1, 0, 2, 0), GridPathFinder.trimToPixelBounds(pts(0, 0, 1, 0, 2, 0)));
        assertEquals(pts(1, 0, 2, 0, 3, 0), GridPathFinder.trimToPixelBounds(pts(0, 0, 1, 0, 2, 0, 3, 0)));
    }

    @Test
    void trimLeavesDegeneratePathsAlone() {
        List<Coord> adjacent = pts(0, 0, 1, 0);
        assertEquals(adjacent, GridPathFinder.trimToPixelBounds(adjacent));
        assertEquals(pts(2, 2), GridPathFinder.trimToPixelBounds(pts(2, 2, 2, 2)));
        assertEquals(pts(5, 5), GridPathFinder.trimToPixelBounds(pts(5, 5)));
    }

    @Test
    void connectorBetweenIslandsIsTrimmedAndSimplified() {
        GridPathFinder f = new GridPathFinder(RasterGrid.from(redIslands()));
        assertEquals(Optional.of(pts(1, 0, 2, 0)), f.findConnector(RED, Coord.of(0, 0), Coord.of(2, 0), false));
    }
}
