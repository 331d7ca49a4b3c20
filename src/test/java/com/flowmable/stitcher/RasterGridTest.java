package com.flowmable.stitcher;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static com.flowmable.stitcher.TestImages.*;
import static org.junit.jupiter.api.Assertions.*;

class RasterGridTest {

    @Test
    void opaquePixelsKeepTheirColor() {
        RasterGrid grid = RasterGrid.from(fromRows(new int[][]{{RED, CLEAR}, {BLUE, GREEN}}));
        assertEquals(2, grid.width());
        assertEquals(2, grid.height());
        assertEquals(RED, grid.colorAt(0, 0));
        assertEquals(BLUE, grid.colorAt(0, 1));
        assertEquals(GREEN, grid.colorAt(1, 1));
    }

    @Test
    void partiallyTransparentPixelsAreEmpty() {
        BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0xFEFF0000);
        img.setRGB(1, 0, 0xFFFF0000);
        RasterGrid grid = RasterGrid.from(img);
        assertEquals(RasterGrid.EMPTY, grid.colorAt(0, 0));
        assertFalse(grid.isSolid(0, 0));
        assertTrue(grid.isSolid(1, 0));
    }

    @Test
    void outOfBoundsIsEmpty() {
        RasterGrid grid = RasterGrid.of(new int[][]{{RED}});
        assertEquals(RasterGrid.EMPTY, grid.colorAt(-1, 0));
        assertEquals(RasterGrid.EMPTY, grid.colorAt(0, 1));
        assertFalse(grid.inBounds(1, 0));
    }

    @Test
    void nullImageRejected() {
        assertThrows(IllegalArgumentException.class, () -> RasterGrid.from(null));
    }

    @Test
    void raggedRowsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RasterGrid.of(new int[][]{{RED, RED}, {RED}}));
    }
}
