package com.flowmable.stitcher;

import java.util.List;
import java.util.Optional;

/**
 * Result of planning one image: every opaque pixel sits in exactly one partition.
 *
 * @param width      raster width in pixels
 * @param height     raster height in pixels
 * @param partitions colors in order of first appearance in a column-major scan
 */
public record StitchPlan(int width, int height, List<Partition> partitions) {

    public StitchPlan {
        partitions = List.copyOf(partitions);
    }

    public int pixelCount() {
        int n = 0;
        for (Partition p : partitions) {
            n += p.pixelCount();
        }
        return n;
    }

    public int jumpStitchCount() {
        int n = 0;
        for (Partition p : partitions) {
            n += p.jumpStitchCount();
        }
        return n;
    }

    public Optional<Partition> partition(String name) {
        return partitions.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
