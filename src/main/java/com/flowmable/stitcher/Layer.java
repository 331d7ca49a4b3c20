package com.flowmable.stitcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One placed image in an export: its partitions plus physical placement and machine parameters.
 * <p>
 * Placement values are in millimeters and degrees. Partitions keep their order; the encoder
 * writes them as nested groups in this order.
 */
public final class Layer {

    private final String id;
    private final int rasterWidth;
    private final int rasterHeight;
    private final List<Partition> partitions;

    private String name;
    private double pixelWidthMm = 2.5;
    private double pixelHeightMm = 2.5;
    private double positionXMm;
    private double positionYMm;
    private int rotationDegrees;
    private double scaleX = 1.0;
    private double scaleY = 1.0;
    private EmbroideryParameters embroideryParameters = EmbroideryParameters.DEFAULT;

    public Layer(String id, String name, int rasterWidth, int rasterHeight, List<Partition> partitions) {
        if (id == null || name == null) {
            throw new IllegalArgumentException("Layer id and name must not be null");
        }
        if (rasterWidth <= 0 || rasterHeight <= 0) {
            throw new IllegalArgumentException("Layer raster has zero area: " + rasterWidth + "x" + rasterHeight);
        }
        this.id = id;
        this.name = name;
        this.rasterWidth = rasterWidth;
        this.rasterHeight = rasterHeight;
        this.partitions = new ArrayList<>(partitions);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Layer setName(String name) {
        this.name = name;
        return this;
    }

    public int rasterWidth() {
        return rasterWidth;
    }

    public int rasterHeight() {
        return rasterHeight;
    }

    public List<Partition> partitions() {
        return Collections.unmodifiableList(partitions);
    }

    public double pixelWidthMm() {
        return pixelWidthMm;
    }

    public double pixelHeightMm() {
        return pixelHeightMm;
    }

    public Layer setPixelSize(double widthMm, double heightMm) {
        if (!(widthMm > 0) || !(heightMm > 0)) {
            throw new IllegalArgumentException("Pixel size must be positive: " + widthMm + "x" + heightMm);
        }
        this.pixelWidthMm = widthMm;
        this.pixelHeightMm = heightMm;
        return this;
    }

    public double positionXMm() {
        return positionXMm;
    }

    public double positionYMm() {
        return positionYMm;
    }

    public Layer setPosition(double xMm, double yMm) {
        this.positionXMm = xMm;
        this.positionYMm = yMm;
        return this;
    }

    public int rotationDegrees() {
        return rotationDegrees;
    }

    public Layer setRotation(int degrees) {
        this.rotationDegrees = degrees;
        return this;
    }

    public double scaleX() {
        return scaleX;
    }

    public double scaleY() {
        return scaleY;
    }

    public Layer setScale(double sx, double sy) {
        this.scaleX = sx;
        this.scaleY = sy;
        return this;
    }

    public EmbroideryParameters embroideryParameters() {
        return embroideryParameters;
    }

    public Layer setEmbroideryParameters(EmbroideryParameters params) {
        if (params == null) {
            throw new IllegalArgumentException("Embroidery parameters must not be null");
        }
        this.embroideryParameters = params;
        return this;
    }

    /** Rotation anchor: the center of the unrotated layer, in millimeters. */
    public double centerXMm() {
        return rasterWidth * pixelWidthMm / 2;
    }

    public double centerYMm() {
        return rasterHeight * pixelHeightMm / 2;
    }

    public int jumpStitchCount() {
        int n = 0;
        for (Partition p : partitions) {
            n += p.jumpStitchCount();
        }
        return n;
    }

    @Override
    public String toString() {
        return "Layer[" + name + ", " + rasterWidth + "x" + rasterHeight + ", partitions=" + partitions.size() + "]";
    }
}
