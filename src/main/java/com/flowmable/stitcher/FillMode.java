package com.flowmable.stitcher;

/**
 * User-facing fill choices and the machine fill method each one maps to.
 */
public enum FillMode {
    AUTO_FILL("auto_fill", 3.0),
    SATIN_LIKE("contour_fill", 1000.0),
    LEGACY("legacy_fill", 3.0);

    private final String fillMethod;
    private final double maxStitchLengthMm;

    FillMode(String fillMethod, double maxStitchLengthMm) {
        this.fillMethod = fillMethod;
        this.maxStitchLengthMm = maxStitchLengthMm;
    }

    public String fillMethod() {
        return fillMethod;
    }

    public double maxStitchLengthMm() {
        return maxStitchLengthMm;
    }

    /** Copy of {@code params} with this mode's fill method and max stitch length. */
    public EmbroideryParameters apply(EmbroideryParameters params) {
        return params.withFill(fillMethod, maxStitchLengthMm);
    }
}
