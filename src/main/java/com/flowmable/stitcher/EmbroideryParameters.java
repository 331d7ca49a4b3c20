package com.flowmable.stitcher;

/**
 * Machine parameters written onto every cell and connector of a layer.
 *
 * @param pullCompensationMm       extra width added to fills to offset fabric pull
 * @param maxStitchLengthMm        longest single fill stitch
 * @param fillMethod               Ink/Stitch fill method name
 * @param oddPixelAngleDegrees     fill angle for cells with odd {@code x + y}
 * @param evenPixelAngleDegrees    fill angle for cells with even {@code x + y}
 * @param minJumpStitchLengthMm    written only when positive
 * @param fillUnderlay             whether fills get an underlay pass
 * @param runningStitchLengthMm    connector stitch length
 * @param runningStitchToleranceMm connector tolerance
 * @param lockStart                connector lock stitch at the start
 * @param lockEnd                  connector lock stitch at the end
 */
public record EmbroideryParameters(
        double pullCompensationMm,
        double maxStitchLengthMm,
        String fillMethod,
        int oddPixelAngleDegrees,
        int evenPixelAngleDegrees,
        double minJumpStitchLengthMm,
        boolean fillUnderlay,
        double runningStitchLengthMm,
        double runningStitchToleranceMm,
        String lockStart,
        String lockEnd
) {

    public static final EmbroideryParameters DEFAULT = new EmbroideryParameters(
            0.0,
            1000.0,
            "contour_fill",
            0,
            90,
            0.0,
            true,
            2.5,
            0.2,
            "half_stitch",
            "half_stitch"
    );

    public EmbroideryParameters {
        if (fillMethod == null || fillMethod.isBlank()) {
            throw new IllegalArgumentException("fillMethod must not be blank");
        }
        if (lockStart == null || lockEnd == null) {
            throw new IllegalArgumentException("lockStart and lockEnd must not be null");
        }
        if (maxStitchLengthMm <= 0 || runningStitchLengthMm <= 0) {
            throw new IllegalArgumentException("Stitch lengths must be > 0");
        }
    }

    public EmbroideryParameters withFill(String method, double maxStitchLength) {
        return new EmbroideryParameters(pullCompensationMm, maxStitchLength, method, oddPixelAngleDegrees,
                evenPixelAngleDegrees, minJumpStitchLengthMm, fillUnderlay, runningStitchLengthMm,
                runningStitchToleranceMm, lockStart, lockEnd);
    }

    public EmbroideryParameters withAngles(int odd, int even) {
        return new EmbroideryParameters(pullCompensationMm, maxStitchLengthMm, fillMethod, odd, even,
                minJumpStitchLengthMm, fillUnderlay, runningStitchLengthMm, runningStitchToleranceMm,
                lockStart, lockEnd);
    }

    public EmbroideryParameters withMinJumpStitchLength(double mm) {
        return new EmbroideryParameters(pullCompensationMm, maxStitchLengthMm, fillMethod, oddPixelAngleDegrees,
                evenPixelAngleDegrees, mm, fillUnderlay, runningStitchLengthMm, runningStitchToleranceMm,
                lockStart, lockEnd);
    }
}
