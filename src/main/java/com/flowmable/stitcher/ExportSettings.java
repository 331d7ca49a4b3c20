package com.flowmable.stitcher;

/**
 * Document-wide export options.
 *
 * @param hoopWidthInches  hoop width, written to the header in whole millimeters
 * @param hoopHeightInches hoop height, written to the header in whole millimeters
 */
public record ExportSettings(double hoopWidthInches, double hoopHeightInches) {

    static final double INCHES_TO_MM = 25.4;

    public static final ExportSettings DEFAULT = new ExportSettings(4.0, 4.0);

    public ExportSettings {
        if (!(hoopWidthInches > 0) || !(hoopHeightInches > 0)) {
            throw new IllegalArgumentException(
                    "Hoop size must be positive: " + hoopWidthInches + "x" + hoopHeightInches);
        }
    }

    public long hoopWidthMm() {
        return Math.round(hoopWidthInches * INCHES_TO_MM);
    }

    public long hoopHeightMm() {
        return Math.round(hoopHeightInches * INCHES_TO_MM);
    }
}
