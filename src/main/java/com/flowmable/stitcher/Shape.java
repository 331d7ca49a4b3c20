package com.flowmable.stitcher;

/**
 * One element of a partition's stitch sequence: either a unit fill cell ({@link Rect})
 * or a connector polyline ({@link StitchPath}).
 */
public sealed interface Shape permits Rect, StitchPath {
}
