package com.flowmable.stitcher;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * JSON configuration for planning and export.
 * <p>
 * Every field carries its default, so a document only needs the keys it changes. Unknown
 * keys are ignored.
 */
public class StitchConfig {

    public PlannerSection planner = new PlannerSection();
    public ExportSection export = new ExportSection();
    public LayerSection layer = new LayerSection();
    public EmbroiderySection embroidery = new EmbroiderySection();

    public static class PlannerSection {
        public String grouping = "PER_COLOR";
        public int sawThreshold = 40;
        public long sawStepLimit = 2_000_000L;
        public String tieBreak = "DIRECTION_ORDER";
        public boolean weightedBridges = false;
        public String routeSurface = "ANY_OPAQUE";
        public int directionRotation = 0;
        // "truncated" or "rounded"
        public String edgeWeighting = "truncated";
    }

    public static class ExportSection {
        public double hoopWidthInches = 4.0;
        public double hoopHeightInches = 4.0;
    }

    public static class LayerSection {
        public String name = "layer";
        public double pixelWidthMm = 2.5;
        public double pixelHeightMm = 2.5;
        public double positionXMm = 0.0;
        public double positionYMm = 0.0;
        public int rotationDegrees = 0;
        public double scaleX = 1.0;
        public double scaleY = 1.0;
    }

    public static class EmbroiderySection {
        // Optional; when set it overrides fillMethod and maxStitchLengthMm
        public String fillMode;
        public double pullCompensationMm = 0.0;
        public double maxStitchLengthMm = 1000.0;
        public String fillMethod = "contour_fill";
        public int oddPixelAngleDegrees = 0;
        public int evenPixelAngleDegrees = 90;
        public double minJumpStitchLengthMm = 0.0;
        public boolean fillUnderlay = true;
        public double runningStitchLengthMm = 2.5;
        public double runningStitchToleranceMm = 0.2;
        public String lockStart = "half_stitch";
        public String lockEnd = "half_stitch";
    }

    public static StitchConfig load(InputStream json) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        StitchConfig config = mapper.readValue(json, StitchConfig.class);
        if (config.planner == null) config.planner = new PlannerSection();
        if (config.export == null) config.export = new ExportSection();
        if (config.layer == null) config.layer = new LayerSection();
        if (config.embroidery == null) config.embroidery = new EmbroiderySection();
        return config;
    }

    public static StitchConfig load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public PlannerSettings toPlannerSettings() {
        return new PlannerSettings(
                parse(PlannerSettings.Grouping.class, planner.grouping, "planner.grouping"),
                planner.sawThreshold,
                planner.sawStepLimit,
                parse(PlannerSettings.NeighborTieBreak.class, planner.tieBreak, "planner.tieBreak"),
                planner.weightedBridges,
                parse(PlannerSettings.RouteSurface.class, planner.routeSurface, "planner.routeSurface"),
                planner.directionRotation,
                edgeWeighting(planner.edgeWeighting));
    }

    public ExportSettings toExportSettings() {
        return new ExportSettings(export.hoopWidthInches, export.hoopHeightInches);
    }

    public EmbroideryParameters toEmbroideryParameters() {
        EmbroideryParameters params = new EmbroideryParameters(
                embroidery.pullCompensationMm,
                embroidery.maxStitchLengthMm,
                embroidery.fillMethod,
                embroidery.oddPixelAngleDegrees,
                embroidery.evenPixelAngleDegrees,
                embroidery.minJumpStitchLengthMm,
                embroidery.fillUnderlay,
                embroidery.runningStitchLengthMm,
                embroidery.runningStitchToleranceMm,
                embroidery.lockStart,
                embroidery.lockEnd);
        if (embroidery.fillMode != null) {
            params = parse(FillMode.class, embroidery.fillMode, "embroidery.fillMode").apply(params);
        }
        return params;
    }

    /** Copies placement and embroidery parameters onto {@code target}. The name is left alone. */
    public Layer applyTo(Layer target) {
        return target.setPixelSize(layer.pixelWidthMm, layer.pixelHeightMm)
                .setPosition(layer.positionXMm, layer.positionYMm)
                .setRotation(layer.rotationDegrees)
                .setScale(layer.scaleX, layer.scaleY)
                .setEmbroideryParameters(toEmbroideryParameters());
    }

    private static EdgeWeighting edgeWeighting(String name) {
        switch (name == null ? "" : name.toLowerCase(Locale.ROOT)) {
            case "truncated": return EdgeWeighting.TRUNCATED_SQUARE;
            case "rounded": return EdgeWeighting.ROUNDED_SQUARE;
            default: throw new IllegalArgumentException("Unknown planner.edgeWeighting: " + name);
        }
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, String key) {
        if (value == null) {
            throw new IllegalArgumentException("Missing " + key);
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + key + ": " + value, e);
        }
    }
}
