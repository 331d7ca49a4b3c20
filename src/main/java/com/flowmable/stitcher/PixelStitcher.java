package com.flowmable.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Top-level entry point: image in, stitch plan out, plan to embroidery document.
 * <p>
 * All settings are passed in at construction; nothing is read from global state.
 */
public class PixelStitcher {

    private static final Logger logger = LoggerFactory.getLogger(PixelStitcher.class);

    private final PlannerSettings settings;
    private final EmbroiderySvgWriter writer;

    public PixelStitcher() {
        this(PlannerSettings.DEFAULT, ExportSettings.DEFAULT);
    }

    public PixelStitcher(PlannerSettings settings, ExportSettings exportSettings) {
        if (settings == null) {
            throw new IllegalArgumentException("Planner settings must not be null");
        }
        this.settings = settings;
        this.writer = new EmbroiderySvgWriter(exportSettings);
    }

    public static PixelStitcher fromConfig(StitchConfig config) {
        return new PixelStitcher(config.toPlannerSettings(), config.toExportSettings());
    }

    public PlannerSettings settings() {
        return settings;
    }

    public StitchPlan plan(Path imageFile) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        return plan(image);
    }

    public StitchPlan plan(BufferedImage image) {
        RasterGrid grid = RasterGrid.from(image);
        Map<Integer, AdjacencyGraph> graphs = new ColorGraphBuilder(settings.directionRotation()).build(grid);
        logger.info("Planning {}x{} image with {} color(s)", grid.width(), grid.height(), graphs.size());

        PartitionOrderer orderer = new PartitionOrderer(grid, settings);
        List<Partition> partitions = new ArrayList<>();
        for (AdjacencyGraph graph : graphs.values()) {
            partitions.addAll(orderer.order(graph));
        }

        StitchPlan plan = new StitchPlan(grid.width(), grid.height(), partitions);
        logger.debug("Plan: {} partition(s), {} pixel(s), {} jump stitch(es)",
                partitions.size(), plan.pixelCount(), plan.jumpStitchCount());
        return plan;
    }

    /**
     * Wraps a plan in a layer with default placement. The layer id is derived from its name so
     * repeated exports stay identical.
     */
    public Layer toLayer(StitchPlan plan, String name) {
        if (name == null) {
            throw new IllegalArgumentException("Layer name must not be null");
        }
        String id = UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
        List<Partition> owned = new ArrayList<>(plan.partitions().size());
        for (Partition p : plan.partitions()) {
            owned.add(p.copy());
        }
        return new Layer(id, name, plan.width(), plan.height(), owned);
    }

    public Layer toLayer(StitchPlan plan, StitchConfig config) {
        return config.applyTo(toLayer(plan, config.layer.name));
    }

    public void export(List<Layer> layers, Path target) throws IOException {
        writer.write(layers, target);
    }

    public void export(List<Layer> layers, Writer out, String title) throws IOException {
        writer.write(layers, out, title);
    }
}
