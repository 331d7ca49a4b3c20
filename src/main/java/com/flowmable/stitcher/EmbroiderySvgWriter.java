package com.flowmable.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;

/**
 * Writes layers as an SVG document annotated with Ink/Stitch attributes.
 * <p>
 * Output depends only on the layers and settings: attribute order and number formatting are
 * fixed, so identical input gives byte-identical documents.
 */
public final class EmbroiderySvgWriter {

    private static final Logger logger = LoggerFactory.getLogger(EmbroiderySvgWriter.class);

    private static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS =
            PosixFilePermissions.fromString("rw-r--r--");

    private final ExportSettings settings;

    public EmbroiderySvgWriter() {
        this(ExportSettings.DEFAULT);
    }

    public EmbroiderySvgWriter(ExportSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Export settings must not be null");
        }
        this.settings = settings;
    }

    /**
     * Writes to a temporary sibling of {@code target} and moves it into place once complete.
     * The document title is the target's file name.
     */
    public void write(List<Layer> layers, Path target) throws IOException {
        requireLayers(layers);
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        logger.info("Writing {} layer(s) to {}", layers.size(), absolute);

        Path tmp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
        try {
            try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                write(layers, out, absolute.getFileName().toString());
            }
            applyPermissions(tmp, absolute);
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, replacing {}", dir, absolute);
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    public void write(List<Layer> layers, Writer out, String title) throws IOException {
        requireLayers(layers);
        writeHeader(out, title, layers.get(0));

        for (int layerIdx = 0; layerIdx < layers.size(); layerIdx++) {
            Layer layer = layers.get(layerIdx);
            writeLayerOpen(out, layer);
            List<Partition> partitions = layer.partitions();
            for (int partIdx = 0; partIdx < partitions.size(); partIdx++) {
                Partition partition = partitions.get(partIdx);
                String partId = "partition_" + layerIdx + "_" + partition.name().replace("#", "");
                out.write("<g id=\"" + escape(partId) + "\">\n");
                List<Shape> shapes = partition.shapes();
                for (int shapeIdx = 0; shapeIdx < shapes.size(); shapeIdx++) {
                    writeShape(out, layer, layerIdx, partIdx, shapeIdx, partition, shapes.get(shapeIdx));
                }
                out.write("</g>\n");
            }
            out.write("</g>\n");
        }
        out.write("</svg>\n");
        out.flush();
    }

    /**
     * Temp files are created owner-only; give the replacement the target's current
     * permissions, or {@code rw-r--r--} for a new file. No-op off POSIX file systems.
     */
    private static void applyPermissions(Path tmp, Path target) throws IOException {
        if (!tmp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : NEW_FILE_PERMISSIONS;
        Files.setPosixFilePermissions(tmp, permissions);
    }

    private static void requireLayers(List<Layer> layers) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("At least one layer is required");
        }
    }

    private void writeHeader(Writer out, String title, Layer first) throws IOException {
        long w = settings.hoopWidthMm();
        long h = settings.hoopHeightMm();
        out.write("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?>\n");
        out.write("<svg\n"
                + "  width=\"" + w + "mm\"\n"
                + "  height=\"" + h + "mm\"\n"
                + "  viewBox=\"0 0 " + w + " " + h + "\"\n"
                + "  version=\"1.1\"\n"
                + "  id=\"svg8\"\n"
                + "  xmlns=\"http://www.w3.org/2000/svg\"\n"
                + "  xmlns:svg=\"http://www.w3.org/2000/svg\"\n"
                + "  xmlns:inkstitch=\"http://inkstitch.org/namespace\"\n"
                + "  xmlns:inkscape=\"http://www.inkscape.org/namespaces/inkscape\"\n"
                + "  xmlns:sodipodi=\"http://sodipodi.sourceforge.net/DTD/sodipodi-0.dtd\"\n"
                + ">\n");
        out.write("<title id=\"title1023\">" + escape(title == null ? "" : title) + "</title>\n");
        out.write("<sodipodi:namedview\n"
                + "  inkscape:document-units=\"mm\"\n"
                + "  inkscape:pagecheckerboard=\"true\"\n"
                + "  showgrid=\"true\"\n"
                + ">\n");
        out.write("<inkscape:grid\n"
                + "  id=\"grid1\"\n"
                + "  units=\"mm\"\n"
                + "  originx=\"0\"\n"
                + "  originy=\"0\"\n"
                + "  spacingx=\"" + fmt(first.pixelWidthMm()) + "\"\n"
                + "  spacingy=\"" + fmt(first.pixelHeightMm()) + "\"\n"
                + "  enabled=\"true\"\n"
                + "  visible=\"true\"\n"
                + "/>\n");
        out.write("</sodipodi:namedview>\n");
        out.write("<defs\n  id=\"defs1\"\n/>\n");
    }

    private void writeLayerOpen(Writer out, Layer layer) throws IOException {
        EmbroideryParameters p = layer.embroideryParameters();
        out.write("<!--  layer id: " + comment(layer.id()) + ", name: " + comment(layer.name()) + " -->\n");
        out.write("<!-- layer embroidery params\n"
                + "  pull_compensation_mm=" + fmt(p.pullCompensationMm())
                + ", max_stitch_length_mm=" + fmt(p.maxStitchLengthMm())
                + ", fill_method=" + comment(p.fillMethod())
                + ", odd_pixel_angle_degrees=" + p.oddPixelAngleDegrees()
                + ", even_pixel_angle_degrees=" + p.evenPixelAngleDegrees()
                + ", min_jump_stitch_length_mm=" + fmt(p.minJumpStitchLengthMm())
                + ", fill_underlay=" + bool(p.fillUnderlay())
                + "\n-->\n");
        out.write("<g id=\"" + escape(layer.name()) + "\" transform=\""
                + "translate(" + fmt(layer.positionXMm()) + " " + fmt(layer.positionYMm()) + ") "
                + "rotate(" + layer.rotationDegrees() + " " + fmt(layer.centerXMm()) + " " + fmt(layer.centerYMm()) + ") "
                + "scale(" + fmt(layer.scaleX()) + " " + fmt(layer.scaleY()) + ")"
                + "\">\n");
    }

    private void writeShape(Writer out, Layer layer, int layerIdx, int partIdx, int shapeIdx,
                            Partition partition, Shape shape) throws IOException {
        if (shape instanceof Rect rect) {
            writeRect(out, layer, layerIdx, partition.hexColor(), rect);
        } else if (shape instanceof StitchPath path) {
            writePath(out, layer, "jump_" + layerIdx + "_" + partIdx + "_" + shapeIdx, partition.hexColor(), path);
        } else {
            throw new StitchEncodingException("Cannot encode shape " + shapeIdx + " of partition "
                    + partition.name() + ": " + shape);
        }
    }

    private void writeRect(Writer out, Layer layer, int layerIdx, String color, Rect rect) throws IOException {
        EmbroideryParameters p = layer.embroideryParameters();
        double pw = layer.pixelWidthMm();
        double ph = layer.pixelHeightMm();
        int angle = rect.angle(p);
        StringBuilder sb = new StringBuilder(384);
        sb.append("<rect x=\"").append(fmt(rect.x() * pw)).append("\" y=\"").append(fmt(rect.y() * ph)).append("\" ")
                .append("width=\"").append(fmt(pw)).append("\" height=\"").append(fmt(ph)).append("\" ")
                .append("fill=\"").append(color).append("\" ")
                .append("id=\"pixel_").append(layerIdx).append('_').append(rect.x()).append('_').append(rect.y())
                .append('_').append(angle).append("\" ")
                .append("style=\"display:inline;stroke:none\" ")
                .append("inkstitch:fill_method=\"").append(escape(p.fillMethod())).append("\" ")
                .append("inkstitch:angle=\"").append(angle).append("\" ")
                .append("inkstitch:max_stitch_length_mm=\"").append(fmt(p.maxStitchLengthMm())).append("\" ")
                .append("inkstitch:pull_compensation_mm=\"").append(fmt(p.pullCompensationMm())).append("\" ")
                .append("inkstitch:fill_underlay=\"").append(bool(p.fillUnderlay())).append("\" ");
        if (p.minJumpStitchLengthMm() > 0.0) {
            sb.append("inkstitch:min_jump_stitch_length_mm=\"").append(fmt(p.minJumpStitchLengthMm())).append("\" ");
        }
        sb.append("/>\n");
        out.write(sb.toString());
    }

    private void writePath(Writer out, Layer layer, String id, String color, StitchPath path) throws IOException {
        List<Coord> points = path.points();
        if (points.isEmpty()) {
            throw new StitchEncodingException("Connector " + id + " has no points");
        }
        EmbroideryParameters p = layer.embroideryParameters();
        double pw = layer.pixelWidthMm();
        double ph = layer.pixelHeightMm();
        StringBuilder d = new StringBuilder();
        for (int i = 0; i < points.size(); i++) {
            Coord c = points.get(i);
            d.append(i == 0 ? "M " : " L ").append(fmt(c.x() * pw)).append(' ').append(fmt(c.y() * ph));
        }
        out.write("<path d=\"" + d + "\" "
                + "id=\"" + id + "\" "
                + "style=\"fill:none;stroke:" + color + ";stroke-width:0.1\" "
                + "inkstitch:stroke_method=\"running_stitch\" "
                + "inkstitch:running_stitch_length_mm=\"" + fmt(p.runningStitchLengthMm()) + "\" "
                + "inkstitch:running_stitch_tolerance_mm=\"" + fmt(p.runningStitchToleranceMm()) + "\" "
                + "inkstitch:lock_start=\"" + escape(p.lockStart()) + "\" "
                + "inkstitch:lock_end=\"" + escape(p.lockEnd()) + "\" "
                + "/>\n");
    }

    /**
     * Plain decimal with at least one fractional digit: {@code 20.0}, {@code 2.5}, {@code 0.0001}.
     */
    static String fmt(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new StitchEncodingException("Cannot encode non-finite number " + v);
        }
        String s = new BigDecimal(Double.toString(v)).stripTrailingZeros().toPlainString();
        return s.indexOf('.') < 0 ? s + ".0" : s;
    }

    static String bool(boolean b) {
        return b ? "True" : "False";
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '"': sb.append("&quot;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    // "--" may not appear inside an XML comment
    private static String comment(String s) {
        String out = s;
        while (out.contains("--")) {
            out = out.replace("--", "- -");
        }
        return out;
    }
}
