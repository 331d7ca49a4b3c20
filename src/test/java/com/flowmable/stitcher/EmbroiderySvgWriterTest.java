package com.flowmable.stitcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class EmbroiderySvgWriterTest {

    private static Layer islandsLayer() {
        Partition red = new Partition(List.of(
                new Rect(0, 0),
                StitchPath.of(Coord.of(1, 0), Coord.of(2, 0)),
                new Rect(2, 0)
        ), "#ff0000", 0xFF0000);
        Partition blue = new Partition(List.of(new Rect(1, 0)), "#0000ff", 0x0000FF);
        return new Layer("layer-1", "pixels", 3, 1, List.of(red, blue));
    }

    private static String render(ExportSettings settings, Layer... layers) throws IOException {
        StringWriter out = new StringWriter();
        new EmbroiderySvgWriter(settings).write(List.of(layers), out, "test.svg");
        return out.toString();
    }

    @Test
    void headerUsesHoopSizeInWholeMillimeters() throws IOException {
        String svg = render(ExportSettings.DEFAULT, islandsLayer());
        assertTrue(svg.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?>\n<svg\n"));
        assertTrue(svg.contains("  width=\"102mm\"\n"));
        assertTrue(svg.contains("  height=\"102mm\"\n"));
        assertTrue(svg.contains("  viewBox=\"0 0 102 102\"\n"));
        assertTrue(svg.contains("<title id=\"title1023\">test.svg</title>\n"));
        assertTrue(svg.contains("  spacingx=\"2.5\"\n  spacingy=\"2.5\"\n"));
        assertTrue(svg.endsWith("</svg>\n"));
    }

    @Test
    void nonSquareHoopRoundsEachSide() throws IOException {
        String svg = render(new ExportSettings(5.0, 7.0), islandsLayer());
        assertTrue(svg.contains("  width=\"127mm\"\n"));
        assertTrue(svg.contains("  height=\"178mm\"\n"));
    }

    @Test
    void rectLineIsExact() throws IOException {
        String svg = render(ExportSettings.DEFAULT, islandsLayer());
        assertTrue(svg.contains("<rect x=\"0.0\" y=\"0.0\" width=\"2.5\" height=\"2.5\" fill=\"#ff0000\" "
                + "id=\"pixel_0_0_0_90\" style=\"display:inline;stroke:none\" "
                + "inkstitch:fill_method=\"contour_fill\" inkstitch:angle=\"90\" "
                + "inkstitch:max_stitch_length_mm=\"1000.0\" inkstitch:pull_compensation_mm=\"0.0\" "
                + "inkstitch:fill_underlay=\"True\" />\n"), svg);
        assertTrue(svg.contains("id=\"pixel_0_1_0_0\""), "odd cell takes the odd angle");
        assertFalse(svg.contains("min_jump_stitch_length_mm"));
    }

    @Test
    void connectorLineIsExact() throws IOException {
        String svg = render(ExportSettings.DEFAULT, islandsLayer());
        assertTrue(svg.contains("<path d=\"M 2.5 0.0 L 5.0 0.0\" id=\"jump_0_0_1\" "
                + "style=\"fill:none;stroke:#ff0000;stroke-width:0.1\" "
                + "inkstitch:stroke_method=\"running_stitch\" "
                + "inkstitch:running_stitch_length_mm=\"2.5\" "
                + "inkstitch:running_stitch_tolerance_mm=\"0.2\" "
                + "inkstitch:lock_start=\"half_stitch\" inkstitch:lock_end=\"half_stitch\" />\n"), svg);
    }

    @Test
    void groupsCarryTransformAndPartitionIds() throws IOException {
        Layer layer = islandsLayer().setPixelSize(1.0, 1.0).setPosition(10, 12.5).setRotation(30);
        String svg = render(ExportSettings.DEFAULT, layer);
        assertTrue(svg.contains("<!--  layer id: layer-1, name: pixels -->\n"));
        assertTrue(svg.contains("<g id=\"pixels\" transform=\"translate(10.0 12.5) rotate(30 1.5 0.5) scale(1.0 1.0)\">\n"));
        assertTrue(svg.contains("<g id=\"partition_0_ff0000\">\n"));
        assertTrue(svg.contains("<g id=\"partition_0_0000ff\">\n"));
    }

    @Test
    void minJumpStitchLengthWrittenOnlyWhenPositive() throws IOException {
        Layer layer = islandsLayer()
                .setEmbroideryParameters(EmbroideryParameters.DEFAULT.withMinJumpStitchLength(0.5));
        String svg = render(ExportSettings.DEFAULT, layer);
        assertTrue(svg.contains("inkstitch:fill_underlay=\"True\" inkstitch:min_jump_stitch_length_mm=\"0.5\" />"));
    }

    @Test
    void angleOverrideReachesIdAndAttribute() throws IOException {
        Partition p = new Partition(List.of(new Rect(0, 0, 45)), "#ff0000", 0xFF0000);
        String svg = render(ExportSettings.DEFAULT, new Layer("l", "one", 1, 1, List.of(p)));
        assertTrue(svg.contains("id=\"pixel_0_0_0_45\""));
        assertTrue(svg.contains("inkstitch:angle=\"45\""));
    }

    @Test
    void outputIsByteIdenticalAcrossRuns() throws IOException {
        assertEquals(render(ExportSettings.DEFAULT, islandsLayer(), islandsLayer()),
                render(ExportSettings.DEFAULT, islandsLayer(), islandsLayer()));
    }

    @Test
    void geometrySurvivesXmlParsing() throws Exception {
        Layer layer = islandsLayer().setPixelSize(1.5, 2.0);
        String svg = render(ExportSettings.DEFAULT, layer);

        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        Document doc = dbf.newDocumentBuilder()
                .parse(new ByteArrayInputStream(svg.getBytes(StandardCharsets.UTF_8)));
        NodeList rects = doc.getElementsByTagNameNS("http://www.w3.org/2000/svg", "rect");
        assertEquals(3, rects.getLength());

        int[][] expected = {{0, 0}, {2, 0}, {1, 0}};
        for (int i = 0; i < rects.getLength(); i++) {
            Element r = (Element) rects.item(i);
            assertEquals(expected[i][0] * 1.5, Double.parseDouble(r.getAttribute("x")), 1e-9);
            assertEquals(expected[i][1] * 2.0, Double.parseDouble(r.getAttribute("y")), 1e-9);
            assertEquals("contour_fill", r.getAttributeNS("http://inkstitch.org/namespace", "fill_method"));
        }
        NodeList paths = doc.getElementsByTagNameNS("http://www.w3.org/2000/svg", "path");
        assertEquals(1, paths.getLength());
        assertEquals("M 1.5 0.0 L 3.0 0.0", ((Element) paths.item(0)).getAttribute("d"));
    }

    @Test
    void nullShapeIsEncodingError() {
        Partition broken = new Partition(Arrays.asList(new Rect(0, 0), null), "#ff0000", 0xFF0000);
        Layer layer = new Layer("l", "broken", 1, 1, List.of(broken));
        assertThrows(StitchEncodingException.class, () -> render(ExportSettings.DEFAULT, layer));
    }

    @Test
    void emptyConnectorIsEncodingError() {
        Partition broken = new Partition(List.of(new StitchPath(List.of())), "#ff0000", 0xFF0000);
        Layer layer = new Layer("l", "broken", 1, 1, List.of(broken));
        assertThrows(StitchEncodingException.class, () -> render(ExportSettings.DEFAULT, layer));
    }

    @Test
    void noLayersRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new EmbroiderySvgWriter().write(List.of(), new StringWriter(), "x"));
    }

    @Test
    void numbersUsePlainDecimalForm() {
        assertEquals("20.0", EmbroiderySvgWriter.fmt(20));
        assertEquals("2.5", EmbroiderySvgWriter.fmt(2.5));
        assertEquals("0.0001", EmbroiderySvgWriter.fmt(0.0001));
        assertEquals("0.0", EmbroiderySvgWriter.fmt(-0.0));
        assertEquals("10000000.0", EmbroiderySvgWriter.fmt(1e7));
        assertEquals("-1.25", EmbroiderySvgWriter.fmt(-1.25));
        assertThrows(StitchEncodingException.class, () -> EmbroiderySvgWriter.fmt(Double.NaN));
    }

    @Test
    void fileWriteUsesFileNameAsTitle(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("design.svg");
        new EmbroiderySvgWriter().write(List.of(islandsLayer()), target);
        String svg = Files.readString(target);
        assertTrue(svg.contains("<title id=\"title1023\">design.svg</title>"));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(target), files.toList());
        }
    }

    @Test
    void fileWriteReplacesExistingDocument(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("design.svg");
        Files.writeString(target, "stale");
        new EmbroiderySvgWriter().write(List.of(islandsLayer()), target);
        assertTrue(Files.readString(target).startsWith("<?xml"));
    }

    @Test
    void failedWriteLeavesNoTemporaryFile(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("occupied");
        Files.createDirectory(target);
        Files.writeString(target.resolve("keep.txt"), "x");
        assertThrows(IOException.class, () -> new EmbroiderySvgWriter().write(List.of(islandsLayer()), target));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(target), files.toList());
        }
    }

    @Test
    void newFileIsReadableByOthers(@TempDir Path dir) throws IOException {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path target = dir.resolve("shared.svg");
        new EmbroiderySvgWriter().write(List.of(islandsLayer()), target);
        assertEquals(PosixFilePermissions.fromString("rw-r--r--"), Files.getPosixFilePermissions(target));
    }

    @Test
    void replacedFileKeepsItsPermissions(@TempDir Path dir) throws IOException {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path target = dir.resolve("group.svg");
        Files.writeString(target, "stale");
        Set<PosixFilePermission> groupWritable = PosixFilePermissions.fromString("rw-rw----");
        Files.setPosixFilePermissions(target, groupWritable);
        new EmbroiderySvgWriter().write(List.of(islandsLayer()), target);
        assertEquals(groupWritable, Files.getPosixFilePermissions(target));
        assertTrue(Files.readString(target).startsWith("<?xml"));
    }
}
