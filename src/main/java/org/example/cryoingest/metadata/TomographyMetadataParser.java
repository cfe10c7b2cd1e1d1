package org.example.cryoingest.metadata;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.geometry.Matrix2;
import org.example.cryoingest.model.BatchPositionInfo;
import org.example.cryoingest.model.SearchMapInfo;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsers for the files Tomo writes next to its search maps and batch positions.
 * Each method reads one file and contributes what that file knows.
 */
@Slf4j
public final class TomographyMetadataParser {

    /** Long side of a search map when its size has to be inferred from the readout area. */
    static final int FALLBACK_MAP_SIZE = 8005;

    private TomographyMetadataParser() {
    }

    /**
     * Reads stage position, pixel size, binning and the three matrices from
     * {@code SearchMap.xml} into {@code target}.
     */
    public static void readSearchMapXml(Path file, SearchMapInfo target) throws MetadataParseException {
        XmlDocument doc = XmlDocument.parse(file);
        target.setPixelSize(doc.text("MicroscopeImage", "SpatialScale", "pixelSize", "x", "numericValue")
                .map(Double::parseDouble).orElse(null));
        doc.find("MicroscopeImage", "microscopeData", "stage", "Position").ifPresent(pos -> {
            target.setXStagePosition(XmlDocument.childText(pos, "X").map(Double::parseDouble).orElse(null));
            target.setYStagePosition(XmlDocument.childText(pos, "Y").map(Double::parseDouble).orElse(null));
        });
        target.setBinning(doc.text("MicroscopeImage", "microscopeData", "acquisition", "camera", "Binning", "x")
                .map(Double::parseDouble).orElse(null));

        doc.find("MicroscopeImage", "CustomData").ifPresent(custom -> {
            for (Element kv : XmlDocument.childrenStartingWith(custom, "KeyValueOfstringanyType")) {
                String key = XmlDocument.childText(kv, "Key").orElse("");
                Optional<Element> value = XmlDocument.child(kv, "Value");
                if (value.isEmpty()) continue;
                if (key.equals("ReferenceCorrectionForStage")) {
                    target.setStageCorrection(matrix(value.get()));
                } else if (key.equals("ReferenceCorrectionForImageShift")) {
                    target.setImageShiftCorrection(matrix(value.get()));
                }
            }
        });
        if (target.getStageCorrection() == null || target.getImageShiftCorrection() == null) {
            log.error("No stage or image shift matrix found for {}", file);
        }
        doc.find("MicroscopeImage", "ReferenceTransformation", "matrix")
                .ifPresent(m -> target.setReference(matrix(m)));
    }

    /**
     * Reads the map size from {@code SearchMap.dm}. When the size is missing, it is
     * derived from the camera readout area scaled to the usual stitched map size.
     */
    public static void readSearchMapDm(Path file, SearchMapInfo target) throws MetadataParseException {
        XmlDocument doc = XmlDocument.parse(file);
        Optional<Element> size = doc.find("TileSetXml", "ImageSize");
        Optional<String> width = size.flatMap(s -> XmlDocument.childText(s, "width"));
        Optional<String> height = size.flatMap(s -> XmlDocument.childText(s, "height"));
        if (width.isPresent() && height.isPresent()) {
            target.setWidth(Integer.parseInt(width.get()));
            target.setHeight(Integer.parseInt(height.get()));
            return;
        }
        log.warn("Unable to find size for SearchMap {}", file);
        Optional<Element> readout = doc.find("TileSetXml", "AcquisitionSettings", "camera", "ReadoutArea");
        if (readout.isEmpty()) return;
        int rw = Integer.parseInt(XmlDocument.childText(readout.get(), "width").orElse("0"));
        int rh = Integer.parseInt(XmlDocument.childText(readout.get(), "height").orElse("0"));
        int longest = Math.max(rw, rh);
        if (longest == 0) return;
        target.setWidth((int) ((double) FALLBACK_MAP_SIZE * rw / longest));
        target.setHeight((int) ((double) FALLBACK_MAP_SIZE * rh / longest));
        log.warn("Inserting inferred width {}, height {} for SearchMap display", target.getWidth(), target.getHeight());
    }

    /**
     * Lists batch positions and, for each, its beam-shifted exposure areas. The
     * batch itself is returned with zero beam shift.
     */
    public static List<BatchPositionInfo> readBatchPositions(Path file) throws MetadataParseException {
        XmlDocument doc = XmlDocument.parse(file);
        List<BatchPositionInfo> out = new ArrayList<>();
        Optional<Element> positions = doc.find("BatchPositionsList", "BatchPositions");
        if (positions.isEmpty()) return out;

        for (Element bp : XmlDocument.children(positions.get(), "BatchPositionParameters")) {
            Optional<Element> onTileSet = XmlDocument.child(bp, "PositionOnTileSet");
            if (onTileSet.isEmpty()) continue;
            String name = XmlDocument.childText(bp, "Name").orElse("");
            String searchMap = XmlDocument.childText(onTileSet.get(), "TileSetName").orElse("");
            double x = Double.parseDouble(XmlDocument.childText(onTileSet.get(), "StagePositionX").orElse("0"));
            double y = Double.parseDouble(XmlDocument.childText(onTileSet.get(), "StagePositionY").orElse("0"));
            BatchPositionInfo batch = BatchPositionInfo.builder()
                    .name(name)
                    .searchMapName(searchMap)
                    .xStagePosition(x)
                    .yStagePosition(y)
                    .build();
            out.add(batch);

            XmlDocument.child(bp, "AdditionalExposureTemplateAreas").ifPresent(areas -> {
                for (Element shift : XmlDocument.children(areas, "ExposureTemplateAreaParameters")) {
                    out.add(batch.toBuilder()
                            .name(XmlDocument.childText(shift, "Name").orElse(name))
                            .xBeamshift(Double.parseDouble(XmlDocument.childText(shift, "PositionX").orElse("0")))
                            .yBeamshift(Double.parseDouble(XmlDocument.childText(shift, "PositionY").orElse("0")))
                            .build());
                }
            });
        }
        return out;
    }

    /**
     * Pixel size of the first {@code Atlas_*.xml} in {@code atlasDirectory}.
     */
    public static Optional<AtlasImage> findAtlasImage(Path atlasDirectory) {
        if (!Files.isDirectory(atlasDirectory)) return Optional.empty();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(atlasDirectory, "Atlas_*.xml")) {
            for (Path xml : ds) {
                Optional<Double> pixelSize = XmlDocument.parse(xml)
                        .text("MicroscopeImage", "SpatialScale", "pixelSize", "x", "numericValue")
                        .map(Double::parseDouble);
                if (pixelSize.isPresent()) {
                    return Optional.of(new AtlasImage(xml, pixelSize.get()));
                }
            }
        } catch (IOException | MetadataParseException e) {
            log.warn("Could not read atlas metadata in {}: {}", atlasDirectory, e.getMessage());
        }
        return Optional.empty();
    }

    private static Matrix2 matrix(Element parent) {
        Map<String, Double> values = new HashMap<>();
        for (String key : new String[]{"m11", "m12", "m21", "m22"}) {
            XmlDocument.childText(parent, "_" + key).ifPresent(v -> values.put(key, Double.parseDouble(v)));
        }
        return values.size() == 4 ? Matrix2.fromMap(values) : null;
    }

    public static final class AtlasImage {
        private final Path xml;
        private final double pixelSize;

        AtlasImage(Path xml, double pixelSize) {
            this.xml = xml;
            this.pixelSize = pixelSize;
        }

        public Path getXml() {
            return xml;
        }

        public double getPixelSize() {
            return pixelSize;
        }

        public Path getJpg() {
            String name = xml.getFileName().toString();
            return xml.resolveSibling(name.substring(0, name.length() - ".xml".length()) + ".jpg");
        }
    }
}
