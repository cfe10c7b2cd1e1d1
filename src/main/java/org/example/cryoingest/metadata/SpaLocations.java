package org.example.cryoingest.metadata;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.model.AtlasPosition;
import org.example.cryoingest.model.FoilHoleInfo;
import org.example.cryoingest.model.GridSquareInfo;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Grid square and foil hole lookups for EPU sessions: ids from file names, stage and
 * pixel positions from the EPU metadata files written alongside the movies.
 */
@Slf4j
public final class SpaLocations {

    private SpaLocations() {
    }

    public static int gridSquareFromFile(Path file) {
        for (Path part : file) {
            String p = part.toString();
            if (p.startsWith("GridSquare")) {
                return Integer.parseInt(p.split("_")[1]);
            }
        }
        throw new IllegalArgumentException("Grid square id could not be determined from path " + file);
    }

    public static int foilHoleFromFile(Path file) {
        String name = file.getFileName().toString();
        String[] split = name.split("_");
        if (split.length < 2) {
            throw new IllegalArgumentException("Foil hole id could not be determined from " + name);
        }
        return Integer.parseInt(split[1]);
    }

    /**
     * Locates {@code Metadata/GridSquare_<id>.dm} for a movie below one of the machine's
     * data directories: {@code <dataDir>/<visit>/<session>/Metadata/GridSquare_<id>.dm}.
     */
    public static Path gridSquareMetadataFile(Path movie, List<String> dataDirectories, String visit, int gridSquare) {
        for (String dd : dataDirectories) {
            Path base = Path.of(dd);
            if (movie.startsWith(base)) {
                Path mid = base.relativize(movie).getParent();
                Path session = climb(mid, 3);
                Path target = base.resolve(visit);
                if (session != null) target = target.resolve(session);
                return target.resolve("Metadata").resolve("GridSquare_" + gridSquare + ".dm");
            }
        }
        throw new IllegalArgumentException("Could not determine grid square metadata path for " + movie);
    }

    private static Path climb(Path p, int levels) {
        Path current = p;
        for (int i = 0; i < levels && current != null; i++) {
            current = current.getParent();
        }
        return current;
    }

    /**
     * Reads the atlas positions of grid squares from an atlas {@code .dm}/XML file.
     * When {@code gridSquare} is non-empty only that square is returned.
     */
    public static Map<String, AtlasPosition> gridSquareAtlasPositions(Path atlasFile, String gridSquare)
            throws MetadataParseException {
        XmlDocument doc = XmlDocument.parse(atlasFile);
        Map<String, AtlasPosition> positions = new LinkedHashMap<>();
        Optional<Element> items = doc.find("AtlasSessionXml", "Atlas", "TilesEfficient", "_items");
        if (items.isEmpty()) return positions;

        for (Element tile : XmlDocument.children(items.get(), "TileXml")) {
            Optional<Element> kv = XmlDocument.child(tile, "Nodes", "KeyValuePairs");
            if (kv.isEmpty()) continue;
            List<Element> holders = XmlDocument.childrenStartingWith(kv.get(), "KeyValuePairOfintNodeXml");
            if (holders.isEmpty()) continue;
            for (Element node : flatten(holders, "KeyValuePairOfintNodeXml")) {
                String key = XmlDocument.childText(node, "key").orElse("");
                if (!gridSquare.isEmpty() && !gridSquare.equals(key)) continue;
                Optional<Element> pos = XmlDocument.child(node, "value", "PositionOnTheAtlas");
                if (pos.isEmpty()) continue;
                try {
                    positions.put(key, new AtlasPosition(
                            (int) Double.parseDouble(XmlDocument.childText(pos.get(), "Center", "x").orElseThrow()),
                            (int) Double.parseDouble(XmlDocument.childText(pos.get(), "Center", "y").orElseThrow()),
                            Double.parseDouble(XmlDocument.childText(pos.get(), "Physical", "x").orElseThrow()) * 1e9,
                            Double.parseDouble(XmlDocument.childText(pos.get(), "Physical", "y").orElseThrow()) * 1e9
                    ));
                } catch (RuntimeException e) {
                    log.warn("Incomplete atlas position for grid square {} in {}", key, atlasFile);
                    continue;
                }
                if (!gridSquare.isEmpty()) return positions;
            }
        }
        return positions;
    }

    /**
     * EPU writes either one element per pair, or a wrapper element whose children
     * carry the pairs. Both shapes are accepted.
     */
    private static List<Element> flatten(List<Element> holders, String prefix) {
        List<Element> out = new ArrayList<>();
        for (Element h : holders) {
            if (XmlDocument.child(h, "key").isPresent()) {
                out.add(h);
            } else {
                for (Element c : XmlDocument.elements(h)) {
                    if (XmlDocument.localName(c).startsWith(prefix) || XmlDocument.child(c, "key").isPresent()) {
                        out.add(c);
                    }
                }
            }
        }
        return out;
    }

    /**
     * Collects the overview image and readout geometry of a grid square. Images are
     * searched in {@code Images-Disc*}/GridSquare_<id>/ next to the metadata directory.
     */
    public static GridSquareInfo gridSquareData(Path metadataFile, int gridSquare) {
        GridSquareInfo.GridSquareInfoBuilder info = GridSquareInfo.builder().id(gridSquare);
        Path sessionDir = metadataFile.getParent() == null ? null : metadataFile.getParent().getParent();
        if (sessionDir == null) return info.build();

        List<Path> images = imagesMatching(sessionDir, "GridSquare_" + gridSquare, "GridSquare_*.jpg");
        if (images.isEmpty()) return info.build();
        Path image = images.get(0);
        info.image(image.toString());
        readImageGeometry(image).ifPresent(g -> info
                .readoutAreaX(g.width)
                .readoutAreaY(g.height)
                .pixelSize(g.pixelSize));
        return info.build();
    }

    /**
     * Finds the foil hole's position on its grid square from {@code GridSquare_<id>.dm}.
     * Returns an id-only record when the foil hole is not listed.
     */
    public static FoilHoleInfo foilHoleData(Path metadataFile, int foilHole, int gridSquare)
            throws MetadataParseException {
        FoilHoleInfo.FoilHoleInfoBuilder info = FoilHoleInfo.builder().id(foilHole).gridSquareId(gridSquare);
        XmlDocument doc = XmlDocument.parse(metadataFile);
        Optional<Element> locations = doc.find("GridSquareXml", "TargetLocations", "TargetLocationsEfficient");
        if (locations.isEmpty()) {
            locations = doc.find("GridSquareXml", "TargetLocations", "TargetLocations");
        }
        Optional<Element> array = locations.flatMap(l -> XmlDocument.child(l, "m_serializationArray"));
        if (array.isEmpty()) {
            log.warn("No target locations in {} for foil hole {}", metadataFile, foilHole);
            return info.build();
        }

        Path sessionDir = metadataFile.getParent() == null ? null : metadataFile.getParent().getParent();
        if (sessionDir != null) {
            List<Path> images = imagesMatching(sessionDir,
                    "GridSquare_" + gridSquare + "/FoilHoles", "FoilHole_" + foilHole + "_*.jpg");
            if (!images.isEmpty()) {
                Path image = images.get(images.size() - 1);
                info.image(image.toString());
                readImageGeometry(image).ifPresent(g -> info
                        .readoutAreaX(g.width)
                        .readoutAreaY(g.height)
                        .pixelSize(g.pixelSize));
            }
        }

        for (Element entry : flatten(XmlDocument.childrenStartingWith(array.get(), "KeyValuePairOfintTargetLocation"),
                "KeyValuePairOfintTargetLocation")) {
            String key = XmlDocument.childText(entry, "key").orElse("");
            if (!key.equals(String.valueOf(foilHole))) continue;
            Optional<Element> value = XmlDocument.child(entry, "value");
            if (value.isEmpty()) break;
            Element v = value.get();
            info.xLocation(parseDouble(XmlDocument.childText(v, "PixelCenter", "x")))
                    .yLocation(parseDouble(XmlDocument.childText(v, "PixelCenter", "y")))
                    .xStagePosition(parseDouble(XmlDocument.childText(v, "StagePosition", "X")))
                    .yStagePosition(parseDouble(XmlDocument.childText(v, "StagePosition", "Y")))
                    .diameter(parseDouble(XmlDocument.childText(v, "PixelWidthHeight", "width")));
            return info.build();
        }
        log.warn("Foil hole positions could not be determined from metadata file {} for foil hole {}",
                metadataFile, foilHole);
        return info.build();
    }

    private static Double parseDouble(Optional<String> raw) {
        return raw.filter(s -> !s.isBlank()).map(Double::parseDouble).orElse(null);
    }

    private static List<Path> imagesMatching(Path sessionDir, String subPath, String glob) {
        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> discs = Files.newDirectoryStream(sessionDir, "Images-Disc*")) {
            for (Path disc : discs) {
                Path dir = disc.resolve(subPath);
                if (!Files.isDirectory(dir)) continue;
                try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, glob)) {
                    for (Path p : ds) found.add(p);
                }
            }
        } catch (IOException e) {
            log.debug("Could not list images under {}: {}", sessionDir, e.getMessage());
        }
        found.sort(Comparator.comparing(SpaLocations::changeTime));
        return found;
    }

    private static FileTime changeTime(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static Optional<ImageGeometry> readImageGeometry(Path jpg) {
        String name = jpg.getFileName().toString();
        Path xml = jpg.resolveSibling(name.substring(0, name.lastIndexOf('.')) + ".xml");
        if (!Files.isRegularFile(xml)) return Optional.empty();
        try {
            XmlDocument doc = XmlDocument.parse(xml);
            Optional<Element> readout = doc.find("MicroscopeImage", "microscopeData", "acquisition", "camera", "ReadoutArea");
            Optional<String> pixelSize = doc.text("MicroscopeImage", "SpatialScale", "pixelSize", "x", "numericValue");
            if (readout.isEmpty() || pixelSize.isEmpty()) return Optional.empty();
            return Optional.of(new ImageGeometry(
                    Integer.parseInt(XmlDocument.childText(readout.get(), "width").orElseThrow()),
                    Integer.parseInt(XmlDocument.childText(readout.get(), "height").orElseThrow()),
                    Double.parseDouble(pixelSize.get())
            ));
        } catch (MetadataParseException | RuntimeException e) {
            log.warn("Could not read image geometry from {}: {}", xml, e.getMessage());
            return Optional.empty();
        }
    }

    private static final class ImageGeometry {
        final int width;
        final int height;
        final double pixelSize;

        ImageGeometry(int width, int height, double pixelSize) {
            this.width = width;
            this.height = height;
            this.pixelSize = pixelSize;
        }
    }
}
