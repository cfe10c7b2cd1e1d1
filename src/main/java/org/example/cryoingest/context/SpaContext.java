package org.example.cryoingest.context;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.MachineConfig;
import org.example.cryoingest.controlplane.model.EerFractionationRequest;
import org.example.cryoingest.controlplane.model.FoilHoleParameters;
import org.example.cryoingest.controlplane.model.GridSquareParameters;
import org.example.cryoingest.controlplane.model.SpaPreprocessRequest;
import org.example.cryoingest.metadata.EerFrameCounter;
import org.example.cryoingest.metadata.MetadataParseException;
import org.example.cryoingest.metadata.SpaLocations;
import org.example.cryoingest.metadata.XmlDocument;
import org.example.cryoingest.model.AtlasPosition;
import org.example.cryoingest.model.DataCollectionParameters;
import org.example.cryoingest.model.FoilHoleInfo;
import org.example.cryoingest.model.GridSquareInfo;
import org.example.cryoingest.model.Role;
import org.example.cryoingest.model.SampleInfo;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Year;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Single particle acquisition with EPU. Every movie is placed on its grid square
 * and foil hole, both registered once, before preprocessing is requested.
 */
@Slf4j
public class SpaContext implements Context {

    static final List<String> DEFAULT_REQUIRED_SUBSTRINGS = List.of("fractions");
    static final String EER_FRACTIONATION_FILE = "eer_fractionation_spa.txt";

    private final SourceEnvironment environment;
    private final SessionEnvironment session;
    private final ControlPlaneClient client;

    /** Foil holes registered so far, by grid square. */
    private final Map<Integer, Set<Integer>> foilHoles = new HashMap<>();

    public SpaContext(SourceEnvironment environment) {
        this.environment = environment;
        this.session = environment.getSession();
        this.client = session.getClient();
    }

    @Override
    public String name() {
        return "SpaContext";
    }

    @Override
    public List<String> postTransfer(Path transferredFile, Role role) {
        String name = transferredFile.getFileName().toString();
        String suffix = TomographyContext.suffix(transferredFile);
        if (role != Role.DETECTOR || name.contains("gain") || !TomographyContext.DATA_SUFFIXES.contains(suffix)) {
            return List.of();
        }
        List<String> required = session.getMachineConfig().requiredSubstrings("epu", suffix, DEFAULT_REQUIRED_SUBSTRINGS);
        if (!required.isEmpty() && required.stream().noneMatch(name::contains)) {
            return List.of();
        }

        String destination = environment.transferredPath(transferredFile).toString();
        int imageNumber = environment.nextImageNumber();
        long correlationId = session.nextCorrelationId();
        DataCollectionParameters p = environment.parametersOrEmpty();

        String eerFractionationFile = null;
        if (suffix.equals(".eer")) {
            Optional<String> written = client.writeEerFractionationFile(session.getSessionId(), session.getVisit(),
                    EerFractionationRequest.builder()
                            .eerPath(destination)
                            .numFrames(countFrames(transferredFile))
                            .fractionation(p.getEerFractionation())
                            .dosePerFrame(p.getDosePerFrame())
                            .fractionationFileName(EER_FRACTIONATION_FILE)
                            .build());
            if (written.isEmpty()) {
                log.warn("No EER fractionation file for {}, preprocessing not requested", transferredFile);
                return List.of();
            }
            eerFractionationFile = written.get();
        }

        Integer foilHole;
        try {
            foilHole = positionAnalysis(transferredFile);
        } catch (MetadataParseException | RuntimeException e) {
            log.warn("Position analysis failed for {}: {}", transferredFile, e.getMessage());
            foilHole = null;
        }

        client.requestSpaPreprocessing(session.getSessionId(), session.getVisit(),
                SpaPreprocessRequest.builder()
                        .path(destination)
                        .description("")
                        .imageNumber(imageNumber)
                        .pixelSize(p.getPixelSizeOnImage())
                        .dosePerFrame(p.getDosePerFrame())
                        .mcBinning(p.getMotionCorrBinning() == null ? 1 : p.getMotionCorrBinning())
                        .gainRef(p.getGainRef())
                        .extractDownscale(p.getDownscale())
                        .eerFractionationFile(eerFractionationFile)
                        .tag(environment.getSource().toString())
                        .foilHoleId(foilHole)
                        .mcUuid(correlationId)
                        .build());
        return List.of();
    }

    private Integer countFrames(Path eer) {
        try {
            return EerFrameCounter.countFrames(eer);
        } catch (IOException e) {
            log.warn("Could not count frames of {}: {}", eer, e.getMessage());
            return null;
        }
    }

    /**
     * Registers the grid square and foil hole of a movie the first time they are
     * seen and returns the foil hole id.
     */
    int positionAnalysis(Path movie) throws MetadataParseException {
        MachineConfig machine = session.getMachineConfig();
        String tag = environment.getSource().toString();
        int gridSquare = SpaLocations.gridSquareFromFile(movie);
        Path metadataFile = SpaLocations.gridSquareMetadataFile(movie, machine.getDataDirectories(),
                session.getVisit(), gridSquare);

        Set<Integer> registered = foilHoles.get(gridSquare);
        if (registered == null) {
            registered = new HashSet<>();
            foilHoles.put(gridSquare, registered);
            AtlasPosition position = atlasPosition(movie, gridSquare).orElse(null);
            GridSquareInfo gs = SpaLocations.gridSquareData(metadataFile, gridSquare);
            GridSquareParameters.GridSquareParametersBuilder params = GridSquareParameters.builder()
                    .tag(tag)
                    .readoutAreaX(gs.getReadoutAreaX())
                    .readoutAreaY(gs.getReadoutAreaY())
                    .thumbnailSizeX(gs.getThumbnailSizeX())
                    .thumbnailSizeY(gs.getThumbnailSizeY())
                    .pixelSize(gs.getPixelSize())
                    .image(gs.getImage() == null ? "" : session.transferredPath(Path.of(gs.getImage())));
            if (position != null) {
                params.xLocation(position.getXPixel())
                        .yLocation(position.getYPixel())
                        .xStagePosition(position.getXStage())
                        .yStagePosition(position.getYStage());
            }
            client.registerGridSquare(session.getSessionId(), gridSquare, params.build());
        }

        int foilHole = SpaLocations.foilHoleFromFile(movie);
        if (!registered.contains(foilHole)) {
            FoilHoleParameters.FoilHoleParametersBuilder params = FoilHoleParameters.builder()
                    .name(foilHole)
                    .tag(tag);
            if (Files.isRegularFile(metadataFile)) {
                FoilHoleInfo fh = SpaLocations.foilHoleData(metadataFile, foilHole, gridSquare);
                params.xLocation(fh.getXLocation())
                        .yLocation(fh.getYLocation())
                        .xStagePosition(fh.getXStagePosition())
                        .yStagePosition(fh.getYStagePosition())
                        .readoutAreaX(fh.getReadoutAreaX())
                        .readoutAreaY(fh.getReadoutAreaY())
                        .pixelSize(fh.getPixelSize())
                        .diameter(fh.getDiameter())
                        .image(fh.getImage() == null ? "" : session.transferredPath(Path.of(fh.getImage())));
            }
            client.registerFoilHole(session.getSessionId(), gridSquare, params.build());
            registered.add(foilHole);
        }
        return foilHole;
    }

    private Optional<AtlasPosition> atlasPosition(Path movie, int gridSquare) {
        Optional<SampleInfo> sample = session.sampleFor(environment.getSource());
        Optional<Path> visitDirectory = session.visitDirectory(movie);
        if (sample.isEmpty() || visitDirectory.isEmpty()) return Optional.empty();
        Path atlas = visitDirectory.get().resolve(sample.get().getAtlas());
        try {
            return Optional.ofNullable(SpaLocations.gridSquareAtlasPositions(atlas, String.valueOf(gridSquare))
                    .get(String.valueOf(gridSquare)));
        } catch (MetadataParseException e) {
            log.warn("Atlas position of grid square {} unavailable from {}: {}", gridSquare, atlas, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<DataCollectionParameters> gatherMetadata(Path metadataFile) {
        log.info("Trying to gather metadata on {}", metadataFile);
        if (!TomographyContext.suffix(metadataFile).equals(".xml")) {
            log.debug("SPA metadata expected in an xml file, not {}", metadataFile.getFileName());
            return Optional.empty();
        }
        if (!Files.isRegularFile(metadataFile)) {
            log.debug("Metadata file {} not found", metadataFile);
            return Optional.empty();
        }
        try {
            return parseMovieXml(XmlDocument.parse(metadataFile));
        } catch (MetadataParseException | RuntimeException e) {
            log.warn("Failed to gather metadata from {}: {}", metadataFile, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<DataCollectionParameters> parseMovieXml(XmlDocument doc) {
        DataCollectionParameters user = environment.parametersOrEmpty();
        DataCollectionParameters.DataCollectionParametersBuilder b = DataCollectionParameters.builder()
                .experimentType("SPA")
                .acquisitionSoftware("epu");

        int magnification = 0;
        int fractions = 1;
        int binningXml = 1;
        double pixelSize;
        int imageSizeX;
        int imageSizeY;
        Double totalDose = null;

        if ("Acquisition".equals(doc.rootName())) {
            b.voltage(300.0);
            imageSizeX = Integer.parseInt(doc.text("Acquisition", "Info", "ImageSize", "Width").orElseThrow());
            imageSizeY = Integer.parseInt(doc.text("Acquisition", "Info", "ImageSize", "Height").orElseThrow());
            pixelSize = Double.parseDouble(doc.text("Acquisition", "Info", "SensorPixelSize", "Height").orElseThrow());
        } else if ("MicroscopeImage".equals(doc.rootName())) {
            Element root = doc.root();
            b.voltage(Double.parseDouble(XmlDocument.childText(root, "microscopeData", "gun", "AccelerationVoltage")
                    .orElseThrow()) / 1000);
            Element camera = XmlDocument.child(root, "microscopeData", "acquisition", "camera").orElseThrow();
            imageSizeX = Integer.parseInt(XmlDocument.childText(camera, "ReadoutArea", "width").orElseThrow());
            imageSizeY = Integer.parseInt(XmlDocument.childText(camera, "ReadoutArea", "height").orElseThrow());
            pixelSize = Double.parseDouble(XmlDocument.childText(root, "SpatialScale", "pixelSize", "x", "numericValue")
                    .orElseThrow());
            magnification = XmlDocument.childText(root, "microscopeData", "optics", "TemMagnification", "NominalMagnification")
                    .map(Integer::parseInt).orElse(0);
            binningXml = XmlDocument.childText(camera, "Binning", "x").map(Integer::parseInt).orElse(1);

            List<Element> custom = XmlDocument.child(root, "CustomData")
                    .map(c -> XmlDocument.childrenStartingWith(c, "KeyValueOfstringanyType"))
                    .orElse(List.of());
            totalDose = customValue(custom, "Dose")
                    .map(v -> Math.round(Double.parseDouble(v) * 1e-20 * 100) / 100.0)
                    .orElse(1.0);
            fractions = XmlDocument.child(camera, "CameraSpecificInput")
                    .flatMap(input -> XmlDocument.firstDescendant(input, "NumberOffractions"))
                    .map(e -> Integer.parseInt(XmlDocument.textOf(e).trim()))
                    .orElse(1);
            Optional<String> c2 = customValue(custom, "Aperture[C2].Name");
            if (c2.isEmpty() && custom.size() > 3) {
                c2 = XmlDocument.childText(custom.get(3), "Value");
            }
            c2.ifPresent(b::c2aperture);
            XmlDocument.childText(camera, "ExposureTime").map(Double::parseDouble).ifPresent(b::exposureTime);
            XmlDocument.childText(root, "microscopeData", "optics", "EnergyFilter", "EnergySelectionSlitWidth")
                    .map(Double::parseDouble).ifPresent(b::slitWidth);
            b.phasePlate(custom.size() > 11
                    && XmlDocument.childText(custom.get(11), "Value").map("true"::equals).orElse(false));
            b.totalExposedDose(totalDose);
        } else {
            log.warn("Metadata file format is not recognised: {}", doc.rootName());
            return Optional.empty();
        }

        PixelSizePolicy.Geometry geometry = PixelSizePolicy.spa(session.getMachineConfig(), session.isSuperres(),
                binningXml, pixelSize, magnification, imageSizeX, imageSizeY);
        int year = Year.now().getValue();
        b.magnification(magnification)
                .pixelSizeOnImage(geometry.getPixelSize())
                .imageSizeX(geometry.getImageSizeX())
                .imageSizeY(geometry.getImageSizeY())
                .motionCorrBinning(geometry.getMotionCorrBinning())
                .gainRef(nonBlank(user.getGainRef())
                        .orElse("data/" + year + "/" + session.getVisit() + "/processing/gain.mrc"))
                .gainRefSuperres(nonBlank(user.getGainRefSuperres())
                        .orElse("data/" + year + "/" + session.getVisit() + "/processing/gain_superres.mrc"));

        if (user.getDosePerFrame() != null) {
            b.dosePerFrame(user.getDosePerFrame());
        } else if (totalDose != null) {
            b.dosePerFrame(Math.round(totalDose / fractions * 1000) / 1000.0);
        }

        return Optional.of(b
                .useCryolo(orDefault(user.getUseCryolo(), true))
                .symmetry(orDefault(user.getSymmetry(), "C1"))
                .maskDiameter(orDefault(user.getMaskDiameter(), 190))
                .boxsize(orDefault(user.getBoxsize(), 256))
                .downscale(orDefault(user.getDownscale(), true))
                .smallBoxsize(orDefault(user.getSmallBoxsize(), 128))
                .eerFractionation(orDefault(user.getEerFractionation(), 20))
                .particleDiameter(orDefault(user.getParticleDiameter(), 0.0))
                .estimateParticleDiameter(orDefault(user.getEstimateParticleDiameter(), true))
                .source(environment.getSource().toString())
                .build());
    }

    private static Optional<String> customValue(List<Element> entries, String key) {
        for (Element e : entries) {
            if (key.equals(XmlDocument.childText(e, "Key").orElse(null))) {
                return XmlDocument.childText(e, "Value");
            }
        }
        return Optional.empty();
    }

    private static Optional<String> nonBlank(String s) {
        return s == null || s.isBlank() || s.equals("None") ? Optional.empty() : Optional.of(s);
    }

    private static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
