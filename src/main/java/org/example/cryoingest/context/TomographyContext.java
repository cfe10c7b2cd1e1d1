package org.example.cryoingest.context;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.model.DataCollectionRequest;
import org.example.cryoingest.controlplane.model.ProcessingJobRequest;
import org.example.cryoingest.controlplane.model.TiltInfo;
import org.example.cryoingest.controlplane.model.TiltSeriesGroupInfo;
import org.example.cryoingest.controlplane.model.TiltSeriesInfo;
import org.example.cryoingest.controlplane.model.TomographyPreprocessRequest;
import org.example.cryoingest.metadata.MdocFile;
import org.example.cryoingest.metadata.MetadataParseException;
import org.example.cryoingest.metadata.TiltAngles;
import org.example.cryoingest.metadata.XmlDocument;
import org.example.cryoingest.model.AcquisitionSoftware;
import org.example.cryoingest.model.DataCollectionParameters;
import org.example.cryoingest.model.Role;
import org.example.cryoingest.model.TiltSeries;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Year;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tilt series reconstruction for Tomo and SerialEM sources.
 * <p>
 * Movies are grouped by the series name encoded in their file names. A series is
 * complete once it holds as many movies as its mdoc has tilt blocks. SerialEM series
 * without an mdoc are considered complete when acquisition moves on to another
 * series and they are at least as long as the longest series seen. A movie arriving
 * for a completed series reopens it and requests a rerun.
 */
@Slf4j
public class TomographyContext implements Context {

    static final Set<String> DATA_SUFFIXES = Set.of(".mrc", ".tiff", ".tif", ".eer");
    static final List<String> DEFAULT_REQUIRED_SUBSTRINGS = List.of("fractions");
    static final List<String> RECIPES = List.of("em-tomo-preprocess", "em-tomo-align");

    private final AcquisitionSoftware software;
    private final SourceEnvironment environment;
    private final SessionEnvironment session;
    private final ControlPlaneClient client;

    private final Map<String, TiltSeries> tiltSeries = new LinkedHashMap<>();
    private final Map<String, Integer> expectedLengths = new LinkedHashMap<>();
    private TiltInfoExtractor extractor;
    private String lastSeries;
    private String lastAngle;

    private volatile boolean dataCollectionsRegistered;
    private volatile String imageDirectory;

    public TomographyContext(AcquisitionSoftware software, SourceEnvironment environment) {
        if (software == AcquisitionSoftware.EPU) {
            throw new IllegalArgumentException("EPU sources are handled by the SPA context");
        }
        this.software = software;
        this.environment = environment;
        this.session = environment.getSession();
        this.client = session.getClient();
    }

    @Override
    public String name() {
        return "TomographyContext(" + software.key() + ")";
    }

    public AcquisitionSoftware getSoftware() {
        return software;
    }

    @Override
    public List<String> postTransfer(Path transferredFile, Role role) {
        String name = transferredFile.getFileName().toString();
        if (role != Role.DETECTOR || name.contains("gain")) return List.of();

        String suffix = suffix(transferredFile);
        List<String> completed = List.of();
        if (DATA_SUFFIXES.contains(suffix)) {
            if (software == AcquisitionSoftware.TOMO) {
                List<String> required = session.getMachineConfig()
                        .requiredSubstrings(software.key(), suffix, DEFAULT_REQUIRED_SUBSTRINGS);
                completed = addTilt(transferredFile, extractor(), required);
            } else {
                completed = addTilt(transferredFile, SerialEmFileNaming.INSTANCE, List.of());
            }
        }
        if (suffix.equals(".mdoc")) {
            completed = mdocTransferred(transferredFile);
        }
        return completed;
    }

    private TiltInfoExtractor extractor() {
        if (extractor == null) {
            String version = session.getMachineConfig().getSoftwareVersions().get(software.key());
            extractor = TomoFileNaming.forVersion(version);
        }
        return extractor;
    }

    private List<String> addTilt(Path movie, TiltInfoExtractor naming, List<String> requiredStrings) {
        String lowerName = movie.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String r : requiredStrings) {
            if (!lowerName.contains(r)) return List.of();
        }

        String seriesNumber;
        String angle;
        String name;
        double angleValue;
        try {
            seriesNumber = naming.series(movie);
            angle = naming.angle(movie);
            Double.parseDouble(seriesNumber);
            angleValue = Double.parseDouble(angle);
            name = TiltSeriesNames.of(naming.tag(movie), seriesNumber, movie);
        } catch (RuntimeException e) {
            log.debug("Tilt series and angle could not be determined for {}", movie);
            return List.of();
        }

        TiltSeries series = tiltSeries.get(name);
        if (series != null && series.contains(movie)) {
            log.debug("{} already belongs to tilt series {}", movie, name);
            return List.of();
        }
        if (series != null && series.isCompleted()) {
            log.info("Tilt series {} was previously thought complete but now {} has been seen", name, movie);
            series.setCompleted(false);
            client.registerTiltSeriesForRerun(session.getSessionId(), new TiltSeriesInfo(name, sourceTag()));
        }

        if (series == null) {
            log.info("New tilt series found: {}", name);
            series = new TiltSeries(name);
            series.setExpectedLength(expectedLengths.get(name));
            series.append(movie, angleValue);
            tiltSeries.put(name, series);
            client.registerTiltSeries(session.getSessionId(), new TiltSeriesInfo(name, sourceTag()));
            // the first series is registered with the data collection form instead
            if (dataCollectionsRegistered && tiltSeries.size() > 1) {
                registerDataCollection(name, movie);
            }
        } else if (series.hasAngle(angleValue)) {
            log.debug("Tilt angle {} already present in tilt series {}", angle, name);
        } else {
            series.append(movie, angleValue);
        }

        String destination = environment.transferredPath(movie).toString();
        client.registerTilt(session.getSessionId(), session.getVisit(),
                new TiltInfo(destination, name, sourceTag()));
        requestPreprocessing(movie, destination, name);

        boolean switched = lastSeries != null && !lastSeries.equals(name) && !lastAngle.equals(angle);
        lastSeries = name;
        lastAngle = angle;
        if (series.getExpectedLength() != null || switched) {
            return checkTiltSeries(switched);
        }
        return List.of();
    }

    private void requestPreprocessing(Path movie, String destination, String seriesName) {
        DataCollectionParameters p = environment.parametersOrEmpty();
        Long size = null;
        Double timestamp = null;
        try {
            size = Files.size(movie);
            timestamp = Files.getLastModifiedTime(movie).toMillis() / 1000.0;
        } catch (IOException e) {
            log.debug("Could not stat {}: {}", movie, e.getMessage());
        }
        client.requestTomographyPreprocessing(session.getSessionId(), session.getVisit(),
                TomographyPreprocessRequest.builder()
                        .path(destination)
                        .description("")
                        .size(size)
                        .timestamp(timestamp)
                        .imageNumber(environment.nextImageNumber())
                        .pixelSize(p.getPixelSizeOnImage())
                        .mcUuid(session.nextCorrelationId())
                        .dosePerFrame(p.getDosePerFrame())
                        .mcBinning(p.getMotionCorrBinning() == null ? 1 : p.getMotionCorrBinning())
                        .gainRef(p.getGainRef())
                        .eerFractionationFile(environment.getEerFractionationFile())
                        .tag(seriesName)
                        .source(sourceTag())
                        .build());
    }

    private List<String> mdocTransferred(Path mdoc) {
        String name = stem(mdoc);
        int blocks;
        try {
            blocks = MdocFile.countBlocks(mdoc);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", mdoc, e.getMessage());
            return List.of();
        }
        expectedLengths.put(name, blocks);
        TiltSeries series = tiltSeries.get(name);
        if (series != null) {
            series.setExpectedLength(blocks);
        }
        client.registerTiltSeriesLength(session.getSessionId(),
                new TiltSeriesGroupInfo(List.of(name), sourceTag(), List.of(blocks)));
        return checkTiltSeries(false);
    }

    /**
     * Marks every series that has become complete and notifies the control plane
     * once per series.
     */
    private List<String> checkTiltSeries(boolean acquisitionMovedOn) {
        int longest = 0;
        for (TiltSeries ts : tiltSeries.values()) {
            longest = Math.max(longest, ts.size());
        }
        List<String> newlyCompleted = new ArrayList<>();
        for (TiltSeries ts : tiltSeries.values()) {
            if (ts.isCompleted()) continue;
            boolean complete;
            if (ts.getExpectedLength() != null) {
                complete = ts.size() >= ts.getExpectedLength();
            } else {
                complete = software == AcquisitionSoftware.SERIALEM && acquisitionMovedOn && ts.size() >= longest;
            }
            if (complete) {
                ts.setCompleted(true);
                newlyCompleted.add(ts.getTag());
                client.registerCompletedTiltSeries(session.getSessionId(), session.getVisit(),
                        new TiltSeriesGroupInfo(List.of(ts.getTag()), sourceTag(), List.of(ts.size())));
            }
        }
        if (!newlyCompleted.isEmpty()) {
            log.info("The following tilt series are considered complete: {}", newlyCompleted);
        }
        return newlyCompleted;
    }

    @Override
    public void parametersConfirmed(String imageDirectory) {
        registerDataCollections(imageDirectory);
    }

    /**
     * Registers data collections and processing jobs for every series seen so far.
     * Called once the data collection form has been confirmed; series found
     * afterwards register their own.
     */
    public void registerDataCollections(String imageDirectory) {
        this.imageDirectory = imageDirectory;
        for (TiltSeries ts : tiltSeries.values()) {
            registerDataCollection(ts.getTag(), ts.getMovies().get(0));
        }
        dataCollectionsRegistered = true;
    }

    private void registerDataCollection(String seriesName, Path firstMovie) {
        DataCollectionRequest.DataCollectionRequestBuilder dc = DataCollectionRequest.builder()
                .experimentType("tomography")
                .fileExtension(suffix(firstMovie))
                .acquisitionSoftware(software.key())
                .imageDirectory(imageDirectory)
                .tag(seriesName)
                .source(sourceTag());
        DataCollectionParameters p = environment.getParameters();
        if (p != null && p.getVoltage() != null) {
            dc.voltage(p.getVoltage())
                    .pixelSizeOnImage(p.getPixelSizeOnImage())
                    .imageSizeX(p.getImageSizeX())
                    .imageSizeY(p.getImageSizeY())
                    .magnification(p.getMagnification());
        }
        client.startDataCollection(session.getSessionId(), session.getVisit(), dc.build());
        for (String recipe : RECIPES) {
            client.registerProcessingJob(session.getSessionId(), session.getVisit(),
                    new ProcessingJobRequest(seriesName, sourceTag(), recipe));
        }
    }

    @Override
    public Optional<DataCollectionParameters> gatherMetadata(Path metadataFile) {
        String suffix = suffix(metadataFile);
        if (!suffix.equals(".mdoc") && !suffix.equals(".xml")) {
            log.debug("Tomography metadata expected in an xml or mdoc file, not {}", metadataFile.getFileName());
            return Optional.empty();
        }
        if (!Files.isRegularFile(metadataFile)) {
            log.debug("Metadata file {} not found", metadataFile);
            return Optional.empty();
        }
        try {
            return suffix.equals(".xml") ? fromAcquisitionXml(metadataFile) : fromMdoc(metadataFile);
        } catch (MetadataParseException | IOException | RuntimeException e) {
            log.warn("Failed to gather metadata from {}: {}", metadataFile, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<DataCollectionParameters> fromAcquisitionXml(Path xml) throws MetadataParseException {
        XmlDocument doc = XmlDocument.parse(xml);
        if (!"Acquisition".equals(doc.rootName())) return Optional.empty();
        Optional<String> width = doc.text("Acquisition", "Info", "ImageSize", "Width");
        Optional<String> height = doc.text("Acquisition", "Info", "ImageSize", "Height");
        Optional<String> pixel = doc.text("Acquisition", "Info", "SensorPixelSize", "Height");
        if (width.isEmpty() || height.isEmpty() || pixel.isEmpty()) return Optional.empty();
        return Optional.of(DataCollectionParameters.builder()
                .experimentType("tomography")
                .voltage(300.0)
                .imageSizeX(Integer.parseInt(width.get()))
                .imageSizeY(Integer.parseInt(height.get()))
                .pixelSizeOnImage(Double.parseDouble(pixel.get()))
                .motionCorrBinning(1)
                .dosePerFrame(environment.parametersOrEmpty().getDosePerFrame())
                .manualTiltOffset(0)
                .source(sourceTag())
                .build());
    }

    private Optional<DataCollectionParameters> fromMdoc(Path path) throws IOException {
        MdocFile mdoc = MdocFile.read(path);
        Map<String, String> global = mdoc.getGlobal();
        Optional<Map<String, String>> first = mdoc.firstBlock();
        if (global.isEmpty() || first.isEmpty()) return Optional.empty();
        Map<String, String> block = first.get();

        String[] imageSize = MdocFile.values(global.get("ImageSize"));
        int magnification = Integer.parseInt(block.get("Magnification"));
        PixelSizePolicy.Geometry geometry = PixelSizePolicy.tomography(
                session.getMachineConfig(),
                session.isSuperres(),
                Integer.parseInt(block.getOrDefault("Binning", "1")),
                Double.parseDouble(global.get("PixelSpacing")),
                magnification,
                Integer.parseInt(imageSize[0]),
                Integer.parseInt(imageSize[1]));

        DataCollectionParameters.DataCollectionParametersBuilder b = DataCollectionParameters.builder()
                .experimentType("tomography")
                .acquisitionSoftware(software.key())
                .voltage(Double.parseDouble(global.get("Voltage")))
                .imageSizeX(geometry.getImageSizeX())
                .imageSizeY(geometry.getImageSizeY())
                .magnification(magnification)
                .pixelSizeOnImage(geometry.getPixelSize())
                .motionCorrBinning(geometry.getMotionCorrBinning())
                .gainRef("data/" + Year.now().getValue() + "/" + session.getVisit() + "/processing/gain.mrc")
                .dosePerFrame(environment.parametersOrEmpty().getDosePerFrame())
                .manualTiltOffset(-TiltAngles.midpoint(mdoc.tiltAngles()))
                .source(sourceTag());

        Optional.ofNullable(block.get("ExposureTime")).map(Double::parseDouble).ifPresent(b::exposureTime);
        Optional.ofNullable(block.get("RotationAngle")).map(Double::parseDouble).ifPresent(b::tiltAxis);
        Optional.ofNullable(block.get("NumSubFrames")).map(Integer::parseInt).ifPresent(b::frameCount);
        String slit = block.get("FilterSlitAndLoss");
        if (slit != null) {
            b.slitWidth(Double.parseDouble(MdocFile.values(slit)[0]));
        }
        String subFramePath = block.get("SubFramePath");
        if (subFramePath != null && subFramePath.contains(".")) {
            String extension = subFramePath.substring(subFramePath.lastIndexOf('.'));
            b.fileExtension(extension);
            if (extension.equals(".eer") && block.get("NumSubFrames") != null) {
                b.numEerFrames(Integer.parseInt(block.get("NumSubFrames")));
            }
        }
        return Optional.of(b.build());
    }

    private String sourceTag() {
        return environment.getSource().toString();
    }

    Map<String, TiltSeries> getTiltSeries() {
        return tiltSeries;
    }

    static String suffix(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
