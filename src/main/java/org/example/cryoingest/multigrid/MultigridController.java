package org.example.cryoingest.multigrid;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.analysis.Analyser;
import org.example.cryoingest.context.Context;
import org.example.cryoingest.context.SessionEnvironment;
import org.example.cryoingest.context.SourceEnvironment;
import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.MachineConfig;
import org.example.cryoingest.controlplane.model.DataCollectionGroupRequest;
import org.example.cryoingest.controlplane.model.DataCollectionRequest;
import org.example.cryoingest.controlplane.model.EerFractionationRequest;
import org.example.cryoingest.controlplane.model.ProcessingJobRequest;
import org.example.cryoingest.controlplane.model.RsyncerInfo;
import org.example.cryoingest.controlplane.model.TransferCountUpdate;
import org.example.cryoingest.model.AcquisitionSoftware;
import org.example.cryoingest.model.DataCollectionParameters;
import org.example.cryoingest.model.ProcessingParameters;
import org.example.cryoingest.model.SampleInfo;
import org.example.cryoingest.model.TransferOutcome;
import org.example.cryoingest.model.WatchedFile;
import org.example.cryoingest.transfer.FileCopier;
import org.example.cryoingest.transfer.LocalCopier;
import org.example.cryoingest.transfer.RsyncCopier;
import org.example.cryoingest.transfer.TransferEngine;
import org.example.cryoingest.watcher.DirWatcher;
import org.example.cryoingest.watcher.MultigridDirWatcher;
import org.example.cryoingest.watcher.SourceAnnouncement;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one (watcher, transfer engine, analyser) pipeline per source directory of a
 * session and manages their joint lifecycle. Pipelines share nothing but the
 * {@link SessionEnvironment}; bookkeeping maps are guarded by this object's lock.
 */
@Slf4j
public class MultigridController {

    static final List<String> SPA_RECIPES = List.of(
            "em-spa-preprocess", "em-spa-extract", "em-spa-class2d", "em-spa-class3d", "em-spa-refine");
    static final String TOMO_EER_FRACTIONATION_FILE = "eer_fractionation_tomo.txt";
    private static final Set<String> DATA_SUFFIXES = Set.of(".mrc", ".tiff", ".tif", ".eer");

    private final SessionEnvironment session;
    private final ControlPlaneClient client;
    private final MachineConfig machineConfig;
    private final PipelineSettings settings;
    private final Map<Path, String> destinationOverrides;
    private final Duration serverTimeOffset;

    private final Map<Path, TransferEngine> transferEngines = new LinkedHashMap<>();
    private final Map<Path, Analyser> analysers = new LinkedHashMap<>();
    private final Map<Path, DirWatcher> watchers = new LinkedHashMap<>();
    private final Map<String, String> destinationRegistry = new ConcurrentHashMap<>();
    private final Set<Path> retried = ConcurrentHashMap.newKeySet();

    private MultigridDirWatcher multigridWatcher;
    private volatile ProcessingParameters processingParameters;
    private volatile Instant visitEndTime;
    private volatile boolean multigridWatcherActive = true;
    @Getter
    private volatile boolean dormant;

    public MultigridController(SessionEnvironment session,
                               PipelineSettings settings,
                               ProcessingParameters processingParameters,
                               Instant visitEndTime,
                               Map<Path, String> destinationOverrides) {
        this.session = session;
        this.client = session.getClient();
        this.machineConfig = session.getMachineConfig();
        this.settings = settings;
        this.processingParameters = processingParameters;
        this.destinationOverrides = destinationOverrides == null ? Map.of() : Map.copyOf(destinationOverrides);
        this.serverTimeOffset = client.currentTimestamp()
                .map(server -> Duration.between(server, Instant.now()))
                .orElse(Duration.ZERO);
        this.visitEndTime = visitEndTime == null ? null : visitEndTime.plus(serverTimeOffset);
        session.setSuperres(machineConfig.isSuperres());
    }

    public long getSessionId() {
        return session.getSessionId();
    }

    /**
     * Creates the multigrid watcher for the session directory together with the
     * directories the instrument expects to exist in it.
     */
    public synchronized void setupMultigridWatcher(Path sessionDirectory, boolean skipExistingProcessing)
            throws IOException {
        if (multigridWatcher != null) return;
        Files.createDirectories(sessionDirectory);
        for (String d : machineConfig.getCreateDirectories()) {
            Files.createDirectories(sessionDirectory.resolve(d));
        }
        multigridWatcher = new MultigridDirWatcher(sessionDirectory, machineConfig, skipExistingProcessing,
                settings.getMultigridScanIntervalSeconds());
        multigridWatcher.subscribe(this::startPipeline);
        multigridWatcher.onFinal(this::multigridWatcherFinalised);
    }

    public synchronized boolean startMultigridWatcher(boolean process) {
        if (multigridWatcher == null) return false;
        if (!process) multigridWatcher.setAnalyse(false);
        multigridWatcher.start();
        return true;
    }

    public synchronized void stopMultigridWatcher() {
        if (multigridWatcher != null) multigridWatcher.requestStop();
    }

    private void multigridWatcherFinalised() {
        multigridWatcherActive = false;
        dormancyCheck();
    }

    public void setProcessingParameters(ProcessingParameters processingParameters) {
        this.processingParameters = processingParameters;
        for (SourceEnvironment env : session.getSources().values()) {
            env.setParameters(env.parametersOrEmpty().withProcessingParameters(processingParameters));
        }
    }

    /**
     * Sets the visit end time, given in control-plane time, on every transfer engine.
     */
    public synchronized void updateVisitEndTime(Instant serverEndTime) {
        visitEndTime = serverEndTime.plus(serverTimeOffset);
        for (TransferEngine engine : transferEngines.values()) {
            engine.setEndTime(visitEndTime);
        }
    }

    Instant getVisitEndTime() {
        return visitEndTime;
    }

    /**
     * Builds and starts the pipeline of one announced source.
     */
    public synchronized void startPipeline(SourceAnnouncement announcement) {
        Path source = announcement.getSource().toAbsolutePath();
        if (watchers.containsKey(source)) {
            log.debug("Pipeline for {} already exists", source);
            return;
        }
        log.info("Starting multigrid rsyncer: {}", source);
        log.debug("Analysis of {} is {}", source, announcement.isAnalyse() ? "enabled" : "disabled");

        String destination = destinationFor(announcement);
        SourceEnvironment env = session.addSource(source, destination);
        env.setParameters(env.parametersOrEmpty().withProcessingParameters(processingParameters));
        boolean transfer = machineConfig.isDataTransferEnabled();

        TransferEngine engine = null;
        if (transfer) {
            client.makeRsyncerDestination(session.getSessionId(), destination);
            engine = new TransferEngine(source, copierFor(destination), TransferEngine.Options.builder()
                    .doTransfer(settings.isDoTransfer())
                    .removeFiles(announcement.isRemoveFiles())
                    .requiredSubstringsForRemoval(machineConfig.allRequiredSubstrings())
                    .endTime(visitEndTime)
                    .batchSize(settings.getBatchSize())
                    .maxBackoffSeconds(settings.getMaxBackoffSeconds())
                    .build());
            TransferEngine e = engine;
            engine.subscribe(outcome -> retryFailure(e, outcome));
            engine.subscribeToBatches((outcomes, skipped) -> transferredFiles(source, destination, outcomes));
            engine.setStopCallback(this::rsyncerStopped);
            transferEngines.put(source, engine);
            client.registerRsyncer(session.getSessionId(), RsyncerInfo.builder()
                    .source(source.toString())
                    .destination(destination)
                    .sessionId(session.getSessionId())
                    .transferring(settings.isDoTransfer())
                    .tag(announcement.getTag())
                    .build());
        }

        DirWatcher watcher = new DirWatcher(source, settings.getSettlingSeconds(),
                settings.getScanIntervalSeconds(), null, true, Set.of());
        watchers.put(source, watcher);

        Analyser analyser = null;
        if (announcement.isAnalyse()) {
            log.info("Starting analyser for {}", source);
            analyser = new Analyser(source, env, announcement.isLimited());
            Analyser a = analyser;
            analyser.subscribe(form -> dataCollectionForm(env, a, form));
            analyser.onFinal(this::dormancyCheck);
            analysers.put(source, analyser);
            analyser.start();
            if (engine != null) engine.subscribe(analyser::enqueue);
        }

        if (engine != null) {
            engine.start();
            TransferEngine e = engine;
            watcher.subscribe(file -> e.enqueue(file.getPath()));
        } else if (analyser != null) {
            Analyser a = analyser;
            watcher.subscribe(file -> a.enqueue(TransferOutcome.untransferred(source, file.getPath())));
        }
        watcher.subscribeToScans(files -> fileCount(source, destination, files));
        watcher.onFinal(this::dormancyCheck);
        watcher.start();
    }

    /**
     * Destination of a source relative to the rsync base path.
     */
    String destinationFor(SourceAnnouncement announcement) {
        Path source = announcement.getSource().toAbsolutePath();
        String extra = announcement.getExtraDirectory() == null ? "" : announcement.getExtraDirectory();
        String override = destinationOverrides.get(source);
        if (override != null) return join(override, extra);

        String year = String.valueOf(Year.now().getValue());
        String visit = session.getVisit();
        for (String dd : machineConfig.getDataDirectories()) {
            Path base = Path.of(dd).toAbsolutePath();
            if (source.equals(base)) return join(year + "/" + visit, extra);
            if (!source.startsWith(base)) continue;
            Path mid = base.relativize(source);
            if (!announcement.isUseSuggestedPath()) {
                return join(year + "/" + visit + "/" + toPosix(mid), extra);
            }
            String sourceName = source.getFileName().toString().equals("Images-Disc1")
                    ? source.getParent().getFileName().toString()
                    : source.getFileName().toString();
            String suggested = destinationRegistry.computeIfAbsent(sourceName, name -> {
                String midParent = mid.getParent() == null ? "" : toPosix(mid.getParent());
                return client.suggestPath(session.getSessionId(), visit,
                                year + "/" + visit + "/" + midParent + "/raw", true, "")
                        .filter(s -> !s.isBlank())
                        .orElse(year + "/" + visit + "/" + toPosix(mid));
            });
            return join(suggested, extra);
        }
        return join(year + "/" + visit + "/" + source.getFileName(), extra);
    }

    private FileCopier copierFor(String destination) {
        if (settings.getTransferMode() == PipelineSettings.TransferMode.LOCAL) {
            return new LocalCopier(settings.getLocalRoot().resolve(destination));
        }
        String host = settings.getDefaultRsyncHost();
        String rsyncUrl = machineConfig.getRsyncUrl();
        if (rsyncUrl != null && !rsyncUrl.isBlank()) {
            String parsed = URI.create(rsyncUrl).getHost();
            host = parsed == null ? rsyncUrl : parsed;
        }
        return RsyncCopier.forDaemon(host, machineConfig.getRsyncModule(), destination);
    }

    void retryFailure(TransferEngine engine, TransferOutcome outcome) {
        if (outcome.isSuccess()) {
            retried.remove(outcome.absolutePath());
            return;
        }
        if (retried.add(outcome.absolutePath())) {
            log.warn("Failed to transfer file {}, queueing it again", outcome.getFilePath());
            engine.enqueue(outcome.getFilePath());
        } else {
            log.warn("Failed to transfer file {} again, leaving it in place", outcome.getFilePath());
        }
    }

    private boolean isDataFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String suffix = dot < 0 ? "" : name.substring(dot);
        return DATA_SUFFIXES.contains(suffix)
                && machineConfig.allRequiredSubstrings().stream().anyMatch(name::contains);
    }

    private void fileCount(Path source, String destination, List<WatchedFile> files) {
        if (files.isEmpty()) return;
        int data = (int) files.stream().filter(f -> isDataFile(f.getPath())).count();
        client.incrementFileCount(session.getVisit(), TransferCountUpdate.builder()
                .source(source.toString())
                .destination(destination)
                .sessionId(session.getSessionId())
                .incrementCount(files.size())
                .incrementDataCount(data)
                .build());
    }

    private void transferredFiles(Path source, String destination, List<TransferOutcome> outcomes) {
        if (outcomes.isEmpty()) return;
        long bytes = 0;
        long dataBytes = 0;
        int data = 0;
        for (TransferOutcome o : outcomes) {
            bytes += o.getFileSize();
            if (isDataFile(o.getFilePath())) {
                data++;
                dataBytes += o.getFileSize();
            }
        }
        client.incrementTransferredFiles(session.getVisit(), TransferCountUpdate.builder()
                .source(source.toString())
                .destination(destination)
                .sessionId(session.getSessionId())
                .incrementCount(outcomes.size())
                .bytes(bytes)
                .incrementDataCount(data)
                .dataBytes(dataBytes)
                .build());
    }

    private void rsyncerStopped(Path source, boolean explicitStop) {
        if (explicitStop) {
            client.deleteRsyncer(session.getSessionId(), source.toString());
        } else {
            client.registerStoppedRsyncer(session.getSessionId(), source.toString());
        }
    }

    /**
     * Starts the data collection of a source from the parameters its analyser
     * harvested. Runs on the analyser thread before held files are replayed.
     */
    void dataCollectionForm(SourceEnvironment env, Analyser analyser, DataCollectionParameters form) {
        DataCollectionParameters parameters = form.withProcessingParameters(processingParameters);
        env.setParameters(parameters);
        String source = env.getSource().toString();
        String imageDirectory = env.transferredPath(env.getSource()).toString();
        long sid = session.getSessionId();
        String visit = session.getVisit();

        boolean spa = AcquisitionSoftware.EPU.key().equals(parameters.getAcquisitionSoftware());
        if (spa) {
            Optional<SampleInfo> sample = session.sampleFor(env.getSource());
            client.registerDataCollectionGroup(sid, visit, DataCollectionGroupRequest.builder()
                    .experimentType("single particle")
                    .experimentTypeId(37)
                    .tag(source)
                    .atlas(sample.map(s -> s.getAtlas().toString()).orElse(""))
                    .sample(sample.map(SampleInfo::getSample).orElse(null))
                    .build());
            client.startDataCollection(sid, visit, DataCollectionRequest.builder()
                    .experimentType(parameters.getExperimentType())
                    .fileExtension(parameters.getFileExtension())
                    .acquisitionSoftware(parameters.getAcquisitionSoftware())
                    .imageDirectory(imageDirectory)
                    .tag(source)
                    .source(source)
                    .voltage(parameters.getVoltage())
                    .pixelSizeOnImage(parameters.getPixelSizeOnImage())
                    .imageSizeX(parameters.getImageSizeX())
                    .imageSizeY(parameters.getImageSizeY())
                    .magnification(parameters.getMagnification())
                    .totalExposedDose(parameters.getTotalExposedDose())
                    .c2aperture(parameters.getC2aperture())
                    .exposureTime(parameters.getExposureTime())
                    .slitWidth(parameters.getSlitWidth())
                    .phasePlate(Boolean.TRUE.equals(parameters.getPhasePlate()))
                    .build());
            for (String recipe : SPA_RECIPES) {
                client.registerProcessingRecipe(sid, visit, new ProcessingJobRequest(source, source, recipe));
            }
            log.info("Posting SPA processing parameters for {}", source);
            client.registerSpaProcessingParameters(sid, source, parameters);
            client.flushSpaProcessing(sid, visit, source);
            return;
        }

        Context context = analyser.getContext();
        if (context != null) context.parametersConfirmed(imageDirectory);
        log.info("Registering tomography processing parameters for {}", source);
        if (parameters.getNumEerFrames() != null) {
            client.writeEerFractionationFile(sid, visit, EerFractionationRequest.builder()
                            .numFrames(parameters.getNumEerFrames())
                            .fractionation(parameters.getEerFractionation())
                            .dosePerFrame(parameters.getDosePerFrame())
                            .fractionationFileName(TOMO_EER_FRACTIONATION_FILE)
                            .build())
                    .ifPresent(env::setEerFractionationFile);
        }
        client.registerTomographyProcessingParameters(sid, parameters);
        client.flushTomographyProcessing(sid, visit, source);
        log.info("Tomography processing flushed for {}", source);
    }

    public synchronized void stopRsyncer(Path source) {
        engine(source).requestStop();
    }

    /**
     * Stops the watcher and transfer engine of a source; the control plane forgets it.
     */
    public synchronized void removeRsyncer(Path source) {
        Path key = source.toAbsolutePath();
        DirWatcher watcher = watchers.get(key);
        if (watcher != null) watcher.requestStop();
        engine(key).requestStop();
    }

    public synchronized void restartRsyncer(Path source) {
        engine(source).restart();
        client.registerRestartedRsyncer(session.getSessionId(), source.toString());
    }

    public synchronized void flushSkipped(Path source) {
        engine(source).flushSkipped();
    }

    /**
     * Transfers whatever is left in a source, removing it there, on a separate thread.
     */
    public synchronized void finaliseRsyncer(Path source) {
        TransferEngine engine = engine(source);
        Thread finaliser = new Thread(() -> engine.finalise(this::dormancyCheck),
                "Controller finaliser thread (" + source + ")");
        finaliser.setDaemon(true);
        finaliser.start();
    }

    /**
     * Stops every pipeline of the session, then finalises each transfer engine.
     */
    public synchronized void finalise() {
        stopMultigridWatcher();
        for (Analyser a : analysers.values()) a.requestStop();
        for (DirWatcher w : watchers.values()) w.requestStop();
        for (Path source : transferEngines.keySet()) finaliseRsyncer(source);
    }

    /**
     * Stops every pipeline without the final directory walk.
     */
    public synchronized void abandon() {
        for (Analyser a : analysers.values()) a.requestStop();
        for (DirWatcher w : watchers.values()) w.requestStop();
        for (TransferEngine e : transferEngines.values()) e.requestStop();
    }

    /**
     * Once the multigrid watcher has ended, every transfer engine is finalised and no
     * pipeline thread is running any more, the session is removed from the control
     * plane. Happens at most once.
     */
    public synchronized void dormancyCheck() {
        if (multigridWatcherActive || dormant) return;
        boolean finalised = transferEngines.values().stream().allMatch(TransferEngine::isFinalised);
        boolean analysing = analysers.values().stream().anyMatch(a -> a.isAlive() && !a.isStopping());
        boolean watching = watchers.values().stream().anyMatch(w -> w.isAlive() && !w.isStopping());
        if (!finalised || analysing || watching) return;

        dormant = true;
        Thread removal = new Thread(() -> {
            if (!client.removeSession(session.getSessionId())) {
                log.warn("Could not delete database data for {}", session.getSessionId());
            }
        }, "Session deletion thread " + session.getSessionId());
        removal.setDaemon(true);
        removal.start();
    }

    public synchronized Map<Path, TransferEngine> getTransferEngines() {
        return Map.copyOf(transferEngines);
    }

    public synchronized Map<Path, Analyser> getAnalysers() {
        return Map.copyOf(analysers);
    }

    synchronized Map<Path, DirWatcher> getWatchers() {
        return Map.copyOf(watchers);
    }

    private TransferEngine engine(Path source) {
        TransferEngine engine = transferEngines.get(source.toAbsolutePath());
        if (engine == null) {
            throw new IllegalArgumentException("No rsyncer for " + source);
        }
        return engine;
    }

    private static String join(String base, String extra) {
        return extra.isEmpty() ? base : base + "/" + extra;
    }

    private static String toPosix(Path p) {
        return p.toString().replace('\\', '/');
    }
}
