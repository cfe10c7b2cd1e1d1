package org.example.cryoingest.analysis;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.context.Context;
import org.example.cryoingest.context.SessionEnvironment;
import org.example.cryoingest.context.SourceEnvironment;
import org.example.cryoingest.context.SpaContext;
import org.example.cryoingest.context.SpaMetadataContext;
import org.example.cryoingest.context.TomographyContext;
import org.example.cryoingest.context.TomographyMetadataContext;
import org.example.cryoingest.context.UnknownSoftwareVersionException;
import org.example.cryoingest.metadata.MdocFile;
import org.example.cryoingest.model.AcquisitionSoftware;
import org.example.cryoingest.model.DataCollectionParameters;
import org.example.cryoingest.model.Role;
import org.example.cryoingest.model.TransferOutcome;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Single consumer of the transferred files of one source.
 * <p>
 * The first recognisable movie fixes the acquisition software and creates the
 * {@link Context}. Until acquisition parameters have been read from a metadata file
 * every file is held back; once they are known the data collection form is
 * published exactly once and the held files are replayed into the context in
 * arrival order. In limited mode, used for metadata sources, files are routed
 * straight to the SPA or tomography metadata context by their location.
 */
@Slf4j
public class Analyser {

    public enum State {
        UNDETERMINED, EXTENSION_KNOWN, CONTEXT_LOCKED
    }

    private static final Path STOP = Path.of("");

    private final Path basepath;
    private final SourceEnvironment environment;
    private final SessionEnvironment session;
    private final boolean limited;
    private final boolean forceMdocMetadata;

    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
    private final List<Consumer<DataCollectionParameters>> formListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> finalListeners = new CopyOnWriteArrayList<>();
    private final Thread thread;

    private volatile boolean stopping;
    private volatile boolean halt;

    // dispatcher thread only
    private State state = State.UNDETERMINED;
    private Context context;
    private SpaMetadataContext spaMetadataContext;
    private TomographyMetadataContext tomographyMetadataContext;
    private String extension = "";
    private Path pendingMdoc;
    private final List<Path> unseen = new ArrayList<>();
    private final Set<Path> attemptedMetadata = new HashSet<>();

    public Analyser(Path basepath, SourceEnvironment environment, boolean limited) {
        this.basepath = basepath.toAbsolutePath();
        this.environment = environment;
        this.session = environment.getSession();
        this.limited = limited;
        this.forceMdocMetadata = session.getMachineConfig().isForceMdocMetadata();
        this.thread = new Thread(this::analyse, "Analyser " + this.basepath);
        this.thread.setDaemon(true);
    }

    /**
     * Receives the harvested acquisition parameters once per source.
     */
    public void subscribe(Consumer<DataCollectionParameters> formListener) {
        formListeners.add(formListener);
    }

    public void onFinal(Runnable listener) {
        finalListeners.add(listener);
    }

    public void enqueue(TransferOutcome outcome) {
        if (stopping || !outcome.isSuccess()) return;
        queue.offer(basepath.resolve(outcome.getFilePath()).toAbsolutePath());
    }

    public synchronized void start() {
        if (thread.isAlive()) {
            throw new IllegalStateException("Analyser already running");
        }
        if (stopping) {
            throw new IllegalStateException("Analyser has already stopped");
        }
        log.info("Analyser thread starting for {}", basepath);
        thread.start();
    }

    public void requestStop() {
        stopping = true;
        halt = true;
        queue.offer(STOP);
    }

    public void stop() {
        log.debug("Analyser thread stop requested for {}", basepath);
        requestStop();
        if (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Analyser thread stop completed for {}", basepath);
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public boolean isStopping() {
        return stopping;
    }

    public int queueSize() {
        return queue.size();
    }

    public Path getBasepath() {
        return basepath;
    }

    private void analyse() {
        log.info("Analyser thread started for {}", basepath);
        while (!halt) {
            Path file;
            try {
                file = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (file == STOP) break;
            try {
                process(file);
            } catch (UnknownSoftwareVersionException e) {
                log.error("Cannot analyse {}: {}", file, e.getMessage());
            } catch (RuntimeException e) {
                log.error("An exception was encountered analysing {}", file, e);
            }
        }
        for (Runnable l : finalListeners) {
            l.run();
        }
        log.info("Analyser thread finished for {}", basepath);
    }

    void process(Path file) {
        if (limited) {
            routeLimited(file);
            return;
        }
        if (hasPart(file, "atlas")) {
            if (spaMetadataContext == null) {
                spaMetadataContext = new SpaMetadataContext(environment);
            }
            if (context == null) {
                context = spaMetadataContext;
                extension = FileClassifier.suffix(file);
                state = State.CONTEXT_LOCKED;
            }
            post(spaMetadataContext, file, Role.MICROSCOPE);
            return;
        }
        switch (state) {
            case UNDETERMINED:
                determine(file);
                break;
            case EXTENSION_KNOWN:
                hold(file);
                if (isMetadataFile(file)) {
                    if (FileClassifier.suffix(file).equals(".mdoc")) pendingMdoc = file;
                    attemptMetadata(file, true);
                } else {
                    attemptMetadata(file, false);
                }
                break;
            case CONTEXT_LOCKED:
                log.debug("Transferring file {} with context {}", file, context.name());
                post(context, file, Role.DETECTOR);
                break;
            default:
                throw new IllegalStateException("Unknown analyser state " + state);
        }
    }

    private void routeLimited(Path file) {
        String name = file.getFileName().toString();
        if (hasPart(file, "Metadata") || name.equals("EpuSession.dm") || hasPart(file, "atlas")) {
            if (spaMetadataContext == null) spaMetadataContext = new SpaMetadataContext(environment);
            context = spaMetadataContext;
        } else if (hasPart(file, "Batch") || hasPart(file, "SearchMaps") || name.equals("Session.dm")) {
            if (tomographyMetadataContext == null) {
                tomographyMetadataContext = new TomographyMetadataContext(environment);
            }
            context = tomographyMetadataContext;
        }
        if (context != null) {
            state = State.CONTEXT_LOCKED;
            post(context, file, Role.MICROSCOPE);
        }
    }

    private void determine(Path file) {
        if (!findExtension(file)) {
            log.debug("No extension found for {}", file);
            hold(file);
            return;
        }
        Optional<AcquisitionSoftware> software = FileClassifier.classify(file);
        if (software.isEmpty()) {
            log.debug("Couldn't find context for {}", file);
            hold(file);
            return;
        }
        log.info("Context found successfully for {}: acquisition software {}", file, software.get().key());
        context = software.get() == AcquisitionSoftware.EPU
                ? new SpaContext(environment)
                : new TomographyContext(software.get(), environment);
        state = State.EXTENSION_KNOWN;
        if (FileClassifier.suffix(file).equals(".mdoc")) pendingMdoc = file;

        try {
            context.postFirstTransfer(file, Role.DETECTOR);
        } catch (UnknownSoftwareVersionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Exception encountered in first transfer of {}", file, e);
        }
        attemptMetadata(file, isMetadataFile(file));
    }

    /**
     * Tries the metadata file belonging to {@code file}. Paths that were already tried
     * are only read again when the file itself is metadata that was just transferred.
     */
    private void attemptMetadata(Path file, boolean fresh) {
        Optional<Path> candidate = metadataCandidate(file);
        if (candidate.isEmpty()) return;
        Path metadata = candidate.get();
        if (!attemptedMetadata.add(metadata) && !fresh) return;

        Optional<DataCollectionParameters> found = context.gatherMetadata(metadata);
        if (found.isEmpty()) {
            log.debug("No acquisition parameters in {} yet", metadata);
            return;
        }
        lock(found.get());
    }

    private Optional<Path> metadataCandidate(Path file) {
        String suffix = FileClassifier.suffix(file);
        boolean tomography = context instanceof TomographyContext;
        if (suffix.equals(".mdoc")) return Optional.of(file);
        if (!tomography) {
            if (suffix.equals(".xml")) return Optional.of(file);
            return FileClassifier.DATA_SUFFIXES.contains(suffix) ? Optional.of(xmlFile(file)) : Optional.empty();
        }
        AcquisitionSoftware software = ((TomographyContext) context).getSoftware();
        if (pendingMdoc != null) return Optional.of(pendingMdoc);
        if (!FileClassifier.DATA_SUFFIXES.contains(suffix)) return Optional.empty();
        if (software == AcquisitionSoftware.SERIALEM) return Optional.of(FileClassifier.withSuffix(file, ".mdoc"));
        return forceMdocMetadata ? Optional.empty() : Optional.of(xmlFile(file));
    }

    private void lock(DataCollectionParameters metadata) {
        DataCollectionParameters.DataCollectionParametersBuilder form = metadata.toBuilder();
        if (metadata.getFileExtension() != null && !metadata.getFileExtension().isEmpty()) {
            extension = metadata.getFileExtension();
        } else {
            form.fileExtension(extension);
        }
        form.acquisitionSoftware(software().key());
        DataCollectionParameters published = form.build();

        state = State.CONTEXT_LOCKED;
        log.info("Acquisition parameters found for {} ({} files held back)", basepath, unseen.size());
        for (Consumer<DataCollectionParameters> l : formListeners) {
            try {
                l.accept(published);
            } catch (RuntimeException e) {
                log.error("Data collection form listener failed for {}", basepath, e);
            }
        }

        List<Path> replay = new ArrayList<>(unseen);
        unseen.clear();
        for (Path f : replay) {
            post(context, f, Role.DETECTOR);
        }
    }

    private AcquisitionSoftware software() {
        if (context instanceof TomographyContext) return ((TomographyContext) context).getSoftware();
        return AcquisitionSoftware.EPU;
    }

    private void post(Context target, Path file, Role role) {
        try {
            target.postTransfer(file, role);
        } catch (UnknownSoftwareVersionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("An exception was encountered post transfer of {}", file, e);
        }
    }

    private void hold(Path file) {
        unseen.add(file);
        if (unseen.size() % 1000 == 0) {
            log.warn("{} files in {} waiting for acquisition parameters", unseen.size(), basepath);
        }
    }

    private boolean findExtension(Path file) {
        String suffix = FileClassifier.suffix(file);
        if (FileClassifier.DATA_SUFFIXES.contains(suffix)) {
            if (!suffix.equals(extension)) {
                log.info("File extension determined: {}", suffix);
                extension = suffix;
            }
            return true;
        }
        if (suffix.equals(".mdoc")) {
            try {
                Optional<String> subFramePath = MdocFile.read(file).firstBlock()
                        .map(b -> b.get("SubFramePath"));
                if (subFramePath.isPresent() && subFramePath.get().contains(".")) {
                    String path = subFramePath.get().replace('\\', '/');
                    extension = path.substring(path.lastIndexOf('.'));
                    return true;
                }
            } catch (IOException e) {
                log.warn("Could not read mdoc {}: {}", file, e.getMessage());
            }
        }
        return false;
    }

    /**
     * The EPU movie metadata file, written below the visit directory under the same
     * relative path as the movie, named after the movie without its last name part.
     */
    Path xmlFile(Path dataFile) {
        String stem = stem(dataFile);
        int cut = stem.lastIndexOf('_');
        String name = (cut < 0 ? "" : stem.substring(0, cut)) + ".xml";
        for (String dd : session.getMachineConfig().getDataDirectories()) {
            Path base = Path.of(dd).toAbsolutePath();
            if (dataFile.startsWith(base)) {
                Path mid = base.relativize(dataFile).getParent();
                Path dir = base.resolve(session.getVisit());
                return (mid == null ? dir : dir.resolve(mid)).resolve(name);
            }
        }
        return FileClassifier.withSuffix(dataFile, ".xml");
    }

    private static boolean isMetadataFile(Path file) {
        String suffix = FileClassifier.suffix(file);
        return suffix.equals(".mdoc") || suffix.equals(".xml");
    }

    private static boolean hasPart(Path file, String part) {
        for (Path p : file) {
            if (p.toString().equals(part)) return true;
        }
        return false;
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    State getState() {
        return state;
    }

    public Context getContext() {
        return context;
    }

    String getExtension() {
        return extension;
    }
}
