package org.example.cryoingest.watcher;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.controlplane.MachineConfig;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Watches the top level of a session directory for new grids. Every grid has a
 * metadata directory below the visit and a data directory next to it; both are
 * announced once so that the controller can start a pipeline for each.
 */
@Slf4j
public class MultigridDirWatcher {

    private final Path basepath;
    private final MachineConfig machineConfig;
    private final boolean skipExistingProcessing;
    private final long scanIntervalMillis;

    private final List<Consumer<SourceAnnouncement>> listeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> finalListeners = new CopyOnWriteArrayList<>();
    private final Set<Path> seenDirectories = new HashSet<>();

    private volatile boolean analyse = true;
    private volatile boolean stopping;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Thread thread;

    public MultigridDirWatcher(Path basepath, MachineConfig machineConfig, boolean skipExistingProcessing,
                               long scanIntervalSeconds) {
        this.basepath = basepath;
        this.machineConfig = machineConfig;
        this.skipExistingProcessing = skipExistingProcessing;
        this.scanIntervalMillis = scanIntervalSeconds * 1000;
        this.thread = new Thread(this::process, "MultigridDirWatcher " + basepath);
        this.thread.setDaemon(true);
    }

    public void subscribe(Consumer<SourceAnnouncement> listener) {
        listeners.add(listener);
    }

    public void onFinal(Runnable listener) {
        finalListeners.add(listener);
    }

    public void setAnalyse(boolean analyse) {
        this.analyse = analyse;
    }

    public void start() {
        if (thread.isAlive()) {
            throw new IllegalStateException("MultigridDirWatcher already running");
        }
        log.info("MultigridDirWatcher thread starting for {}", basepath);
        thread.start();
    }

    public void requestStop() {
        stopping = true;
        stopSignal.countDown();
    }

    public void stop() {
        requestStop();
        if (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("MultigridDirWatcher thread stop completed");
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    private void process() {
        boolean firstLoop = true;
        try {
            while (!stopping) {
                scan(firstLoop);
                firstLoop = false;
                if (stopSignal.await(scanIntervalMillis, TimeUnit.MILLISECONDS)) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finalListeners.forEach(Runnable::run);
            log.info("MultigridDirWatcher thread finished for {}", basepath);
        }
    }

    /**
     * Looks at every directory below the session directory once.
     */
    synchronized void scan(boolean firstLoop) {
        for (Path d : list(basepath)) {
            if (!Files.isDirectory(d)) continue;
            String name = d.getFileName().toString();
            if (machineConfig.getCreateDirectories().contains(name)) {
                if (seenDirectories.add(d)) {
                    announce(SourceAnnouncement.builder()
                            .source(d)
                            .tag(SourceAnnouncement.ATLAS)
                            .useSuggestedPath(false)
                            .analyse(analyse && machineConfig.getAnalyseCreatedDirectories().contains(name))
                            .build());
                }
                continue;
            }
            List<Path> samples = new ArrayList<>();
            for (Path p : list(d)) {
                if (p.getFileName().toString().startsWith("Sample")) samples.add(p);
            }
            if (!samples.isEmpty()) {
                // multi-sample Tomo sessions keep one metadata directory per sample
                for (Path sample : samples) {
                    if (!containsMdoc(sample)) continue;
                    if (seenDirectories.add(sample)) {
                        announceMetadata(sample, "metadata_" + name + "_" + sample.getFileName());
                    }
                    handleFractions(d.getParent().getParent().resolve(name + "_" + sample.getFileName()), firstLoop);
                }
            } else {
                if (seenDirectories.add(d)) {
                    announceMetadata(d, "metadata_" + name);
                }
                Path parent = d.getParent();
                Path root = parent == null ? null : parent.getParent();
                if (root != null) {
                    handleFractions(root.resolve(name), firstLoop);
                }
            }
        }
    }

    private void announceMetadata(Path directory, String extraDirectory) {
        announce(SourceAnnouncement.builder()
                .source(directory)
                .tag(SourceAnnouncement.METADATA)
                .extraDirectory(extraDirectory)
                .analyse(analyse)
                .limited(true)
                .build());
    }

    private void handleFractions(Path directory, boolean firstLoop) {
        boolean analyseFractions = analyse && !(firstLoop && skipExistingProcessing);
        boolean processingStarted = false;
        for (Path disc : list(directory)) {
            if (!disc.getFileName().toString().startsWith("Images-Disc")) continue;
            if (seenDirectories.add(disc)) {
                announceFractions(disc, analyseFractions);
            }
            processingStarted = true;
        }
        if (!processingStarted && Files.isDirectory(directory) && !list(directory).isEmpty()
                && seenDirectories.add(directory)) {
            announceFractions(directory, analyseFractions);
        }
    }

    private void announceFractions(Path directory, boolean analyseFractions) {
        announce(SourceAnnouncement.builder()
                .source(directory)
                .tag(SourceAnnouncement.FRACTIONS)
                .removeFiles(true)
                .analyse(analyseFractions)
                .build());
    }

    private void announce(SourceAnnouncement announcement) {
        log.info("New source directory found: {} ({})", announcement.getSource(), announcement.getTag());
        for (Consumer<SourceAnnouncement> l : listeners) {
            try {
                l.accept(announcement);
            } catch (RuntimeException e) {
                log.error("Failed to set up source {}", announcement.getSource(), e);
            }
        }
    }

    private static boolean containsMdoc(Path directory) {
        try (Stream<Path> s = Files.list(directory)) {
            return s.anyMatch(p -> p.getFileName().toString().endsWith(".mdoc"));
        } catch (IOException e) {
            return false;
        }
    }

    private static List<Path> list(Path directory) {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(directory)) return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(directory)) {
            for (Path p : ds) out.add(p);
        } catch (IOException e) {
            log.warn("Could not list {}: {}", directory, e.getMessage());
        }
        out.sort(null);
        return out;
    }
}
