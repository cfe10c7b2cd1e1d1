package org.example.cryoingest.watcher;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.model.WatchedFile;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Polls a directory tree and announces files once they have settled: a file is
 * emitted after its size and modification time have stayed the same for at least
 * the settling time. Each path is emitted at most once while it stays unchanged.
 */
@Slf4j
public class DirWatcher {

    private final Path basepath;
    private final long settlingMillis;
    private final long scanIntervalMillis;
    private final Long appearanceCutoffMillis;
    private final boolean transferAll;
    private final Set<String> blacklist;
    private final LongSupplier clock;
    private final long initMillis;

    private final List<Consumer<WatchedFile>> fileListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<WatchedFile>>> scanListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> finalListeners = new CopyOnWriteArrayList<>();

    private Map<Path, FileInfo> lastScan = new HashMap<>();
    private final Map<Path, FileInfo> candidates = new HashMap<>();

    private final Thread thread;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    @Getter
    private volatile boolean stopping;

    public DirWatcher(Path basepath, long settlingSeconds, long scanIntervalSeconds,
                      Double appearanceHours, boolean transferAll, Set<String> blacklist) {
        this(basepath, settlingSeconds * 1000, scanIntervalSeconds * 1000, appearanceHours, transferAll,
                blacklist, System::currentTimeMillis);
    }

    DirWatcher(Path basepath, long settlingMillis, long scanIntervalMillis, Double appearanceHours,
               boolean transferAll, Set<String> blacklist, LongSupplier clock) {
        this.basepath = basepath;
        this.settlingMillis = settlingMillis;
        this.scanIntervalMillis = scanIntervalMillis;
        this.transferAll = transferAll;
        this.blacklist = blacklist;
        this.clock = clock;
        this.initMillis = clock.getAsLong();
        this.appearanceCutoffMillis = appearanceHours != null && appearanceHours > 0
                ? initMillis - (long) (appearanceHours * 3_600_000)
                : null;
        this.thread = new Thread(this::process, "DirWatcher " + basepath);
        this.thread.setDaemon(true);
    }

    public void subscribe(Consumer<WatchedFile> listener) {
        fileListeners.add(listener);
    }

    /**
     * Receives the files emitted by each scan, once per scan.
     */
    public void subscribeToScans(Consumer<List<WatchedFile>> listener) {
        scanListeners.add(listener);
    }

    public void onFinal(Runnable listener) {
        finalListeners.add(listener);
    }

    public Path getBasepath() {
        return basepath;
    }

    public void start() {
        if (thread.isAlive()) {
            throw new IllegalStateException("DirWatcher already running");
        }
        if (stopping) {
            throw new IllegalStateException("DirWatcher has already stopped");
        }
        log.info("DirWatcher thread starting for {}", basepath);
        thread.start();
    }

    public void requestStop() {
        stopping = true;
        stopSignal.countDown();
    }

    public void stop() {
        log.debug("DirWatcher thread stop requested for {}", basepath);
        requestStop();
        if (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("DirWatcher thread stop completed for {}", basepath);
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    private void process() {
        try {
            while (!stopping) {
                scan();
                if (stopSignal.await(scanIntervalMillis, TimeUnit.MILLISECONDS)) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finalListeners.forEach(Runnable::run);
            log.info("DirWatcher thread finished for {}", basepath);
        }
    }

    /**
     * Runs one scan and returns the files it emitted.
     */
    public synchronized List<WatchedFile> scan() {
        List<WatchedFile> emitted = new ArrayList<>();
        Map<Path, FileInfo> fileList;
        try {
            fileList = scanDirectory(basepath, appearanceCutoffMillis);
        } catch (IOException e) {
            log.error("Could not scan {}: {}", basepath, e.getMessage());
            return emitted;
        }
        long scanCompletion = clock.getAsLong();

        for (Map.Entry<Path, FileInfo> e : fileList.entrySet()) {
            if (!e.getValue().equals(lastScan.get(e.getKey()))) {
                candidates.put(e.getKey(), e.getValue().settledFrom(scanCompletion));
            }
        }

        for (Path candidate : orderedCandidates()) {
            if (!fileList.containsKey(candidate)) {
                log.info("Previously seen file {} has disappeared", candidate);
                candidates.remove(candidate);
                continue;
            }
            FileInfo info = candidates.get(candidate);
            if (info.settlingSince + settlingMillis > clock.getAsLong()) continue;
            FileInfo now = fileList.get(candidate);
            if (now.size != info.size || now.modifiedMillis > info.modifiedMillis) continue;

            candidates.remove(candidate);
            if (!transferAll && appearanceCutoffMillis == null && now.modifiedMillis < initMillis) {
                log.debug("Skipping {} as it predates the watcher", candidate.getFileName());
                continue;
            }
            WatchedFile settled = new WatchedFile(candidate, now.size, now.modifiedMillis);
            if (readyForTransfer(settled)) {
                emitted.add(settled);
            }
        }

        List<WatchedFile> scanResult = List.copyOf(emitted);
        scanListeners.forEach(l -> l.accept(scanResult));
        lastScan = fileList;
        return scanResult;
    }

    /**
     * Candidates by modification time, with mdoc files first so that tilt series
     * lengths are known before their movies arrive.
     */
    private List<Path> orderedCandidates() {
        List<Path> byTime = new ArrayList<>(candidates.keySet());
        byTime.sort(Comparator.comparingLong(p -> candidates.get(p).modifiedMillis));
        List<Path> ordered = new ArrayList<>();
        for (Path p : byTime) {
            if (p.getFileName().toString().endsWith(".mdoc")) ordered.add(0, p);
            else ordered.add(p);
        }
        return ordered;
    }

    private boolean readyForTransfer(WatchedFile file) {
        String name = file.getPath().getFileName().toString();
        if (name.startsWith(".") || name.endsWith("downloading")) return false;
        log.debug("File {} is ready to be transferred", name);
        fileListeners.forEach(l -> l.accept(file));
        return true;
    }

    private Map<Path, FileInfo> scanDirectory(Path directory, Long modifiedAfter) throws IOException {
        Map<Path, FileInfo> result = new LinkedHashMap<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (isBlacklisted(entry)) continue;
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(entry, BasicFileAttributes.class);
                } catch (IOException e) {
                    // removed between listing and stat
                    continue;
                }
                long modified = Math.max(attrs.lastModifiedTime().toMillis(), attrs.creationTime().toMillis());
                if (attrs.isDirectory()) {
                    if (modifiedAfter == null || modified >= modifiedAfter) {
                        try {
                            result.putAll(scanDirectory(entry, null));
                        } catch (NoSuchFileException e) {
                            log.debug("Directory {} disappeared during scan", entry);
                        } catch (IOException e) {
                            log.warn("Could not scan {}: {}", entry, e.getMessage());
                        }
                    }
                } else if (modifiedAfter == null || modified >= modifiedAfter) {
                    result.put(entry, new FileInfo(attrs.size(), modified, 0));
                }
            }
        }
        return result;
    }

    private boolean isBlacklisted(Path entry) {
        String path = entry.toString();
        if (path.contains("textual")) return true;
        for (String b : blacklist) {
            if (path.contains(b)) return true;
        }
        return false;
    }

    private static final class FileInfo {
        final long size;
        final long modifiedMillis;
        final long settlingSince;

        FileInfo(long size, long modifiedMillis, long settlingSince) {
            this.size = size;
            this.modifiedMillis = modifiedMillis;
            this.settlingSince = settlingSince;
        }

        FileInfo settledFrom(long since) {
            return new FileInfo(size, modifiedMillis, since);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FileInfo)) return false;
            FileInfo other = (FileInfo) o;
            return size == other.size && modifiedMillis == other.modifiedMillis;
        }

        @Override
        public int hashCode() {
            return Objects.hash(size, modifiedMillis);
        }
    }
}
