package org.example.cryoingest.transfer;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.model.TransferOutcome;
import org.example.cryoingest.model.TransferResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Moves files out of one source directory in batches.
 * <p>
 * A worker thread blocks for the first queued file, drains whatever else is queued
 * and hands the batch to a {@link FileCopier}. Every file of the batch produces one
 * {@link TransferOutcome} for the primary subscribers; secondary subscribers get the
 * successful outcomes of each batch together with the number of files skipped.
 */
@Slf4j
public class TransferEngine {

    public enum Status {
        READY, RUNNING, STOPPING, FINISHED;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    static final int QUEUE_CAPACITY = 100_000;
    private static final long DRAIN_POLL_MILLIS = 100;

    /** Wakes the worker without carrying a file. */
    private static final Path WAKE = Path.of("");

    @Getter
    @Builder
    public static class Options {
        @Builder.Default
        private final boolean doTransfer = true;
        private final boolean removeFiles;
        @Builder.Default
        private final List<String> requiredSubstringsForRemoval = List.of();
        @Builder.Default
        private final boolean notify = true;
        private final Instant endTime;
        @Builder.Default
        private final int batchSize = 100;
        @Builder.Default
        private final int maxBackoffSeconds = 120;
    }

    private final Path basepath;
    private final FileCopier copier;
    private final List<String> requiredSubstringsForRemoval;
    private final boolean doTransfer;
    private final int batchSize;
    private final int maxBackoffSeconds;

    private volatile boolean removeFiles;
    private volatile boolean notify;
    private volatile Instant endTime;

    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final AtomicInteger unfinished = new AtomicInteger();
    private final Object drained = new Object();
    private final List<Path> skippedFiles = new ArrayList<>();

    private final AtomicLong filesTransferred = new AtomicLong();
    private final AtomicLong bytesTransferred = new AtomicLong();
    private final AtomicInteger filesSkipped = new AtomicInteger();

    private final List<Consumer<TransferOutcome>> listeners = new CopyOnWriteArrayList<>();
    private final List<BiConsumer<List<TransferOutcome>, Integer>> batchListeners = new CopyOnWriteArrayList<>();
    private volatile BiConsumer<Path, Boolean> stopCallback = (path, explicit) -> { };

    private Thread thread;
    private volatile boolean stopping;
    private volatile boolean halt;
    @Getter
    private volatile boolean finalised;

    public TransferEngine(Path basepath, FileCopier copier, Options options) {
        this.basepath = basepath.toAbsolutePath();
        this.copier = copier;
        this.doTransfer = options.isDoTransfer();
        this.removeFiles = options.isRemoveFiles();
        this.requiredSubstringsForRemoval = List.copyOf(options.getRequiredSubstringsForRemoval());
        this.notify = options.isNotify();
        this.endTime = options.getEndTime();
        this.batchSize = options.getBatchSize();
        this.maxBackoffSeconds = options.getMaxBackoffSeconds();
        this.thread = newThread("RSync");
    }

    private Thread newThread(String prefix) {
        Thread t = new Thread(this::process, prefix + " " + basepath + ":" + copier.destination());
        t.setDaemon(true);
        return t;
    }

    public void subscribe(Consumer<TransferOutcome> listener) {
        listeners.add(listener);
    }

    public void subscribeToBatches(BiConsumer<List<TransferOutcome>, Integer> listener) {
        batchListeners.add(listener);
    }

    /**
     * Called when the worker exits with the base path and whether the exit was
     * requested.
     */
    public void setStopCallback(BiConsumer<Path, Boolean> stopCallback) {
        this.stopCallback = stopCallback;
    }

    public Path getBasepath() {
        return basepath;
    }

    public Status status() {
        if (stopping) {
            return thread.isAlive() ? Status.STOPPING : Status.FINISHED;
        }
        return thread.isAlive() ? Status.RUNNING : Status.READY;
    }

    public synchronized void start() {
        if (thread.isAlive()) {
            throw new IllegalStateException("Transfer engine already running");
        }
        if (stopping) {
            throw new IllegalStateException("Transfer engine has already stopped");
        }
        log.info("RSync thread starting for {} -> {}", basepath, copier.destination());
        thread.start();
    }

    /**
     * Starts a fresh worker after the previous one was stopped.
     *
     * @throws IllegalStateException if the worker was never asked to stop
     */
    public synchronized void restart() {
        if (thread.isAlive() && !halt) {
            throw new IllegalStateException("Transfer engine still running");
        }
        joinWorker();
        halt = false;
        stopping = false;
        thread = newThread("RSync");
        start();
    }

    /**
     * Waits for queued files to be transferred, then stops the worker.
     */
    public void stop() {
        log.debug("RSync thread stop requested for {}", basepath);
        stopping = true;
        if (thread.isAlive()) {
            log.info("Waiting for ongoing transfers to complete...");
            awaitDrained();
        }
        halt = true;
        if (thread.isAlive()) {
            queue.offer(WAKE);
            joinWorker();
        }
        log.debug("RSync thread stop completed for {}", basepath);
    }

    /**
     * Stops without waiting for the queue.
     */
    public void requestStop() {
        stopping = true;
        halt = true;
        queue.offer(WAKE);
    }

    /**
     * Stops the worker, then walks the source directory once more and transfers
     * everything still there with source removal enabled.
     */
    public void finalise(Runnable callback) {
        stop();
        removeFiles = true;
        notify = false;
        List<Path> remaining;
        try (Stream<Path> walk = Files.walk(basepath)) {
            remaining = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Could not walk {} for finalisation", basepath, e);
            remaining = List.of();
        }
        for (int i = 0; i < remaining.size(); i += batchSize) {
            transferBatch(remaining.subList(i, Math.min(i + batchSize, remaining.size())));
        }
        finalised = true;
        log.info("Finalised transfer of {}", basepath);
        if (callback != null) {
            callback.run();
        }
    }

    public void enqueue(Path file) {
        if (stopping) return;
        Path absolute = basepath.resolve(file);
        try {
            unfinished.incrementAndGet();
            queue.put(absolute);
        } catch (InterruptedException e) {
            unfinished.decrementAndGet();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Queues again the files held back by the visit end time.
     */
    public void flushSkipped() {
        List<Path> flush;
        synchronized (skippedFiles) {
            flush = new ArrayList<>(skippedFiles);
            skippedFiles.clear();
        }
        for (Path f : flush) {
            unfinished.incrementAndGet();
            if (!queue.offer(f)) {
                unfinished.decrementAndGet();
                log.warn("Queue full, could not flush {}", f);
            }
        }
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public int queueSize() {
        return Math.max(unfinished.get(), 0);
    }

    public long getFilesTransferred() {
        return filesTransferred.get();
    }

    public long getBytesTransferred() {
        return bytesTransferred.get();
    }

    public int getFilesSkipped() {
        return filesSkipped.get();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public boolean isStopping() {
        return stopping;
    }

    private void process() {
        log.info("RSync thread started for {}", basepath);
        int backoff = 0;
        while (!halt) {
            Path first;
            try {
                first = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (first == WAKE) continue;

            List<Path> batch = new ArrayList<>();
            if (!first.getFileName().toString().startsWith(".")) batch.add(first);
            int taken = 1;
            try {
                while (batch.size() <= batchSize) {
                    Path next = queue.poll(DRAIN_POLL_MILLIS, TimeUnit.MILLISECONDS);
                    if (next == null) break;
                    if (next == WAKE) {
                        queue.offer(WAKE);
                        break;
                    }
                    taken++;
                    if (!next.getFileName().toString().startsWith(".")) batch.add(next);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                halt = true;
            }

            log.info("Preparing to transfer {} files", batch.size());
            boolean success;
            try {
                success = doTransfer ? transferBatch(batch) : fakeTransfer(batch);
            } catch (RuntimeException e) {
                log.error("Unhandled exception in RSync thread", e);
                success = false;
            }
            log.info("Completed transfer of {} files", batch.size());
            taskDone(taken);

            if (success) {
                backoff = 0;
            } else if (!halt) {
                backoff = Math.min(backoff * 2 + 1, maxBackoffSeconds);
                log.info("Waiting {} seconds before next rsync attempt", backoff);
                try {
                    TimeUnit.SECONDS.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        stopCallback.accept(basepath, stopping);
        log.info("RSync thread finished for {}", basepath);
    }

    private void taskDone(int n) {
        if (unfinished.addAndGet(-n) <= 0) {
            synchronized (drained) {
                drained.notifyAll();
            }
        }
    }

    private void awaitDrained() {
        synchronized (drained) {
            while (unfinished.get() > 0 && thread.isAlive()) {
                try {
                    drained.wait(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void joinWorker() {
        if (thread == Thread.currentThread()) return;
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean fakeTransfer(List<Path> files) {
        Set<Path> relative = new LinkedHashSet<>();
        for (Path f : files) relative.add(relativize(f));
        long total = 0;
        for (Path f : relative) {
            filesTransferred.incrementAndGet();
            TransferOutcome outcome = outcome(f, 0, TransferResult.SUCCESS, ++total);
            emit(outcome);
            emitBatch(List.of(outcome), 0);
        }
        return true;
    }

    /**
     * Copies one batch and reports every file in it.
     *
     * @return whether every file was copied
     */
    boolean transferBatch(List<Path> infiles) {
        List<Path> files = new ArrayList<>();
        int skipped = 0;
        Instant cutoff = endTime;
        for (Path f : infiles) {
            if (!Files.isRegularFile(f)) continue;
            if (cutoff != null && !changedBefore(f, cutoff)) {
                synchronized (skippedFiles) {
                    skippedFiles.add(f);
                }
                skipped++;
                continue;
            }
            files.add(f);
        }
        filesSkipped.addAndGet(skipped);

        Set<Path> relative = new LinkedHashSet<>();
        for (Path f : files) relative.add(relativize(f));

        List<Path> keep = new ArrayList<>();
        List<Path> remove = new ArrayList<>();
        for (Path f : relative) {
            if (!removeFiles) {
                keep.add(f);
            } else if (requiredSubstringsForRemoval.isEmpty()
                    || requiredSubstringsForRemoval.stream().anyMatch(s -> f.getFileName().toString().contains(s))) {
                remove.add(f);
            } else {
                keep.add(f);
            }
        }

        CopyResult result;
        try {
            result = copier.copy(basepath, keep, false).and(copier.copy(basepath, remove, true));
        } catch (IOException e) {
            log.warn("Copy of {} files from {} failed: {}", relative.size(), basepath, e.getMessage());
            result = new CopyResult(Map.of(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = new CopyResult(Map.of(), false);
        } catch (RuntimeException e) {
            log.error("Copy of {} files from {} failed", relative.size(), basepath, e);
            result = new CopyResult(Map.of(), false);
        }

        long batchTotal = 0;
        List<TransferOutcome> successful = new ArrayList<>();
        for (Map.Entry<Path, Long> copied : result.getCopied().entrySet()) {
            filesTransferred.incrementAndGet();
            bytesTransferred.addAndGet(copied.getValue());
            TransferOutcome outcome = outcome(copied.getKey(), copied.getValue(), TransferResult.SUCCESS, ++batchTotal);
            emit(outcome);
            successful.add(outcome);
        }
        emitBatch(successful, skipped);

        boolean success = result.isClean();
        for (Path f : relative) {
            if (result.getCopied().containsKey(f)) continue;
            filesTransferred.incrementAndGet();
            emit(outcome(f, 0, TransferResult.FAILURE, filesTransferred.get()));
            success = false;
        }
        if (!success) {
            log.debug("Files identified for transfer ({}): {}", relative.size(), relative);
            log.debug("Files successfully transferred ({}): {}", result.getCopied().size(), result.getCopied().keySet());
        }
        return success;
    }

    private TransferOutcome outcome(Path relative, long size, TransferResult result, long total) {
        return TransferOutcome.builder()
                .filePath(relative)
                .basePath(basepath)
                .fileSize(size)
                .outcome(result)
                .transferTotal(total)
                .queueSize(queueSize())
                .build();
    }

    private Path relativize(Path file) {
        if (!file.startsWith(basepath)) {
            throw new IllegalArgumentException("File '" + file + "' is outside of " + basepath);
        }
        return basepath.relativize(file);
    }

    /**
     * Status change time where the file system exposes it, modification time otherwise.
     */
    private static boolean changedBefore(Path file, Instant cutoff) {
        try {
            FileTime changed;
            if (file.getFileSystem().supportedFileAttributeViews().contains("unix")) {
                changed = (FileTime) Files.getAttribute(file, "unix:ctime");
            } else {
                changed = Files.readAttributes(file, BasicFileAttributes.class).lastModifiedTime();
            }
            return changed.toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.debug("Could not read change time of {}: {}", file, e.getMessage());
            return false;
        }
    }

    private void emit(TransferOutcome outcome) {
        if (!notify) return;
        for (Consumer<TransferOutcome> l : listeners) {
            l.accept(outcome);
        }
    }

    private void emitBatch(List<TransferOutcome> outcomes, int skipped) {
        if (!notify) return;
        for (BiConsumer<List<TransferOutcome>, Integer> l : batchListeners) {
            l.accept(outcomes, skipped);
        }
    }
}
