package org.example.cryoingest.transfer;

import org.example.cryoingest.model.TransferOutcome;
import org.example.cryoingest.model.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TransferEngineTest {

    @TempDir
    Path source;

    @TempDir
    Path destination;

    private final List<TransferOutcome> outcomes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(source.resolve("grid1"));
        Files.writeString(source.resolve("grid1/movie_1_fractions.tiff"), "0123456789");
        Files.writeString(source.resolve("grid1/movie_1.xml"), "<xml/>");
    }

    private TransferEngine engine(TransferEngine.Options options) {
        TransferEngine engine = new TransferEngine(source, new LocalCopier(destination), options);
        engine.subscribe(outcomes::add);
        return engine;
    }

    @Test
    void transferBatch_copiesAndReportsEachFile() {
        TransferEngine engine = engine(TransferEngine.Options.builder().build());
        List<Integer> skippedPerBatch = new ArrayList<>();
        engine.subscribeToBatches((batch, skipped) -> skippedPerBatch.add(skipped));

        boolean ok = engine.transferBatch(List.of(
                source.resolve("grid1/movie_1_fractions.tiff"),
                source.resolve("grid1/movie_1.xml")));

        assertThat(ok).isTrue();
        assertThat(destination.resolve("grid1/movie_1_fractions.tiff")).hasContent("0123456789");
        assertThat(outcomes).extracting(TransferOutcome::getFilePath)
                .containsExactly(Path.of("grid1/movie_1_fractions.tiff"), Path.of("grid1/movie_1.xml"));
        assertThat(outcomes).allMatch(TransferOutcome::isSuccess);
        assertThat(outcomes.get(0).getFileSize()).isEqualTo(10);
        assertThat(skippedPerBatch).containsExactly(0);
        assertThat(engine.getFilesTransferred()).isEqualTo(2);
        assertThat(engine.getBytesTransferred()).isEqualTo(16);
        assertThat(source.resolve("grid1/movie_1_fractions.tiff")).exists();
    }

    @Test
    void transferBatch_removesOnlyFilesWithRequiredSubstring() {
        TransferEngine engine = engine(TransferEngine.Options.builder()
                .removeFiles(true)
                .requiredSubstringsForRemoval(List.of("fractions"))
                .build());

        engine.transferBatch(List.of(
                source.resolve("grid1/movie_1_fractions.tiff"),
                source.resolve("grid1/movie_1.xml")));

        assertThat(source.resolve("grid1/movie_1_fractions.tiff")).doesNotExist();
        assertThat(source.resolve("grid1/movie_1.xml")).exists();
        assertThat(destination.resolve("grid1/movie_1.xml")).exists();
    }

    @Test
    void transferBatch_holdsBackFilesChangedAfterEndTime() throws Exception {
        Thread.sleep(50);
        Instant endTime = Instant.now();
        Thread.sleep(50);
        Files.writeString(source.resolve("grid1/movie_2_fractions.tiff"), "late");
        TransferEngine engine = engine(TransferEngine.Options.builder().endTime(endTime).build());
        AtomicInteger skipped = new AtomicInteger();
        engine.subscribeToBatches((batch, n) -> skipped.addAndGet(n));

        engine.transferBatch(List.of(
                source.resolve("grid1/movie_2_fractions.tiff"),
                source.resolve("grid1/movie_1.xml")));

        assertThat(outcomes).extracting(TransferOutcome::getFilePath).containsExactly(Path.of("grid1/movie_1.xml"));
        assertThat(skipped).hasValue(1);
        assertThat(engine.getFilesSkipped()).isEqualTo(1);

        engine.flushSkipped();
        assertThat(engine.queueSize()).isEqualTo(1);
    }

    @Test
    void transferBatch_backdatedModificationTimeDoesNotReleaseFile() throws Exception {
        Path late = source.resolve("grid1/movie_2_fractions.tiff");
        assumeTrue(late.getFileSystem().supportedFileAttributeViews().contains("unix"));
        Thread.sleep(50);
        Instant endTime = Instant.now();
        Thread.sleep(50);
        Files.writeString(late, "late");
        Files.setLastModifiedTime(late, FileTime.from(endTime.minus(1, ChronoUnit.HOURS)));
        TransferEngine engine = engine(TransferEngine.Options.builder().endTime(endTime).build());

        engine.transferBatch(List.of(late));

        assertThat(outcomes).isEmpty();
        assertThat(engine.getFilesSkipped()).isEqualTo(1);
    }

    @Test
    void transferBatch_reportsFilesTheCopierMissed() throws Exception {
        FileCopier copier = mock(FileCopier.class);
        when(copier.destination()).thenReturn("remote::data");
        when(copier.copy(any(), anyList(), eq(true))).thenReturn(CopyResult.empty());
        when(copier.copy(any(), anyList(), eq(false))).thenReturn(
                new CopyResult(Map.of(Path.of("grid1/movie_1.xml"), 6L), false));
        TransferEngine engine = new TransferEngine(source, copier, TransferEngine.Options.builder().build());
        engine.subscribe(outcomes::add);

        boolean ok = engine.transferBatch(List.of(
                source.resolve("grid1/movie_1_fractions.tiff"),
                source.resolve("grid1/movie_1.xml")));

        assertThat(ok).isFalse();
        assertThat(outcomes).filteredOn(o -> o.getOutcome() == TransferResult.FAILURE)
                .extracting(TransferOutcome::getFilePath)
                .containsExactly(Path.of("grid1/movie_1_fractions.tiff"));
    }

    @Test
    void stop_drainsQueueBeforeHalting() {
        TransferEngine engine = engine(TransferEngine.Options.builder().build());
        AtomicBoolean explicitStop = new AtomicBoolean();
        engine.setStopCallback((path, explicit) -> explicitStop.set(explicit));

        engine.start();
        engine.enqueue(Path.of("grid1/movie_1_fractions.tiff"));
        engine.enqueue(Path.of("grid1/movie_1.xml"));
        engine.stop();

        assertThat(engine.isAlive()).isFalse();
        assertThat(engine.status()).isEqualTo(TransferEngine.Status.FINISHED);
        assertThat(outcomes).hasSize(2);
        assertThat(explicitStop).isTrue();
    }

    @Test
    void restart_rejectsRunningEngine() {
        TransferEngine engine = engine(TransferEngine.Options.builder().build());
        engine.start();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertThatThrownBy(engine::restart)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("still running");
        });
        assertThat(engine.status()).isEqualTo(TransferEngine.Status.RUNNING);

        engine.stop();
    }

    @Test
    void restart_afterStopTransfersAgain() {
        TransferEngine engine = engine(TransferEngine.Options.builder().build());
        engine.start();
        engine.stop();

        assertTimeoutPreemptively(Duration.ofSeconds(5), engine::restart);
        assertThat(engine.status()).isEqualTo(TransferEngine.Status.RUNNING);
        engine.enqueue(Path.of("grid1/movie_1.xml"));
        engine.stop();

        assertThat(outcomes).extracting(TransferOutcome::getFilePath).containsExactly(Path.of("grid1/movie_1.xml"));
        assertThat(destination.resolve("grid1/movie_1.xml")).exists();
    }

    @Test
    void restart_afterRequestedStopWaitsForWorker() {
        TransferEngine engine = engine(TransferEngine.Options.builder().build());
        engine.start();
        engine.requestStop();

        assertTimeoutPreemptively(Duration.ofSeconds(5), engine::restart);
        assertThat(engine.status()).isEqualTo(TransferEngine.Status.RUNNING);

        engine.stop();
    }

    @Test
    void disabledTransferReportsFilesWithoutCopying() {
        TransferEngine engine = engine(TransferEngine.Options.builder().doTransfer(false).build());

        engine.start();
        engine.enqueue(Path.of("grid1/movie_1.xml"));
        engine.stop();

        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.isSuccess()).isTrue();
            assertThat(o.getFileSize()).isZero();
        });
        assertThat(destination.resolve("grid1/movie_1.xml")).doesNotExist();
    }

    @Test
    void finalise_movesRemainingFilesAndRunsCallback() {
        TransferEngine engine = engine(TransferEngine.Options.builder().build());
        AtomicBoolean called = new AtomicBoolean();

        engine.finalise(() -> called.set(true));

        assertThat(called).isTrue();
        assertThat(engine.isFinalised()).isTrue();
        assertThat(source.resolve("grid1/movie_1.xml")).doesNotExist();
        assertThat(destination.resolve("grid1/movie_1.xml")).exists();
        assertThat(outcomes).isEmpty();
    }
}
