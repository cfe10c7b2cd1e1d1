package org.example.cryoingest.watcher;

import org.example.cryoingest.model.WatchedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class DirWatcherTest {

    @TempDir
    Path dir;

    private final AtomicLong clock = new AtomicLong(System.currentTimeMillis());

    private DirWatcher watcher(boolean transferAll, Set<String> blacklist) {
        return new DirWatcher(dir, 1000, 100, null, transferAll, blacklist, clock::get);
    }

    private static List<Path> paths(List<WatchedFile> files) {
        List<Path> out = new ArrayList<>();
        files.forEach(f -> out.add(f.getPath()));
        return out;
    }

    @Test
    void emitsFileOnceAfterSettling() throws IOException {
        Path movie = Files.writeString(dir.resolve("movie.tiff"), "0123456789");
        DirWatcher watcher = watcher(true, Set.of());
        List<WatchedFile> notified = new ArrayList<>();
        watcher.subscribe(notified::add);

        assertThat(watcher.scan()).isEmpty();

        clock.addAndGet(2000);
        List<WatchedFile> emitted = watcher.scan();
        assertThat(emitted).singleElement().satisfies(f -> {
            assertThat(f.getPath()).isEqualTo(movie);
            assertThat(f.getSize()).isEqualTo(10);
        });
        assertThat(notified).hasSize(1);

        clock.addAndGet(2000);
        assertThat(watcher.scan()).isEmpty();
    }

    @Test
    void changedFileIsEmittedAgain() throws IOException {
        Path movie = Files.writeString(dir.resolve("movie.tiff"), "0123");
        DirWatcher watcher = watcher(true, Set.of());
        watcher.scan();
        clock.addAndGet(2000);
        assertThat(watcher.scan()).hasSize(1);

        Files.writeString(movie, "4567", StandardOpenOption.APPEND);
        assertThat(watcher.scan()).isEmpty();
        clock.addAndGet(2000);

        assertThat(watcher.scan()).singleElement().satisfies(f -> assertThat(f.getSize()).isEqualTo(8));
    }

    @Test
    void mdocFilesComeFirst() throws IOException {
        Files.createDirectories(dir.resolve("tilts"));
        Files.writeString(dir.resolve("tilts/Position_1_001[0.00]_fractions.tiff"), "movie");
        Files.writeString(dir.resolve("tilts/Position_1.mdoc"), "[ZValue = 0]");
        DirWatcher watcher = watcher(true, Set.of());
        watcher.scan();
        clock.addAndGet(2000);

        assertThat(paths(watcher.scan())).containsExactly(
                dir.resolve("tilts/Position_1.mdoc"),
                dir.resolve("tilts/Position_1_001[0.00]_fractions.tiff"));
    }

    @Test
    void skipsHiddenBlacklistedAndTextualFiles() throws IOException {
        Files.writeString(dir.resolve(".movie.tiff.partial"), "x");
        Files.writeString(dir.resolve("movie.tiff.downloading"), "x");
        Files.createDirectories(dir.resolve("textual"));
        Files.writeString(dir.resolve("textual/notes.txt"), "x");
        Files.createDirectories(dir.resolve("Thumbnails"));
        Files.writeString(dir.resolve("Thumbnails/thumb.jpg"), "x");
        Files.writeString(dir.resolve("kept.xml"), "<xml/>");
        DirWatcher watcher = watcher(true, Set.of("Thumbnails"));
        watcher.scan();
        clock.addAndGet(2000);

        assertThat(paths(watcher.scan())).containsExactly(dir.resolve("kept.xml"));
    }

    @Test
    void filesOlderThanWatcherAreSkippedUnlessTransferringAll() throws IOException {
        Path old = Files.writeString(dir.resolve("old.tiff"), "x");
        Files.setLastModifiedTime(old, FileTime.fromMillis(clock.get() - 3_600_000));

        DirWatcher newOnly = watcher(false, Set.of());
        newOnly.scan();
        clock.addAndGet(2000);
        assertThat(newOnly.scan()).isEmpty();

        DirWatcher all = watcher(true, Set.of());
        all.scan();
        clock.addAndGet(2000);
        assertThat(paths(all.scan())).containsExactly(old);
    }

    @Test
    void scanListenersReceiveEachScan() throws IOException {
        Files.writeString(dir.resolve("a.tiff"), "a");
        DirWatcher watcher = watcher(true, Set.of());
        List<Integer> counts = new ArrayList<>();
        watcher.subscribeToScans(files -> counts.add(files.size()));

        watcher.scan();
        clock.addAndGet(2000);
        watcher.scan();

        assertThat(counts).containsExactly(0, 1);
    }
}
