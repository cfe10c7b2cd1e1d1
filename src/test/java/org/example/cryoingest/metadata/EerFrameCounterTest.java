package org.example.cryoingest.metadata;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EerFrameCounterTest {

    /**
     * Minimal little-endian BigTIFF with {@code frames} single-tag directories.
     */
    private static byte[] bigTiff(int frames) {
        int ifdSize = 8 + 20 + 8;
        ByteBuffer buf = ByteBuffer.allocate(16 + frames * ifdSize).order(ByteOrder.LITTLE_ENDIAN);
        buf.put((byte) 'I').put((byte) 'I').putShort((short) 43).putShort((short) 8).putShort((short) 0);
        buf.putLong(frames == 0 ? 0 : 16);
        for (int i = 0; i < frames; i++) {
            long start = 16L + (long) i * ifdSize;
            buf.putLong(1);
            buf.put(new byte[20]);
            buf.putLong(i == frames - 1 ? 0 : start + ifdSize);
        }
        return buf.array();
    }

    @Test
    void countsDirectories(@TempDir Path dir) throws IOException {
        Path eer = Files.write(dir.resolve("movie.eer"), bigTiff(5));

        assertThat(EerFrameCounter.countFrames(eer)).isEqualTo(5);
    }

    @Test
    void rejectsTruncatedFile(@TempDir Path dir) throws IOException {
        byte[] full = bigTiff(3);
        byte[] truncated = new byte[full.length - 30];
        System.arraycopy(full, 0, truncated, 0, truncated.length);
        Path eer = Files.write(dir.resolve("broken.eer"), truncated);

        assertThatThrownBy(() -> EerFrameCounter.countFrames(eer)).isInstanceOf(IOException.class);
    }
}
