package org.example.cryoingest.metadata;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Counts the frames of an EER movie by walking its image file directories.
 * EER follows the BigTIFF layout: 8-byte IFD offsets, 8-byte tag counts and
 * 20-byte tag entries, one IFD per raw frame.
 */
public final class EerFrameCounter {

    private static final int TAG_ENTRY_SIZE = 20;

    private EerFrameCounter() {
    }

    public static int countFrames(Path eerFile) throws IOException {
        try (FileChannel ch = FileChannel.open(eerFile, StandardOpenOption.READ)) {
            long size = ch.size();
            ByteBuffer bom = read(ch, 0, 2, ByteOrder.LITTLE_ENDIAN);
            ByteOrder order = (bom.get(0) == 'I' && bom.get(1) == 'I')
                    ? ByteOrder.LITTLE_ENDIAN
                    : ByteOrder.BIG_ENDIAN;

            long ifd = read(ch, 8, 8, order).getLong();
            int frames = 0;
            while (ifd != 0) {
                if (ifd < 0 || ifd + 8 > size) {
                    throw new IOException("IFD offset " + ifd + " outside " + eerFile);
                }
                frames++;
                long numTags = read(ch, ifd, 8, order).getLong();
                long next = ifd + 8 + TAG_ENTRY_SIZE * numTags;
                if (numTags < 0 || next + 8 > size) {
                    throw new IOException("Truncated IFD at " + ifd + " in " + eerFile);
                }
                ifd = read(ch, next, 8, order).getLong();
            }
            return frames;
        }
    }

    private static ByteBuffer read(FileChannel ch, long position, int length, ByteOrder order) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length).order(order);
        while (buf.hasRemaining()) {
            int n = ch.read(buf, position + buf.position());
            if (n < 0) throw new IOException("Unexpected end of file at " + position);
        }
        buf.flip();
        return buf;
    }
}
