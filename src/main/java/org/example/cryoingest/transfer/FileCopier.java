package org.example.cryoingest.transfer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Copies a batch of files, given relative to a base directory, to the destination
 * the copier was built for.
 */
public interface FileCopier {

    /**
     * @param removeSource delete each source file once it is confirmed copied
     * @return the files confirmed copied with their sizes; anything missing from the
     * result has failed
     */
    CopyResult copy(Path basepath, List<Path> relativeFiles, boolean removeSource)
            throws IOException, InterruptedException;

    /** Human readable destination, for logs and thread names. */
    String destination();
}
