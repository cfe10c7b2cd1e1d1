package org.example.cryoingest.context;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.model.DataCollectionParameters;

import java.nio.file.Path;

/**
 * Per-source view of a session: where the source is transferred to, the confirmed
 * acquisition parameters and the movie counter. Parameters are written by the
 * controller and read by the dispatcher thread of the source.
 */
@Slf4j
@Getter
public class SourceEnvironment {

    private final SessionEnvironment session;
    private final Path source;

    /** Destination relative to the rsync base path. */
    private final String destination;

    @Setter
    private volatile DataCollectionParameters parameters;

    @Setter
    private volatile String eerFractionationFile;

    private Integer nextImageNumber;

    SourceEnvironment(SessionEnvironment session, Path source, String destination) {
        this.session = session;
        this.source = source;
        this.destination = destination;
    }

    public Path transferredPath(Path localFile) {
        Path base = Path.of(session.getMachineConfig().getRsyncBasepath()).resolve(destination);
        if (localFile.startsWith(source)) {
            return base.resolve(source.relativize(localFile));
        }
        return base.resolve(localFile.getFileName());
    }

    /**
     * Image numbers continue from the movies the control plane already knows for
     * this source. Only called from the dispatcher thread.
     */
    public int nextImageNumber() {
        if (nextImageNumber == null) {
            Integer known = session.getClient().numMovies(session.getSessionId()).get(source.toString());
            nextImageNumber = (known == null ? 0 : known) + 1;
            log.debug("Image numbers for {} start at {}", source, nextImageNumber);
        }
        return nextImageNumber++;
    }

    public DataCollectionParameters parametersOrEmpty() {
        DataCollectionParameters p = parameters;
        return p == null ? new DataCollectionParameters() : p;
    }
}
