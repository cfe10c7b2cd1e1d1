package org.example.cryoingest.context;

import lombok.Getter;
import lombok.Setter;
import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.MachineConfig;
import org.example.cryoingest.model.SampleInfo;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State shared by every source of one session: the authenticated control-plane
 * client, the instrument configuration and the per-source environments. Owned by
 * the multigrid controller and referenced by each pipeline.
 */
@Getter
public class SessionEnvironment {

    private final long sessionId;
    private final String visit;
    private final String instrumentName;
    private final ControlPlaneClient client;
    private final MachineConfig machineConfig;

    /** Whether the current collection is recorded in super-resolution mode. */
    @Setter
    private volatile boolean superres;

    private final Map<Path, SourceEnvironment> sources = new ConcurrentHashMap<>();
    private final Map<Path, SampleInfo> samples = new ConcurrentHashMap<>();
    private final AtomicLong correlationIds = new AtomicLong();

    public SessionEnvironment(long sessionId,
                              String visit,
                              String instrumentName,
                              ControlPlaneClient client,
                              MachineConfig machineConfig) {
        this.sessionId = sessionId;
        this.visit = visit;
        this.instrumentName = instrumentName;
        this.client = client;
        this.machineConfig = machineConfig;
    }

    public SourceEnvironment addSource(Path source, String destination) {
        return sources.computeIfAbsent(source, s -> new SourceEnvironment(this, s, destination));
    }

    public Optional<SourceEnvironment> source(Path source) {
        return Optional.ofNullable(sources.get(source));
    }

    /**
     * The registered source with the longest path that contains {@code file}.
     */
    public Optional<SourceEnvironment> sourceFor(Path file) {
        SourceEnvironment best = null;
        for (SourceEnvironment env : sources.values()) {
            if (file.startsWith(env.getSource())
                    && (best == null || env.getSource().getNameCount() > best.getSource().getNameCount())) {
                best = env;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Where a local file ends up after transfer, or the local path itself when no
     * source covers it.
     */
    public String transferredPath(Path localFile) {
        return sourceFor(localFile)
                .map(env -> env.transferredPath(localFile).toString())
                .orElse(localFile.toString());
    }

    /**
     * Records the atlas and sample of the data written below {@code dataDirectory}.
     */
    public void putSample(Path dataDirectory, SampleInfo sample) {
        samples.put(dataDirectory, sample);
    }

    public Optional<SampleInfo> sampleFor(Path source) {
        for (Map.Entry<Path, SampleInfo> e : samples.entrySet()) {
            if (source.startsWith(e.getKey())) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }

    /**
     * The visit directory below the configured data directory holding {@code file}.
     */
    public Optional<Path> visitDirectory(Path file) {
        for (String dd : machineConfig.getDataDirectories()) {
            Path base = Path.of(dd);
            if (file.startsWith(base)) return Optional.of(base.resolve(visit));
        }
        return Optional.empty();
    }

    /**
     * Data directory holding the movies described by a metadata directory. EPU and
     * Tomo write metadata to {@code <root>/<visit>/<name>} and movies to
     * {@code <root>/<name>}; multi-sample Tomo layouts write
     * {@code <root>/<visit>/<name>/<sample>} and {@code <root>/<name>_<sample>}.
     */
    public Path dataDirectoryFor(Path metadataDirectory) {
        Path parent = metadataDirectory.getParent();
        if (parent != null && parent.getParent() != null
                && visit.equals(parent.getParent().getFileName().toString())
                && metadataDirectory.getFileName().toString().startsWith("Sample")) {
            return parent.getParent().getParent()
                    .resolve(parent.getFileName() + "_" + metadataDirectory.getFileName());
        }
        if (parent == null || parent.getParent() == null) return metadataDirectory;
        return parent.getParent().resolve(metadataDirectory.getFileName());
    }

    public long nextCorrelationId() {
        return correlationIds.incrementAndGet();
    }
}
