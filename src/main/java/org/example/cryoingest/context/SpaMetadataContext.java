package org.example.cryoingest.context;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.metadata.AtlasReference;
import org.example.cryoingest.metadata.MetadataParseException;
import org.example.cryoingest.model.Role;
import org.example.cryoingest.model.SampleInfo;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code EpuSession.dm} from an EPU metadata directory and records which
 * atlas and sample the session's movies belong to.
 */
@Slf4j
public class SpaMetadataContext implements Context {

    private final SourceEnvironment environment;
    private final SessionEnvironment session;

    public SpaMetadataContext(SourceEnvironment environment) {
        this.environment = environment;
        this.session = environment.getSession();
    }

    @Override
    public String name() {
        return "SpaMetadataContext";
    }

    @Override
    public List<String> postTransfer(Path transferredFile, Role role) {
        if (!transferredFile.getFileName().toString().equals("EpuSession.dm")) {
            return List.of();
        }
        log.info("EPU session metadata found: {}", transferredFile);
        Optional<SampleInfo> sample;
        try {
            sample = AtlasReference.fromEpuSession(transferredFile, session.getVisit())
                    .flatMap(AtlasReference::toSampleInfo);
        } catch (MetadataParseException e) {
            log.warn("Could not read {}: {}", transferredFile, e.getMessage());
            return List.of();
        }
        if (sample.isEmpty()) {
            log.warn("Sample could not be identified for {}", transferredFile);
            return List.of();
        }
        Path dataDirectory = session.dataDirectoryFor(environment.getSource());
        session.putSample(dataDirectory, sample.get());
        log.info("Data in {} comes from sample {} on atlas {}", dataDirectory,
                sample.get().getSample(), sample.get().getAtlas());
        return List.of();
    }
}
