package org.example.cryoingest.context;

import org.example.cryoingest.model.DataCollectionParameters;
import org.example.cryoingest.model.Role;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Acquisition-specific handling of transferred files for one source. A context is
 * created once the dispatcher has classified the source and is only ever called
 * from that dispatcher's thread.
 */
public interface Context {

    /**
     * Short name used in logs.
     */
    String name();

    /**
     * Handles a transferred file and returns the tags of the units it completed.
     */
    List<String> postTransfer(Path transferredFile, Role role);

    default List<String> postFirstTransfer(Path transferredFile, Role role) {
        return postTransfer(transferredFile, role);
    }

    /**
     * Harvests acquisition parameters from a metadata file. Empty means the file is
     * missing or not understood yet.
     */
    default Optional<DataCollectionParameters> gatherMetadata(Path metadataFile) {
        return Optional.empty();
    }

    /**
     * Called once the acquisition parameters of the source have been confirmed.
     */
    default void parametersConfirmed(String imageDirectory) {
    }
}
