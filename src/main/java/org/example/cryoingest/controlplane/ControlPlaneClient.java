package org.example.cryoingest.controlplane;

import org.example.cryoingest.controlplane.model.BatchPositionParameters;
import org.example.cryoingest.controlplane.model.DataCollectionGroupRequest;
import org.example.cryoingest.controlplane.model.DataCollectionRequest;
import org.example.cryoingest.controlplane.model.EerFractionationRequest;
import org.example.cryoingest.controlplane.model.FoilHoleParameters;
import org.example.cryoingest.controlplane.model.GridSquareParameters;
import org.example.cryoingest.controlplane.model.ProcessingJobRequest;
import org.example.cryoingest.controlplane.model.RsyncerInfo;
import org.example.cryoingest.controlplane.model.SearchMapParameters;
import org.example.cryoingest.controlplane.model.SpaPreprocessRequest;
import org.example.cryoingest.controlplane.model.TiltInfo;
import org.example.cryoingest.controlplane.model.TiltSeriesGroupInfo;
import org.example.cryoingest.controlplane.model.TiltSeriesInfo;
import org.example.cryoingest.controlplane.model.TomographyPreprocessRequest;
import org.example.cryoingest.controlplane.model.TransferCountUpdate;
import org.example.cryoingest.model.DataCollectionParameters;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Calls made by the instrument server to the control plane. Registrations are
 * upserts on the control-plane side. Implementations never throw for transport or
 * HTTP errors: they log and return an empty result, and the caller carries on.
 */
public interface ControlPlaneClient {

    boolean validateToken();

    Optional<MachineConfig> machineInfo(String instrumentName);

    Optional<Instant> currentTimestamp();

    /**
     * Number of movies already registered per source, used to seed image numbers.
     */
    Map<String, Integer> numMovies(long sessionId);

    void registerGridSquare(long sessionId, int gridSquareId, GridSquareParameters parameters);

    void registerFoilHole(long sessionId, int gridSquareId, FoilHoleParameters parameters);

    void registerTiltSeries(long sessionId, TiltSeriesInfo info);

    void registerTiltSeriesLength(long sessionId, TiltSeriesGroupInfo info);

    void registerCompletedTiltSeries(long sessionId, String visit, TiltSeriesGroupInfo info);

    void registerTiltSeriesForRerun(long sessionId, TiltSeriesInfo info);

    void registerTilt(long sessionId, String visit, TiltInfo info);

    void requestTomographyPreprocessing(long sessionId, String visit, TomographyPreprocessRequest request);

    void requestSpaPreprocessing(long sessionId, String visit, SpaPreprocessRequest request);

    /**
     * Asks the control plane to write an EER fractionation file and returns its path.
     */
    Optional<String> writeEerFractionationFile(long sessionId, String visit, EerFractionationRequest request);

    Optional<String> suggestPath(long sessionId, String visit, String basePath, boolean touch, String extraDirectory);

    void makeRsyncerDestination(long sessionId, String destination);

    void registerRsyncer(long sessionId, RsyncerInfo info);

    void registerStoppedRsyncer(long sessionId, String source);

    void registerRestartedRsyncer(long sessionId, String source);

    void deleteRsyncer(long sessionId, String source);

    void registerDataCollectionGroup(long sessionId, String visit, DataCollectionGroupRequest request);

    void startDataCollection(long sessionId, String visit, DataCollectionRequest request);

    /**
     * Registers one downstream recipe for a single-particle source.
     */
    void registerProcessingRecipe(long sessionId, String visit, ProcessingJobRequest request);

    /**
     * Registers one processing job for a tilt series.
     */
    void registerProcessingJob(long sessionId, String visit, ProcessingJobRequest request);

    void registerSpaProcessingParameters(long sessionId, String tag, DataCollectionParameters parameters);

    void flushSpaProcessing(long sessionId, String visit, String tag);

    void registerTomographyProcessingParameters(long sessionId, DataCollectionParameters parameters);

    void flushTomographyProcessing(long sessionId, String visit, String source);

    void registerSearchMap(long sessionId, String name, SearchMapParameters parameters);

    void registerBatchPosition(long sessionId, String name, BatchPositionParameters parameters);

    void incrementFileCount(String visit, TransferCountUpdate update);

    void incrementTransferredFiles(String visit, TransferCountUpdate update);

    boolean removeSession(long sessionId);
}
