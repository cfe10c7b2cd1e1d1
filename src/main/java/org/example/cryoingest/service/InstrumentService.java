package org.example.cryoingest.service;

import org.example.cryoingest.dto.request.MultigridWatcherRequest;
import org.example.cryoingest.dto.response.AnalyserInfoResponse;
import org.example.cryoingest.dto.response.RsyncerInfoResponse;
import org.example.cryoingest.model.ProcessingParameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public interface InstrumentService {
    boolean handshake(String controlPlaneToken);
    boolean sessionHandshake(long sessionId, String controlPlaneToken);
    void setupMultigridWatcher(long sessionId, MultigridWatcherRequest request) throws IOException;
    boolean startMultigridWatcher(long sessionId, boolean process);
    void stopMultigridWatcher(long sessionId);
    void updateVisitEndTime(long sessionId, Instant endTime);
    void stopRsyncer(long sessionId, Path source);
    void removeRsyncer(long sessionId, Path source);
    void finaliseRsyncer(long sessionId, Path source);
    void restartRsyncer(long sessionId, Path source);
    void flushSkipped(long sessionId, Path source);
    void abandon(long sessionId);
    void finaliseSession(long sessionId);
    List<RsyncerInfoResponse> rsyncerInfo(long sessionId);
    List<AnalyserInfoResponse> analyserInfo(long sessionId);
    void registerProcessingParameters(long sessionId, String label, ProcessingParameters parameters);
}
