package org.example.cryoingest.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.context.SessionEnvironment;
import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.ControlPlaneClientFactory;
import org.example.cryoingest.controlplane.MachineConfig;
import org.example.cryoingest.dto.request.MultigridWatcherRequest;
import org.example.cryoingest.dto.response.AnalyserInfoResponse;
import org.example.cryoingest.dto.response.RsyncerInfoResponse;
import org.example.cryoingest.model.ProcessingParameters;
import org.example.cryoingest.multigrid.MultigridController;
import org.example.cryoingest.multigrid.PipelineSettings;
import org.example.cryoingest.security.TokenStore;
import org.example.cryoingest.service.InstrumentService;
import org.example.cryoingest.transfer.TransferEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class InstrumentServiceImpl implements InstrumentService {

    private final ControlPlaneClientFactory clientFactory;
    private final TokenStore tokenStore;

    private final Map<Long, MultigridController> controllers = new ConcurrentHashMap<>();
    private final Map<String, ProcessingParameters> processingParameters = new ConcurrentHashMap<>();

    @Value("${ingest.control-plane.url}")
    private String controlPlaneUrl;

    @Value("${ingest.instrument-name}")
    private String instrumentName;

    @Value("${ingest.watcher.settling-seconds:30}")
    private long settlingSeconds;

    @Value("${ingest.watcher.scan-interval-seconds:15}")
    private long scanIntervalSeconds;

    @Value("${ingest.multigrid.scan-interval-seconds:15}")
    private long multigridScanIntervalSeconds;

    @Value("${ingest.transfer.mode:rsync}")
    private String transferMode;

    @Value("${ingest.transfer.local-root:}")
    private String localRoot;

    @Value("${ingest.transfer.batch-size:100}")
    private int batchSize;

    @Value("${ingest.transfer.max-backoff-seconds:120}")
    private int maxBackoffSeconds;

    @Override
    public boolean handshake(String controlPlaneToken) {
        if (!clientFactory.create(controlPlaneToken).validateToken()) return false;
        tokenStore.putInstrumentToken(controlPlaneToken);
        return true;
    }

    @Override
    public boolean sessionHandshake(long sessionId, String controlPlaneToken) {
        if (!clientFactory.create(controlPlaneToken).validateToken()) return false;
        tokenStore.putSessionToken(sessionId, controlPlaneToken);
        return true;
    }

    @Override
    public synchronized void setupMultigridWatcher(long sessionId, MultigridWatcherRequest request)
            throws IOException {
        if (controllers.containsKey(sessionId)) return;
        controllers.values().removeIf(MultigridController::isDormant);

        String token = tokenStore.tokenFor(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "no control-plane token"));
        ControlPlaneClient client = clientFactory.create(token);
        String instrument = request.getInstrumentName() == null || request.getInstrumentName().isBlank()
                ? instrumentName
                : request.getInstrumentName();
        MachineConfig machineConfig = client.machineInfo(instrument)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_GATEWAY,
                        "machine configuration unavailable for " + instrument));

        SessionEnvironment session = new SessionEnvironment(sessionId, request.getVisit(), instrument,
                client, machineConfig);
        Map<Path, String> overrides = new LinkedHashMap<>();
        request.getDestinationOverrides().forEach((k, v) -> overrides.put(Path.of(k).toAbsolutePath(), v));

        ProcessingParameters parameters = request.getLabel() == null
                ? null
                : processingParameters.get(request.getLabel());
        MultigridController controller = new MultigridController(session, settings(), parameters,
                request.getVisitEndTime(), overrides);
        controller.setupMultigridWatcher(Path.of(request.getSource()), request.isSkipExistingProcessing());
        controllers.put(sessionId, controller);
        log.info("Multigrid controller set up for session {} watching {}", sessionId, request.getSource());
    }

    private PipelineSettings settings() {
        return PipelineSettings.builder()
                .settlingSeconds(settlingSeconds)
                .scanIntervalSeconds(scanIntervalSeconds)
                .multigridScanIntervalSeconds(multigridScanIntervalSeconds)
                .batchSize(batchSize)
                .maxBackoffSeconds(maxBackoffSeconds)
                .transferMode(PipelineSettings.TransferMode.valueOf(transferMode.toUpperCase(Locale.ROOT)))
                .localRoot(localRoot.isBlank() ? null : Path.of(localRoot))
                .defaultRsyncHost(URI.create(controlPlaneUrl).getHost())
                .build();
    }

    private MultigridController controller(long sessionId) {
        MultigridController controller = controllers.get(sessionId);
        if (controller == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "no multigrid controller for session " + sessionId);
        }
        return controller;
    }

    @Override
    public boolean startMultigridWatcher(long sessionId, boolean process) {
        MultigridController controller = controllers.get(sessionId);
        return controller != null && controller.startMultigridWatcher(process);
    }

    @Override
    public void stopMultigridWatcher(long sessionId) {
        controller(sessionId).stopMultigridWatcher();
    }

    @Override
    public void updateVisitEndTime(long sessionId, Instant endTime) {
        controller(sessionId).updateVisitEndTime(endTime);
    }

    @Override
    public void stopRsyncer(long sessionId, Path source) {
        onSource(() -> controller(sessionId).stopRsyncer(source));
    }

    @Override
    public void removeRsyncer(long sessionId, Path source) {
        onSource(() -> controller(sessionId).removeRsyncer(source));
    }

    @Override
    public void finaliseRsyncer(long sessionId, Path source) {
        onSource(() -> controller(sessionId).finaliseRsyncer(source));
    }

    @Override
    public void restartRsyncer(long sessionId, Path source) {
        onSource(() -> controller(sessionId).restartRsyncer(source));
    }

    @Override
    public void flushSkipped(long sessionId, Path source) {
        onSource(() -> controller(sessionId).flushSkipped(source));
    }

    private static void onSource(Runnable action) {
        try {
            action.run();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @Override
    public void abandon(long sessionId) {
        controller(sessionId).abandon();
    }

    @Override
    public void finaliseSession(long sessionId) {
        controller(sessionId).finalise();
    }

    @Override
    public List<RsyncerInfoResponse> rsyncerInfo(long sessionId) {
        List<RsyncerInfoResponse> info = new ArrayList<>();
        for (Map.Entry<Path, TransferEngine> e : controller(sessionId).getTransferEngines().entrySet()) {
            TransferEngine engine = e.getValue();
            info.add(RsyncerInfoResponse.builder()
                    .source(e.getKey().toString())
                    .numFilesTransferred(engine.getFilesTransferred())
                    .numFilesInQueue(engine.queueSize())
                    .alive(engine.isAlive())
                    .stopping(engine.isStopping())
                    .numFilesSkipped(engine.getFilesSkipped())
                    .status(engine.status().key())
                    .build());
        }
        return info;
    }

    @Override
    public List<AnalyserInfoResponse> analyserInfo(long sessionId) {
        List<AnalyserInfoResponse> info = new ArrayList<>();
        controller(sessionId).getAnalysers().forEach((source, analyser) -> info.add(AnalyserInfoResponse.builder()
                .source(source.toString())
                .numFilesInQueue(analyser.queueSize())
                .alive(analyser.isAlive())
                .stopping(analyser.isStopping())
                .build()));
        return info;
    }

    @Override
    public void registerProcessingParameters(long sessionId, String label, ProcessingParameters parameters) {
        processingParameters.put(label, parameters);
        MultigridController controller = controllers.get(sessionId);
        if (controller != null) {
            controller.setProcessingParameters(parameters);
        }
    }
}
