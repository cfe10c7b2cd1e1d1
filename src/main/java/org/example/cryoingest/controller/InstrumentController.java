package org.example.cryoingest.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.cryoingest.dto.request.MultigridWatcherRequest;
import org.example.cryoingest.dto.request.ProcessingParametersRequest;
import org.example.cryoingest.dto.request.RsyncerSourceRequest;
import org.example.cryoingest.dto.request.VisitEndTimeRequest;
import org.example.cryoingest.dto.response.AnalyserInfoResponse;
import org.example.cryoingest.dto.response.RsyncerInfoResponse;
import org.example.cryoingest.service.InstrumentService;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions/{sessionId}")
@RequiredArgsConstructor
public class InstrumentController {

    private static final Map<String, Boolean> SUCCESS = Map.of("success", true);

    private final InstrumentService instrumentService;

    @PostMapping("/multigrid_watcher")
    public Map<String, Boolean> setupMultigridWatcher(@PathVariable long sessionId,
                                                      @Valid @RequestBody MultigridWatcherRequest req)
            throws IOException {
        instrumentService.setupMultigridWatcher(sessionId, req);
        return SUCCESS;
    }

    @PostMapping("/start_multigrid_watcher")
    public Map<String, Boolean> startMultigridWatcher(@PathVariable long sessionId,
                                                      @RequestParam(defaultValue = "true") boolean process) {
        return Map.of("success", instrumentService.startMultigridWatcher(sessionId, process));
    }

    @DeleteMapping("/multigrid_watcher")
    public Map<String, Boolean> stopMultigridWatcher(@PathVariable long sessionId) {
        instrumentService.stopMultigridWatcher(sessionId);
        return SUCCESS;
    }

    @PostMapping("/multigrid_controller/visit_end_time")
    public Map<String, Boolean> visitEndTime(@PathVariable long sessionId,
                                             @Valid @RequestBody VisitEndTimeRequest req) {
        instrumentService.updateVisitEndTime(sessionId, req.getEndTime());
        return SUCCESS;
    }

    @PostMapping("/stop_rsyncer")
    public Map<String, Boolean> stopRsyncer(@PathVariable long sessionId,
                                            @Valid @RequestBody RsyncerSourceRequest req) {
        instrumentService.stopRsyncer(sessionId, Path.of(req.getSource()));
        return SUCCESS;
    }

    @PostMapping("/remove_rsyncer")
    public Map<String, Boolean> removeRsyncer(@PathVariable long sessionId,
                                              @Valid @RequestBody RsyncerSourceRequest req) {
        instrumentService.removeRsyncer(sessionId, Path.of(req.getSource()));
        return SUCCESS;
    }

    @PostMapping("/finalise_rsyncer")
    public Map<String, Boolean> finaliseRsyncer(@PathVariable long sessionId,
                                                @Valid @RequestBody RsyncerSourceRequest req) {
        instrumentService.finaliseRsyncer(sessionId, Path.of(req.getSource()));
        return SUCCESS;
    }

    @PostMapping("/restart_rsyncer")
    public Map<String, Boolean> restartRsyncer(@PathVariable long sessionId,
                                               @Valid @RequestBody RsyncerSourceRequest req) {
        instrumentService.restartRsyncer(sessionId, Path.of(req.getSource()));
        return SUCCESS;
    }

    @PostMapping("/flush_skipped_rsyncer")
    public Map<String, Boolean> flushSkipped(@PathVariable long sessionId,
                                             @Valid @RequestBody RsyncerSourceRequest req) {
        instrumentService.flushSkipped(sessionId, Path.of(req.getSource()));
        return SUCCESS;
    }

    @PostMapping("/abandon_controller")
    public Map<String, Boolean> abandon(@PathVariable long sessionId) {
        instrumentService.abandon(sessionId);
        return SUCCESS;
    }

    @PostMapping("/finalise_session")
    public Map<String, Boolean> finaliseSession(@PathVariable long sessionId) {
        instrumentService.finaliseSession(sessionId);
        return SUCCESS;
    }

    @GetMapping("/rsyncer_info")
    public List<RsyncerInfoResponse> rsyncerInfo(@PathVariable long sessionId) {
        return instrumentService.rsyncerInfo(sessionId);
    }

    @GetMapping("/analyser_info")
    public List<AnalyserInfoResponse> analyserInfo(@PathVariable long sessionId) {
        return instrumentService.analyserInfo(sessionId);
    }

    @PostMapping("/processing_parameters")
    public Map<String, Boolean> processingParameters(@PathVariable long sessionId,
                                                     @Valid @RequestBody ProcessingParametersRequest req) {
        instrumentService.registerProcessingParameters(sessionId, req.getLabel(), req.getParams());
        return SUCCESS;
    }
}
