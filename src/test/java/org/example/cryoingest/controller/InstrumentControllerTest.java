package org.example.cryoingest.controller;

import org.example.cryoingest.config.SecurityConfig;
import org.example.cryoingest.dto.request.MultigridWatcherRequest;
import org.example.cryoingest.dto.response.RsyncerInfoResponse;
import org.example.cryoingest.security.JwtService;
import org.example.cryoingest.service.InstrumentService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {AuthController.class, InstrumentController.class})
@Import({SecurityConfig.class, JwtService.class})
class InstrumentControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private JwtService jwtService;

    @MockBean
    private InstrumentService instrumentService;

    private String bearer(long sessionId) {
        return "Bearer " + jwtService.generateSessionToken(sessionId);
    }

    @Test
    void healthIsPublic() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk());
    }

    @Test
    void handshakeIssuesInstrumentToken() throws Exception {
        when(instrumentService.handshake("cp-token")).thenReturn(true);

        mvc.perform(post("/api/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\": \"cp-token\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.access_token").isNotEmpty());
    }

    @Test
    void rejectedHandshakeIsUnauthorized() throws Exception {
        when(instrumentService.handshake("bad")).thenReturn(false);

        mvc.perform(post("/api/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\": \"bad\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void blankHandshakeTokenFailsValidation() throws Exception {
        mvc.perform(post("/api/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\": \"\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(instrumentService);
    }

    @Test
    void sessionTokenIsOnlyValidForItsSession() throws Exception {
        mvc.perform(get("/api/sessions/5/check_token").header("Authorization", bearer(5)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_valid").value(true));

        mvc.perform(get("/api/sessions/6/check_token").header("Authorization", bearer(5)))
                .andExpect(status().isForbidden());

        mvc.perform(get("/api/sessions/5/check_token"))
                .andExpect(status().isForbidden());
    }

    @Test
    void instrumentTokenCannotReachSessionEndpoints() throws Exception {
        mvc.perform(get("/api/sessions/5/rsyncer_info")
                        .header("Authorization", "Bearer " + jwtService.generateInstrumentToken()))
                .andExpect(status().isForbidden());
    }

    @Test
    void setsUpMultigridWatcher() throws Exception {
        mvc.perform(post("/api/sessions/5/multigrid_watcher")
                        .header("Authorization", bearer(5))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source": "/dls/m02/data/cm1-1", "visit": "cm1-1",
                                 "label": "grid", "skip_existing_processing": true,
                                 "destination_overrides": {"/dls/m02/data/cm1-1/atlas": "custom"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<MultigridWatcherRequest> request = ArgumentCaptor.forClass(MultigridWatcherRequest.class);
        verify(instrumentService).setupMultigridWatcher(eq(5L), request.capture());
        assertThat(request.getValue().getVisit()).isEqualTo("cm1-1");
        assertThat(request.getValue().isSkipExistingProcessing()).isTrue();
        assertThat(request.getValue().getDestinationOverrides()).containsEntry("/dls/m02/data/cm1-1/atlas", "custom");
    }

    @Test
    void multigridWatcherNeedsVisit() throws Exception {
        mvc.perform(post("/api/sessions/5/multigrid_watcher")
                        .header("Authorization", bearer(5))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"/dls/m02/data/cm1-1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void startReportsWhetherWatcherExists() throws Exception {
        when(instrumentService.startMultigridWatcher(5, false)).thenReturn(true);

        mvc.perform(post("/api/sessions/5/start_multigrid_watcher")
                        .param("process", "false")
                        .header("Authorization", bearer(5)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void visitEndTimeIsParsed() throws Exception {
        mvc.perform(post("/api/sessions/5/multigrid_controller/visit_end_time")
                        .header("Authorization", bearer(5))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"end_time\": \"2030-01-01T12:00:00Z\"}"))
                .andExpect(status().isOk());

        verify(instrumentService).updateVisitEndTime(5, Instant.parse("2030-01-01T12:00:00Z"));
    }

    @Test
    void rsyncerCommandsResolveTheSource() throws Exception {
        mvc.perform(post("/api/sessions/5/flush_skipped_rsyncer")
                        .header("Authorization", bearer(5))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"/dls/m02/data/Grid1\"}"))
                .andExpect(status().isOk());

        verify(instrumentService).flushSkipped(5, Path.of("/dls/m02/data/Grid1"));
    }

    @Test
    void unknownRsyncerIsNotFound() throws Exception {
        doThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "No rsyncer"))
                .when(instrumentService).stopRsyncer(eq(5L), any());

        mvc.perform(post("/api/sessions/5/stop_rsyncer")
                        .header("Authorization", bearer(5))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"/nowhere\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void rsyncerInfoIsListed() throws Exception {
        when(instrumentService.rsyncerInfo(5)).thenReturn(List.of(RsyncerInfoResponse.builder()
                .source("/dls/m02/data/Grid1")
                .numFilesTransferred(12)
                .numFilesInQueue(3)
                .alive(true)
                .stopping(false)
                .numFilesSkipped(0)
                .status("running")
                .build()));

        mvc.perform(get("/api/sessions/5/rsyncer_info").header("Authorization", bearer(5)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].source").value("/dls/m02/data/Grid1"))
                .andExpect(jsonPath("$[0].num_files_transferred").value(12))
                .andExpect(jsonPath("$[0].status").value("running"));
    }

    @Test
    void processingParametersAreRegistered() throws Exception {
        mvc.perform(post("/api/sessions/5/processing_parameters")
                        .header("Authorization", bearer(5))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"label": "grid", "params": {"dose_per_frame": 1.2, "symmetry": "C1"}}
                                """))
                .andExpect(status().isOk());

        verify(instrumentService).registerProcessingParameters(eq(5L), eq("grid"), any());
    }
}
