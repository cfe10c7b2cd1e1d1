package org.example.cryoingest.controlplane;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
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
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ControlPlaneClient} over HTTP. One instance is bound to one control-plane
 * token; it is shared by every pipeline thread of a session.
 */
@Slf4j
public class RestControlPlaneClient implements ControlPlaneClient {

    private final RestClient rest;
    private final ObjectMapper objectMapper;

    public RestControlPlaneClient(RestClient.Builder builder, String baseUrl, String token, ObjectMapper objectMapper) {
        this.rest = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean validateToken() {
        return call("validate_token", () -> rest.get()
                .uri("/validate_token")
                .retrieve()
                .body(JsonNode.class))
                .map(node -> node.path("valid").asBoolean(false))
                .orElse(false);
    }

    @Override
    public Optional<MachineConfig> machineInfo(String instrumentName) {
        return call("machine_info", () -> rest.get()
                .uri("/instruments/{instrument}/machine", instrumentName)
                .retrieve()
                .body(MachineConfig.class));
    }

    @Override
    public Optional<Instant> currentTimestamp() {
        return call("current_timestamp", () -> rest.get()
                .uri("/time")
                .retrieve()
                .body(JsonNode.class))
                .filter(node -> node.has("timestamp"))
                .map(node -> Instant.ofEpochMilli((long) (node.get("timestamp").asDouble() * 1000)));
    }

    @Override
    public Map<String, Integer> numMovies(long sessionId) {
        return call("num_movies", () -> rest.get()
                .uri("/sessions/{sid}/num_movies", sessionId)
                .retrieve()
                .body(new ParameterizedTypeReference<Map<String, Integer>>() {
                }))
                .orElse(Map.of());
    }

    @Override
    public void registerGridSquare(long sessionId, int gridSquareId, GridSquareParameters parameters) {
        post("register_grid_square", parameters, "/sessions/{sid}/grid_square/{gsid}", sessionId, gridSquareId);
    }

    @Override
    public void registerFoilHole(long sessionId, int gridSquareId, FoilHoleParameters parameters) {
        post("register_foil_hole", parameters, "/sessions/{sid}/grid_square/{gsid}/foil_hole", sessionId, gridSquareId);
    }

    @Override
    public void registerTiltSeries(long sessionId, TiltSeriesInfo info) {
        post("register_tilt_series", info, "/sessions/{sid}/tilt_series", sessionId);
    }

    @Override
    public void registerTiltSeriesLength(long sessionId, TiltSeriesGroupInfo info) {
        post("register_tilt_series_length", info, "/sessions/{sid}/tilt_series_length", sessionId);
    }

    @Override
    public void registerCompletedTiltSeries(long sessionId, String visit, TiltSeriesGroupInfo info) {
        post("register_completed_tilt_series", info,
                "/visits/{visit}/sessions/{sid}/completed_tilt_series", visit, sessionId);
    }

    @Override
    public void registerTiltSeriesForRerun(long sessionId, TiltSeriesInfo info) {
        post("register_tilt_series_for_rerun", info, "/sessions/{sid}/tilt_series_for_rerun", sessionId);
    }

    @Override
    public void registerTilt(long sessionId, String visit, TiltInfo info) {
        post("register_tilt", info, "/visits/{visit}/sessions/{sid}/tilt", visit, sessionId);
    }

    @Override
    public void requestTomographyPreprocessing(long sessionId, String visit, TomographyPreprocessRequest request) {
        post("tomography_preprocess", request, "/visits/{visit}/sessions/{sid}/tomography_preprocess", visit, sessionId);
    }

    @Override
    public void requestSpaPreprocessing(long sessionId, String visit, SpaPreprocessRequest request) {
        post("spa_preprocess", request, "/visits/{visit}/sessions/{sid}/spa_preprocess", visit, sessionId);
    }

    @Override
    public Optional<String> writeEerFractionationFile(long sessionId, String visit, EerFractionationRequest request) {
        return call("write_eer_fractionation_file", () -> rest.post()
                .uri("/visits/{visit}/sessions/{sid}/eer_fractionation_file", visit, sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class))
                .map(node -> node.path("eer_fractionation_file").asText(null));
    }

    @Override
    public Optional<String> suggestPath(long sessionId, String visit, String basePath, boolean touch, String extraDirectory) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("base_path", basePath);
        body.put("touch", touch);
        body.put("extra_directory", extraDirectory);
        return call("suggest_path", () -> rest.post()
                .uri("/visits/{visit}/sessions/{sid}/suggested_path", visit, sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class))
                .map(node -> node.path("suggested_path").asText(null));
    }

    @Override
    public void makeRsyncerDestination(long sessionId, String destination) {
        post("make_rsyncer_destination", Map.of("destination", destination),
                "/sessions/{sid}/make_rsyncer_destination", sessionId);
    }

    @Override
    public void registerRsyncer(long sessionId, RsyncerInfo info) {
        post("register_rsyncer", info, "/sessions/{sid}/rsyncers", sessionId);
    }

    @Override
    public void registerStoppedRsyncer(long sessionId, String source) {
        post("register_stopped_rsyncer", Map.of("source", source), "/sessions/{sid}/rsyncer_stopped", sessionId);
    }

    @Override
    public void registerRestartedRsyncer(long sessionId, String source) {
        post("register_restarted_rsyncer", Map.of("source", source), "/sessions/{sid}/rsyncer_started", sessionId);
    }

    @Override
    public void deleteRsyncer(long sessionId, String source) {
        call("delete_rsyncer", () -> rest.delete()
                .uri("/sessions/{sid}/rsyncer?source={source}", sessionId, source)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void registerDataCollectionGroup(long sessionId, String visit, DataCollectionGroupRequest request) {
        post("register_dc_group", request, "/visits/{visit}/sessions/{sid}/register_data_collection_group", visit, sessionId);
    }

    @Override
    public void startDataCollection(long sessionId, String visit, DataCollectionRequest request) {
        post("start_dc", request, "/visits/{visit}/sessions/{sid}/start_data_collection", visit, sessionId);
    }

    @Override
    public void registerProcessingRecipe(long sessionId, String visit, ProcessingJobRequest request) {
        post("register_proc", request, "/visits/{visit}/sessions/{sid}/register_proc", visit, sessionId);
    }

    @Override
    public void registerProcessingJob(long sessionId, String visit, ProcessingJobRequest request) {
        post("register_processing_job", request, "/visits/{visit}/sessions/{sid}/register_processing_job", visit, sessionId);
    }

    @Override
    public void registerSpaProcessingParameters(long sessionId, String tag, DataCollectionParameters parameters) {
        Map<String, Object> body = objectMapper.convertValue(parameters, new TypeReference<LinkedHashMap<String, Object>>() {
        });
        body.put("tag", tag);
        post("register_spa_proc_params", body, "/sessions/{sid}/spa_processing_parameters", sessionId);
    }

    @Override
    public void flushSpaProcessing(long sessionId, String visit, String tag) {
        post("flush_spa_processing", Map.of("tag", tag), "/visits/{visit}/sessions/{sid}/flush_spa_processing", visit, sessionId);
    }

    @Override
    public void registerTomographyProcessingParameters(long sessionId, DataCollectionParameters parameters) {
        post("register_tomo_proc_params", parameters, "/sessions/{sid}/tomography_processing_parameters", sessionId);
    }

    @Override
    public void flushTomographyProcessing(long sessionId, String visit, String source) {
        post("flush_tomography_processing", Map.of("rsync_source", source),
                "/visits/{visit}/sessions/{sid}/flush_tomography_processing", visit, sessionId);
    }

    @Override
    public void registerSearchMap(long sessionId, String name, SearchMapParameters parameters) {
        post("register_search_map", parameters, "/sessions/{sid}/search_map/{name}", sessionId, name);
    }

    @Override
    public void registerBatchPosition(long sessionId, String name, BatchPositionParameters parameters) {
        post("register_batch_position", parameters, "/sessions/{sid}/batch_position/{name}", sessionId, name);
    }

    @Override
    public void incrementFileCount(String visit, TransferCountUpdate update) {
        post("increment_rsync_file_count", update, "/visits/{visit}/increment_rsync_file_count", visit);
    }

    @Override
    public void incrementTransferredFiles(String visit, TransferCountUpdate update) {
        post("increment_rsync_transferred_files", update, "/visits/{visit}/increment_rsync_transferred_files", visit);
    }

    @Override
    public boolean removeSession(long sessionId) {
        return call("remove_session", () -> rest.delete()
                .uri("/sessions/{sid}", sessionId)
                .retrieve()
                .toBodilessEntity())
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .orElse(false);
    }

    private void post(String operation, Object body, String uri, Object... uriVariables) {
        call(operation, () -> rest.post()
                .uri(uri, uriVariables)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity());
    }

    private <T> Optional<T> call(String operation, Supplier<T> request) {
        try {
            return Optional.ofNullable(request.get());
        } catch (RestClientResponseException e) {
            log.warn("Control plane call {} failed with status {}: {}",
                    operation, e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RestClientException e) {
            log.warn("Control plane call {} failed: {}", operation, e.getMessage());
        }
        return Optional.empty();
    }
}
