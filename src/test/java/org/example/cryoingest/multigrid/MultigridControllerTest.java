package org.example.cryoingest.multigrid;

import org.example.cryoingest.analysis.Analyser;
import org.example.cryoingest.context.Context;
import org.example.cryoingest.context.SessionEnvironment;
import org.example.cryoingest.context.SourceEnvironment;
import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.MachineConfig;
import org.example.cryoingest.controlplane.model.DataCollectionGroupRequest;
import org.example.cryoingest.controlplane.model.EerFractionationRequest;
import org.example.cryoingest.controlplane.model.RsyncerInfo;
import org.example.cryoingest.controlplane.model.TransferCountUpdate;
import org.example.cryoingest.model.DataCollectionParameters;
import org.example.cryoingest.model.ProcessingParameters;
import org.example.cryoingest.model.TransferOutcome;
import org.example.cryoingest.model.TransferResult;
import org.example.cryoingest.transfer.TransferEngine;
import org.example.cryoingest.watcher.SourceAnnouncement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MultigridControllerTest {

    private static final long SESSION_ID = 11;
    private static final String VISIT = "cm33333-3";

    @TempDir
    Path root;

    @TempDir
    Path destinationRoot;

    private Path dataDirectory;
    private ControlPlaneClient client;
    private MachineConfig machine;
    private SessionEnvironment session;
    private MultigridController controller;

    @BeforeEach
    void setUp() throws IOException {
        dataDirectory = Files.createDirectories(root.resolve("data"));
        client = mock(ControlPlaneClient.class);
        when(client.currentTimestamp()).thenReturn(Optional.empty());
        when(client.numMovies(anyLong())).thenReturn(Map.of());
        when(client.removeSession(anyLong())).thenReturn(true);
        machine = new MachineConfig();
        machine.setDataDirectories(List.of(dataDirectory.toString()));
        machine.setRsyncBasepath("/dls/m02/data");
        machine.setCreateDirectories(List.of("atlas"));
        machine.setDataRequiredSubstrings(Map.of("epu", Map.of(".tiff", List.of("fractions"))));
        session = new SessionEnvironment(SESSION_ID, VISIT, "m02", client, machine);
        controller = controller(Map.of());
    }

    @AfterEach
    void tearDown() {
        controller.abandon();
        controller.stopMultigridWatcher();
    }

    private MultigridController controller(Map<Path, String> overrides) {
        PipelineSettings settings = PipelineSettings.builder()
                .settlingSeconds(0)
                .scanIntervalSeconds(1)
                .multigridScanIntervalSeconds(1)
                .transferMode(PipelineSettings.TransferMode.LOCAL)
                .localRoot(destinationRoot)
                .build();
        return new MultigridController(session, settings, new ProcessingParameters(), null, overrides);
    }

    private static SourceAnnouncement fractions(Path source) {
        return SourceAnnouncement.builder().source(source).tag(SourceAnnouncement.FRACTIONS).build();
    }

    @Test
    void destinationUsesOverrideFirst() {
        Path source = dataDirectory.resolve("Grid1/Images-Disc1");
        MultigridController overridden = controller(Map.of(source, "custom/destination"));

        assertThat(overridden.destinationFor(fractions(source))).isEqualTo("custom/destination");
        verify(client, never()).suggestPath(anyLong(), anyString(), anyString(), anyBoolean(), anyString());
    }

    @Test
    void gridDirectoriesShareOneSuggestedPath() {
        when(client.suggestPath(anyLong(), anyString(), anyString(), anyBoolean(), anyString()))
                .thenReturn(Optional.of("2024/" + VISIT + "/Grid1/raw"));
        SourceAnnouncement data = fractions(dataDirectory.resolve("Grid1/Images-Disc1"));
        SourceAnnouncement metadata = SourceAnnouncement.builder()
                .source(dataDirectory.resolve(VISIT).resolve("Grid1"))
                .tag(SourceAnnouncement.METADATA)
                .extraDirectory("metadata_Grid1")
                .build();

        assertThat(controller.destinationFor(data)).isEqualTo("2024/" + VISIT + "/Grid1/raw");
        assertThat(controller.destinationFor(metadata)).isEqualTo("2024/" + VISIT + "/Grid1/raw/metadata_Grid1");
        verify(client, times(1)).suggestPath(eq(SESSION_ID), eq(VISIT),
                eq(Year.now().getValue() + "/" + VISIT + "/Grid1/raw"), eq(true), eq(""));
    }

    @Test
    void destinationFallsBackWithoutSuggestion() {
        when(client.suggestPath(anyLong(), anyString(), anyString(), anyBoolean(), anyString()))
                .thenReturn(Optional.empty());
        String year = String.valueOf(Year.now().getValue());

        assertThat(controller.destinationFor(fractions(dataDirectory.resolve("Grid2"))))
                .isEqualTo(year + "/" + VISIT + "/Grid2");
        assertThat(controller.destinationFor(fractions(dataDirectory))).isEqualTo(year + "/" + VISIT);
        assertThat(controller.destinationFor(SourceAnnouncement.builder()
                .source(dataDirectory.resolve(VISIT).resolve("atlas"))
                .tag(SourceAnnouncement.ATLAS)
                .useSuggestedPath(false)
                .build()))
                .isEqualTo(year + "/" + VISIT + "/" + VISIT + "/atlas");
    }

    @Test
    void pipelineCopiesSettledFilesAndReportsCounts() throws IOException {
        when(client.suggestPath(anyLong(), anyString(), anyString(), anyBoolean(), anyString()))
                .thenReturn(Optional.of("2024/" + VISIT + "/Grid1/raw"));
        Path source = Files.createDirectories(dataDirectory.resolve("Grid1/Images-Disc1"));
        Files.writeString(source.resolve("FoilHole_1_Data_2_3_20240101_120000_fractions.tiff"), "movie");

        controller.startPipeline(fractions(source));

        verify(client).makeRsyncerDestination(SESSION_ID, "2024/" + VISIT + "/Grid1/raw");
        ArgumentCaptor<RsyncerInfo> rsyncer = ArgumentCaptor.forClass(RsyncerInfo.class);
        verify(client).registerRsyncer(eq(SESSION_ID), rsyncer.capture());
        assertThat(rsyncer.getValue().getSource()).isEqualTo(source.toString());

        ArgumentCaptor<TransferCountUpdate> transferred = ArgumentCaptor.forClass(TransferCountUpdate.class);
        verify(client, timeout(10_000)).incrementTransferredFiles(eq(VISIT), transferred.capture());
        assertThat(transferred.getValue().getIncrementCount()).isEqualTo(1);
        assertThat(transferred.getValue().getIncrementDataCount()).isEqualTo(1);
        assertThat(destinationRoot.resolve("2024/" + VISIT + "/Grid1/raw/FoilHole_1_Data_2_3_20240101_120000_fractions.tiff"))
                .hasContent("movie");
        verify(client, timeout(10_000).atLeastOnce()).incrementFileCount(eq(VISIT), any());
        assertThat(controller.getTransferEngines()).containsKey(source);
        assertThat(controller.getAnalysers()).isEmpty();
    }

    @Test
    void setupCreatesInstrumentDirectories() throws IOException {
        Path sessionDirectory = dataDirectory.resolve(VISIT);

        controller.setupMultigridWatcher(sessionDirectory, false);

        assertThat(sessionDirectory.resolve("atlas")).isDirectory();
    }

    @Test
    void repeatedAnnouncementStartsOnePipeline() throws IOException {
        Path source = Files.createDirectories(dataDirectory.resolve("Grid1"));

        controller.startPipeline(fractions(source));
        controller.startPipeline(fractions(source));

        verify(client, times(1)).registerRsyncer(eq(SESSION_ID), any());
        assertThat(controller.getWatchers()).hasSize(1);
    }

    @Test
    void failedFileIsRetriedOncePerFailureEpisode() {
        TransferEngine engine = mock(TransferEngine.class);
        Path source = dataDirectory.resolve("Grid1");
        Path movie = Path.of("FoilHole_1_Data_2_3_20240101_120000_fractions.tiff");
        TransferOutcome failed = TransferOutcome.builder()
                .basePath(source).filePath(movie).outcome(TransferResult.FAILURE).build();
        TransferOutcome succeeded = TransferOutcome.builder()
                .basePath(source).filePath(movie).outcome(TransferResult.SUCCESS).build();

        controller.retryFailure(engine, failed);
        controller.retryFailure(engine, failed);
        verify(engine, times(1)).enqueue(movie);

        controller.retryFailure(engine, succeeded);
        controller.retryFailure(engine, failed);
        verify(engine, times(2)).enqueue(movie);
    }

    @Test
    void unknownSourceIsRejected() {
        assertThatThrownBy(() -> controller.stopRsyncer(root.resolve("nowhere")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.flushSkipped(root.resolve("nowhere")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void visitEndTimeReachesEngines() throws IOException {
        Path source = Files.createDirectories(dataDirectory.resolve("Grid1"));
        controller.startPipeline(fractions(source));
        Instant end = Instant.parse("2030-01-01T00:00:00Z");

        controller.updateVisitEndTime(end);

        assertThat(controller.getVisitEndTime()).isEqualTo(end);
    }

    @Test
    void sessionIsRemovedOnceMultigridWatcherEnds() throws IOException {
        machine.setCreateDirectories(List.of());
        Path sessionDirectory = dataDirectory.resolve(VISIT);
        controller.setupMultigridWatcher(sessionDirectory, false);
        assertThat(sessionDirectory).isDirectory();

        assertThat(controller.startMultigridWatcher(false)).isTrue();
        controller.stopMultigridWatcher();

        verify(client, timeout(10_000)).removeSession(SESSION_ID);
        assertThat(controller.isDormant()).isTrue();
    }

    @Test
    void spaFormStartsDataCollectionAndRecipes() {
        SourceEnvironment env = session.addSource(dataDirectory.resolve("Grid1/Images-Disc1"), "2024/" + VISIT + "/Grid1/raw");
        DataCollectionParameters form = DataCollectionParameters.builder()
                .experimentType("SPA")
                .acquisitionSoftware("epu")
                .fileExtension(".tiff")
                .voltage(300.0)
                .build();

        controller.dataCollectionForm(env, mock(Analyser.class), form);

        ArgumentCaptor<DataCollectionGroupRequest> group = ArgumentCaptor.forClass(DataCollectionGroupRequest.class);
        verify(client).registerDataCollectionGroup(eq(SESSION_ID), eq(VISIT), group.capture());
        assertThat(group.getValue().getExperimentTypeId()).isEqualTo(37);
        verify(client).startDataCollection(eq(SESSION_ID), eq(VISIT), any());
        verify(client, times(5)).registerProcessingRecipe(eq(SESSION_ID), eq(VISIT), any());
        verify(client).registerSpaProcessingParameters(eq(SESSION_ID), eq(env.getSource().toString()), any());
        verify(client).flushSpaProcessing(SESSION_ID, VISIT, env.getSource().toString());
        assertThat(env.getParameters().getVoltage()).isEqualTo(300.0);
    }

    @Test
    void tomographyFormConfirmsContextAndWritesEerFile() {
        SourceEnvironment env = session.addSource(dataDirectory.resolve("Tomo1"), "2024/" + VISIT + "/Tomo1");
        Analyser analyser = mock(Analyser.class);
        Context context = mock(Context.class);
        when(analyser.getContext()).thenReturn(context);
        when(client.writeEerFractionationFile(anyLong(), anyString(), any()))
                .thenReturn(Optional.of("/dls/m02/data/processing/eer_fractionation_tomo.txt"));
        DataCollectionParameters form = DataCollectionParameters.builder()
                .experimentType("tomography")
                .acquisitionSoftware("tomo")
                .numEerFrames(600)
                .eerFractionation(20)
                .build();

        controller.dataCollectionForm(env, analyser, form);

        verify(context).parametersConfirmed("/dls/m02/data/2024/" + VISIT + "/Tomo1");
        ArgumentCaptor<EerFractionationRequest> eer = ArgumentCaptor.forClass(EerFractionationRequest.class);
        verify(client).writeEerFractionationFile(eq(SESSION_ID), eq(VISIT), eer.capture());
        assertThat(eer.getValue().getNumFrames()).isEqualTo(600);
        assertThat(eer.getValue().getFractionationFileName()).isEqualTo("eer_fractionation_tomo.txt");
        assertThat(env.getEerFractionationFile()).isEqualTo("/dls/m02/data/processing/eer_fractionation_tomo.txt");
        verify(client).registerTomographyProcessingParameters(eq(SESSION_ID), any());
        verify(client).flushTomographyProcessing(SESSION_ID, VISIT, env.getSource().toString());
    }
}
