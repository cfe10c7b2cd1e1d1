package org.example.cryoingest.context;

import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.MachineConfig;
import org.example.cryoingest.controlplane.model.DataCollectionRequest;
import org.example.cryoingest.controlplane.model.TiltSeriesGroupInfo;
import org.example.cryoingest.controlplane.model.TiltSeriesInfo;
import org.example.cryoingest.controlplane.model.TomographyPreprocessRequest;
import org.example.cryoingest.model.AcquisitionSoftware;
import org.example.cryoingest.model.DataCollectionParameters;
import org.example.cryoingest.model.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TomographyContextTest {

    private static final long SESSION_ID = 4;
    private static final String VISIT = "cm12345-1";

    @TempDir
    Path source;

    private ControlPlaneClient client;
    private SessionEnvironment session;
    private SourceEnvironment environment;

    @BeforeEach
    void setUp() {
        client = mock(ControlPlaneClient.class);
        when(client.numMovies(anyLong())).thenReturn(Map.of());
        MachineConfig machine = new MachineConfig();
        machine.setRsyncBasepath("/dls/m02/data");
        session = new SessionEnvironment(SESSION_ID, VISIT, "m02", client, machine);
        environment = session.addSource(source, "2024/" + VISIT + "/raw");
    }

    private Path movie(String position, int index, double angle) {
        return source.resolve(String.format(Locale.ROOT, "%s_%03d[%.2f]_fractions.tiff", position, index, angle));
    }

    private List<Path> tiltSeries(String position, int count) {
        List<Path> movies = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            movies.add(movie(position, i + 1, -60.0 + 3 * i));
        }
        return movies;
    }

    private Path mdoc(String name, int blocks) throws IOException {
        List<String> lines = new ArrayList<>(List.of("PixelSpacing = 1.35", "ImageSize = 4096 4096", "Voltage = 300", ""));
        for (int i = 0; i < blocks; i++) {
            lines.add("[ZValue = " + i + "]");
            lines.add("TiltAngle = " + (-60.0 + 3 * i));
            lines.add("Magnification = 105000");
            lines.add("");
        }
        return Files.write(source.resolve(name + ".mdoc"), lines);
    }

    @Test
    void seriesCompletesOnceAfterLastMovieWhenMdocArrivesFirst() throws IOException {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);
        List<Path> movies = tiltSeries("Position_1", 41);
        Collections.shuffle(movies, new Random(7));

        assertThat(context.postTransfer(mdoc("Position_1", 41), Role.DETECTOR)).isEmpty();
        for (Path movie : movies.subList(0, 40)) {
            assertThat(context.postTransfer(movie, Role.DETECTOR)).isEmpty();
        }
        verify(client, never()).registerCompletedTiltSeries(anyLong(), anyString(), any());

        assertThat(context.postTransfer(movies.get(40), Role.DETECTOR)).containsExactly("Position_1");

        ArgumentCaptor<TiltSeriesGroupInfo> captor = ArgumentCaptor.forClass(TiltSeriesGroupInfo.class);
        verify(client, times(1)).registerCompletedTiltSeries(eq(SESSION_ID), eq(VISIT), captor.capture());
        assertThat(captor.getValue().getTags()).containsExactly("Position_1");
        assertThat(captor.getValue().getTiltSeriesLengths()).containsExactly(41);
        verify(client, times(41)).registerTilt(eq(SESSION_ID), eq(VISIT), any());
        verify(client, times(1)).registerTiltSeries(SESSION_ID, new TiltSeriesInfo("Position_1", source.toString()));
    }

    @Test
    void seriesCompletesWhenMdocArrivesLast() throws IOException {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);
        for (Path movie : tiltSeries("Position_1", 41)) {
            assertThat(context.postTransfer(movie, Role.DETECTOR)).isEmpty();
        }

        assertThat(context.postTransfer(mdoc("Position_1", 41), Role.DETECTOR)).containsExactly("Position_1");
        verify(client, times(1)).registerCompletedTiltSeries(eq(SESSION_ID), eq(VISIT), any());
        verify(client).registerTiltSeriesLength(SESSION_ID,
                new TiltSeriesGroupInfo(List.of("Position_1"), source.toString(), List.of(41)));
    }

    @Test
    void lateMovieReopensSeriesAndCompletesItAgain() throws IOException {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);
        context.postTransfer(mdoc("Position_1", 41), Role.DETECTOR);
        tiltSeries("Position_1", 41).forEach(m -> context.postTransfer(m, Role.DETECTOR));

        List<String> completed = context.postTransfer(movie("Position_1", 42, 63.0), Role.DETECTOR);

        verify(client, times(1)).registerTiltSeriesForRerun(SESSION_ID,
                new TiltSeriesInfo("Position_1", source.toString()));
        assertThat(completed).containsExactly("Position_1");
        ArgumentCaptor<TiltSeriesGroupInfo> captor = ArgumentCaptor.forClass(TiltSeriesGroupInfo.class);
        verify(client, times(2)).registerCompletedTiltSeries(eq(SESSION_ID), eq(VISIT), captor.capture());
        assertThat(captor.getAllValues().get(1).getTiltSeriesLengths()).containsExactly(42);
    }

    @Test
    void repeatedMovieIsIgnored() {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);
        Path movie = movie("Position_1", 1, 0.0);

        context.postTransfer(movie, Role.DETECTOR);
        context.postTransfer(movie, Role.DETECTOR);

        verify(client, times(1)).registerTilt(eq(SESSION_ID), eq(VISIT), any());
        assertThat(context.getTiltSeries().get("Position_1").size()).isEqualTo(1);
    }

    @Test
    void moviesWithoutRequiredSubstringOrFromMicroscopeAreIgnored() {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);

        context.postTransfer(source.resolve("Position_1_001[0.00].tiff"), Role.DETECTOR);
        context.postTransfer(movie("Position_1", 1, 0.0), Role.MICROSCOPE);
        context.postTransfer(source.resolve("gain_fractions.tiff"), Role.DETECTOR);

        verify(client, never()).registerTiltSeries(anyLong(), any());
        assertThat(context.getTiltSeries()).isEmpty();
    }

    @Test
    void preprocessingCarriesTransferredPathAndImageNumbers() {
        when(client.numMovies(SESSION_ID)).thenReturn(Map.of(source.toString(), 10));
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);

        context.postTransfer(movie("Position_1", 1, 0.0), Role.DETECTOR);

        ArgumentCaptor<TomographyPreprocessRequest> captor = ArgumentCaptor.forClass(TomographyPreprocessRequest.class);
        verify(client).requestTomographyPreprocessing(eq(SESSION_ID), eq(VISIT), captor.capture());
        assertThat(captor.getValue().getImageNumber()).isEqualTo(11);
        assertThat(captor.getValue().getPath())
                .isEqualTo("/dls/m02/data/2024/" + VISIT + "/raw/Position_1_001[0.00]_fractions.tiff");
        assertThat(captor.getValue().getTag()).isEqualTo("Position_1");
    }

    @Test
    void firstSeriesSeenAfterConfirmationIsNotRegistered() {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);
        context.parametersConfirmed("/dls/m02/data/2024/" + VISIT + "/raw");

        context.postTransfer(movie("Position_1", 1, 0.0), Role.DETECTOR);
        verify(client, never()).startDataCollection(anyLong(), anyString(), any());

        context.postTransfer(movie("Position_2", 1, 0.0), Role.DETECTOR);
        ArgumentCaptor<DataCollectionRequest> captor = ArgumentCaptor.forClass(DataCollectionRequest.class);
        verify(client, times(1)).startDataCollection(eq(SESSION_ID), eq(VISIT), captor.capture());
        assertThat(captor.getValue().getTag()).isEqualTo("Position_2");
        verify(client, times(2)).registerProcessingJob(eq(SESSION_ID), eq(VISIT), any());
    }

    @Test
    void confirmationRegistersSeriesSeenSoFar() {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);
        context.postTransfer(movie("Position_1", 1, 0.0), Role.DETECTOR);
        context.postTransfer(movie("Position_2", 1, 0.0), Role.DETECTOR);
        verify(client, never()).startDataCollection(anyLong(), anyString(), any());

        context.parametersConfirmed("/dls/m02/data/2024/" + VISIT + "/raw");

        verify(client, times(2)).startDataCollection(eq(SESSION_ID), eq(VISIT), any());
        verify(client, times(4)).registerProcessingJob(eq(SESSION_ID), eq(VISIT), any());
    }

    @Test
    void serialEmSeriesCompletesWhenAcquisitionMovesOn() {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.SERIALEM, environment);
        for (int i = 0; i < 3; i++) {
            assertThat(context.postTransfer(source.resolve("tomo_1_" + (i * 3) + ".0.mrc"), Role.DETECTOR)).isEmpty();
        }

        List<String> completed = context.postTransfer(source.resolve("tomo_2_-3.0.mrc"), Role.DETECTOR);

        assertThat(completed).containsExactly("1");
    }

    @Test
    void gatherMetadata_readsMdoc() throws IOException {
        environment.setParameters(DataCollectionParameters.builder().dosePerFrame(1.5).build());
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);

        DataCollectionParameters params = context.gatherMetadata(mdoc("Position_1", 41)).orElseThrow();

        assertThat(params.getVoltage()).isEqualTo(300.0);
        assertThat(params.getMagnification()).isEqualTo(105000);
        assertThat(params.getImageSizeX()).isEqualTo(4096);
        assertThat(params.getPixelSizeOnImage()).isCloseTo(1.35e-10, within(1e-16));
        assertThat(params.getDosePerFrame()).isEqualTo(1.5);
        assertThat(params.getManualTiltOffset()).isZero();
        assertThat(params.getGainRef()).endsWith("/" + VISIT + "/processing/gain.mrc");
    }

    @Test
    void gatherMetadata_ignoresMissingOrUnsupportedFiles() {
        TomographyContext context = new TomographyContext(AcquisitionSoftware.TOMO, environment);

        assertThat(context.gatherMetadata(source.resolve("missing.mdoc"))).isEmpty();
        assertThat(context.gatherMetadata(source.resolve("movie.tiff"))).isEmpty();
    }
}
