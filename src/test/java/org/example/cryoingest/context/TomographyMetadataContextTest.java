package org.example.cryoingest.context;

import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.MachineConfig;
import org.example.cryoingest.controlplane.model.BatchPositionParameters;
import org.example.cryoingest.geometry.Matrix2;
import org.example.cryoingest.model.BatchPositionInfo;
import org.example.cryoingest.model.Role;
import org.example.cryoingest.model.SearchMapInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TomographyMetadataContextTest {

    private static final long SESSION_ID = 9;
    private static final String VISIT = "cm40000-2";

    @TempDir
    Path root;

    private ControlPlaneClient client;
    private TomographyMetadataContext context;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        client = mock(ControlPlaneClient.class);
        source = Files.createDirectories(root.resolve(VISIT).resolve("TomoSession"));
        SessionEnvironment session = new SessionEnvironment(SESSION_ID, VISIT, "m02", client, new MachineConfig());
        context = new TomographyMetadataContext(session.addSource(source, "2024/" + VISIT + "/metadata"));
    }

    private static SearchMapInfo searchMap() {
        SearchMapInfo map = new SearchMapInfo("SearchMap_1");
        map.setXStagePosition(0.0);
        map.setYStagePosition(0.0);
        map.setPixelSize(0.5);
        map.setWidth(1000);
        map.setHeight(800);
        map.setReference(Matrix2.IDENTITY);
        map.setStageCorrection(Matrix2.IDENTITY);
        map.setImageShiftCorrection(Matrix2.IDENTITY);
        return map;
    }

    @Test
    void batchIsPlacedRelativeToSearchMapCentre() {
        BatchPositionInfo batch = BatchPositionInfo.builder()
                .name("Position_1")
                .searchMapName("SearchMap_1")
                .xStagePosition(50)
                .yStagePosition(-100)
                .build();

        BatchPositionInfo placed = context.placeOnSearchMap(batch, searchMap());

        assertThat(placed.getXLocation()).isEqualTo(600);
        assertThat(placed.getYLocation()).isEqualTo(200);
    }

    @Test
    void beamShiftMovesExposureArea() {
        BatchPositionInfo area = BatchPositionInfo.builder()
                .name("Position_1_2")
                .searchMapName("SearchMap_1")
                .xStagePosition(50)
                .yStagePosition(-100)
                .xBeamshift(10)
                .build();

        assertThat(context.placeOnSearchMap(area, searchMap()).getXLocation()).isEqualTo(580);
    }

    @Test
    void incompleteSearchMapLeavesBatchUnplaced() {
        SearchMapInfo map = searchMap();
        map.setImageShiftCorrection(null);
        BatchPositionInfo batch = BatchPositionInfo.builder().name("Position_1").searchMapName("SearchMap_1").build();

        assertThat(context.placeOnSearchMap(batch, map).getXLocation()).isNull();
        assertThat(context.placeOnAtlas(map)).isFalse();
    }

    @Test
    void batchesArrivingFirstAreRegisteredWithoutLocation() throws IOException {
        Path list = Files.createDirectories(source.resolve("Batch")).resolve("BatchPositionsList.xml");
        Files.writeString(list, String.join("\n",
                "<BatchPositionsList><BatchPositions>",
                "  <BatchPositionParameters>",
                "    <Name>Position_1</Name>",
                "    <PositionOnTileSet>",
                "      <TileSetName>SearchMap_1</TileSetName>",
                "      <StagePositionX>0.00001</StagePositionX>",
                "      <StagePositionY>0.00002</StagePositionY>",
                "    </PositionOnTileSet>",
                "    <AdditionalExposureTemplateAreas>",
                "      <ExposureTemplateAreaParameters>",
                "        <Name>Position_1_2</Name><PositionX>1e-7</PositionX><PositionY>0</PositionY>",
                "      </ExposureTemplateAreaParameters>",
                "    </AdditionalExposureTemplateAreas>",
                "  </BatchPositionParameters>",
                "</BatchPositions></BatchPositionsList>"));

        context.postTransfer(list, Role.MICROSCOPE);
        context.postTransfer(list, Role.MICROSCOPE);

        verify(client, times(1)).registerDataCollectionGroup(eq(SESSION_ID), eq(VISIT), any());
        verify(client, times(4)).registerSearchMap(eq(SESSION_ID), eq("SearchMap_1"), any());
        ArgumentCaptor<BatchPositionParameters> captor = ArgumentCaptor.forClass(BatchPositionParameters.class);
        verify(client, times(2)).registerBatchPosition(eq(SESSION_ID), eq("Position_1_2"), captor.capture());
        assertThat(captor.getValue().getXLocation()).isNull();
        assertThat(captor.getValue().getXBeamshift()).isEqualTo(1e-7);
        assertThat(captor.getValue().getSearchMapName()).isEqualTo("SearchMap_1");
        assertThat(context.getSearchMaps()).containsOnlyKeys("SearchMap_1");
    }

    @Test
    void unrelatedFilesAreIgnored() throws IOException {
        context.postTransfer(Files.createFile(source.resolve("notes.txt")), Role.MICROSCOPE);

        verify(client, times(0)).registerDataCollectionGroup(anyLong(), anyString(), any());
    }
}
