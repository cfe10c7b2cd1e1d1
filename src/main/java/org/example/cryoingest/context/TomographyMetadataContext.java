package org.example.cryoingest.context;

import lombok.extern.slf4j.Slf4j;
import org.example.cryoingest.controlplane.ControlPlaneClient;
import org.example.cryoingest.controlplane.model.BatchPositionParameters;
import org.example.cryoingest.controlplane.model.DataCollectionGroupRequest;
import org.example.cryoingest.controlplane.model.SearchMapParameters;
import org.example.cryoingest.geometry.AffineTransforms;
import org.example.cryoingest.geometry.CameraOrientation;
import org.example.cryoingest.geometry.Vector2;
import org.example.cryoingest.metadata.AtlasReference;
import org.example.cryoingest.metadata.MetadataParseException;
import org.example.cryoingest.metadata.TomographyMetadataParser;
import org.example.cryoingest.model.BatchPositionInfo;
import org.example.cryoingest.model.Role;
import org.example.cryoingest.model.SampleInfo;
import org.example.cryoingest.model.SearchMapInfo;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Places Tomo search maps on the atlas and batch positions on their search map.
 * <p>
 * {@code Session.dm}, {@code SearchMap.xml}, {@code SearchMap.dm} and
 * {@code BatchPositionsList.xml} arrive in any order. Each file contributes what it
 * knows; a position is computed as soon as all of its inputs are present and sent
 * with the next registration.
 */
@Slf4j
public class TomographyMetadataContext implements Context {

    static final String EXPERIMENT_TYPE = "tomo";
    static final int EXPERIMENT_TYPE_ID = 36;

    /** Offset of the atlas origin from its top-left corner, in atlas pixels. */
    static final int ATLAS_CENTRE_OFFSET = 2003;

    private final SourceEnvironment environment;
    private final SessionEnvironment session;
    private final ControlPlaneClient client;

    private final Map<String, SearchMapInfo> searchMaps = new HashMap<>();
    private final Map<String, BatchPositionInfo> pendingBatches = new LinkedHashMap<>();
    private Double atlasPixelSize;
    private boolean groupRegistered;

    public TomographyMetadataContext(SourceEnvironment environment) {
        this.environment = environment;
        this.session = environment.getSession();
        this.client = session.getClient();
    }

    @Override
    public String name() {
        return "TomographyMetadataContext";
    }

    @Override
    public List<String> postTransfer(Path transferredFile, Role role) {
        String name = transferredFile.getFileName().toString();
        try {
            switch (name) {
                case "Session.dm":
                    sessionTransferred(transferredFile);
                    break;
                case "SearchMap.xml":
                    ensureGroupRegistered();
                    searchMapXmlTransferred(transferredFile);
                    break;
                case "SearchMap.dm":
                    ensureGroupRegistered();
                    searchMapDmTransferred(transferredFile);
                    break;
                case "BatchPositionsList.xml":
                    ensureGroupRegistered();
                    batchPositionsTransferred(transferredFile);
                    break;
                default:
                    break;
            }
        } catch (MetadataParseException e) {
            log.warn("Could not read tomography metadata {}: {}", transferredFile, e.getMessage());
        }
        return List.of();
    }

    private String groupTag() {
        return session.dataDirectoryFor(environment.getSource()).toString();
    }

    private void ensureGroupRegistered() {
        if (groupRegistered) return;
        client.registerDataCollectionGroup(session.getSessionId(), session.getVisit(),
                DataCollectionGroupRequest.builder()
                        .experimentType(EXPERIMENT_TYPE)
                        .experimentTypeId(EXPERIMENT_TYPE_ID)
                        .tag(groupTag())
                        .build());
        groupRegistered = true;
    }

    private void sessionTransferred(Path sessionDm) throws MetadataParseException {
        log.info("Tomography session metadata found: {}", sessionDm);
        Optional<AtlasReference> atlas = AtlasReference.fromTomographySession(sessionDm, session.getVisit());
        Optional<SampleInfo> sample = atlas.flatMap(AtlasReference::toSampleInfo);
        if (sample.isEmpty()) {
            log.warn("Sample could not be identified for {}", sessionDm);
            return;
        }
        Path visitDirectory = environment.getSource().getParent();
        Path atlasDirectory = visitDirectory.resolve(sample.get().getAtlas()).getParent();
        Optional<TomographyMetadataParser.AtlasImage> atlasImage = TomographyMetadataParser.findAtlasImage(atlasDirectory);
        if (atlasImage.isEmpty()) {
            log.warn("No atlas image found in {}", atlasDirectory);
        }
        session.putSample(session.dataDirectoryFor(environment.getSource()), sample.get());
        atlasPixelSize = atlasImage.map(TomographyMetadataParser.AtlasImage::getPixelSize).orElse(null);

        client.registerDataCollectionGroup(session.getSessionId(), session.getVisit(),
                DataCollectionGroupRequest.builder()
                        .experimentType(EXPERIMENT_TYPE)
                        .experimentTypeId(EXPERIMENT_TYPE_ID)
                        .tag(groupTag())
                        .atlas(atlasImage.map(a -> session.transferredPath(a.getJpg())).orElse(null))
                        .sample(sample.get().getSample())
                        .atlasPixelSize(atlasPixelSize)
                        .build());
        groupRegistered = true;

        for (SearchMapInfo map : searchMaps.values()) {
            if (map.getXLocation() == null && placeOnAtlas(map)) {
                registerSearchMap(map, fullParameters(map));
            }
        }
    }

    private void searchMapXmlTransferred(Path xml) throws MetadataParseException {
        SearchMapInfo map = searchMap(xml.getParent().getFileName().toString());
        TomographyMetadataParser.readSearchMapXml(xml, map);
        map.setImage(session.transferredPath(xml.resolveSibling("SearchMap.jpg")));
        placeOnAtlas(map);
        registerSearchMap(map, fullParameters(map));
        placePendingBatches(map);
    }

    private void searchMapDmTransferred(Path dm) throws MetadataParseException {
        SearchMapInfo map = searchMap(dm.getParent().getFileName().toString());
        TomographyMetadataParser.readSearchMapDm(dm, map);
        placeOnAtlas(map);
        registerSearchMap(map, fullParameters(map));
        placePendingBatches(map);
    }

    private void batchPositionsTransferred(Path xml) throws MetadataParseException {
        for (BatchPositionInfo batch : TomographyMetadataParser.readBatchPositions(xml)) {
            SearchMapInfo map = searchMap(batch.getSearchMapName());
            // the search map must exist before its batches
            registerSearchMap(map, SearchMapParameters.builder().tag(groupTag()).build());
            BatchPositionInfo placed = placeOnSearchMap(batch, map);
            if (placed.getXLocation() == null) {
                pendingBatches.put(batch.getName(), batch);
            } else {
                pendingBatches.remove(batch.getName());
            }
            registerBatch(placed);
        }
    }

    private SearchMapInfo searchMap(String name) {
        return searchMaps.computeIfAbsent(name, SearchMapInfo::new);
    }

    /**
     * Computes the search map's position and size on the atlas.
     *
     * @return whether the placement could be computed
     */
    boolean placeOnAtlas(SearchMapInfo map) {
        if (!map.placementInputsKnown() || atlasPixelSize == null) {
            log.info("Unable to place search map {} on the atlas yet: stage {}, width {}, atlas pixel size {}",
                    map.getName(), map.getXStagePosition(), map.getWidth(), atlasPixelSize);
            return false;
        }
        Vector2 stage = new Vector2(map.getXStagePosition(), map.getYStagePosition());
        Vector2 v = AffineTransforms.corrected(map.getReference(), map.getStageCorrection(), stage);
        v = CameraOrientation.fromConfig(session.getMachineConfig().getCamera()).apply(v);
        map.setXLocation((int) (v.getX() / atlasPixelSize + ATLAS_CENTRE_OFFSET));
        map.setYLocation((int) (v.getY() / atlasPixelSize + ATLAS_CENTRE_OFFSET));
        map.setAtlasWidth((int) (map.getWidth() * map.getPixelSize() / atlasPixelSize));
        map.setAtlasHeight((int) (map.getHeight() * map.getPixelSize() / atlasPixelSize));
        return true;
    }

    /**
     * Locates a batch position on its search map, in search map pixels, including
     * the beam shift of its exposure area.
     */
    BatchPositionInfo placeOnSearchMap(BatchPositionInfo batch, SearchMapInfo map) {
        if (!map.batchInputsKnown()) {
            log.warn("Incomplete search map {} for position of {}: stage {}, width {}",
                    map.getName(), batch.getName(), map.getXStagePosition(), map.getWidth());
            return batch;
        }
        Vector2 offset = AffineTransforms.relativeOffset(
                map.getReference(),
                map.getStageCorrection(),
                map.getImageShiftCorrection(),
                new Vector2(map.getXStagePosition(), map.getYStagePosition()),
                new Vector2(batch.getXStagePosition(), batch.getYStagePosition()));
        double px = map.getPixelSize();
        Vector2 centre = offset.scale(1 / px).plus(new Vector2(map.getWidth() / 2.0, map.getHeight() / 2.0));
        return batch.toBuilder()
                .xLocation((int) (centre.getX() - batch.getXBeamshift() / px))
                .yLocation((int) (centre.getY() - batch.getYBeamshift() / px))
                .build();
    }

    private void placePendingBatches(SearchMapInfo map) {
        List<BatchPositionInfo> waiting = new ArrayList<>();
        for (BatchPositionInfo b : pendingBatches.values()) {
            if (b.getSearchMapName().equals(map.getName())) waiting.add(b);
        }
        if (waiting.isEmpty() || !map.batchInputsKnown()) return;
        for (BatchPositionInfo b : waiting) {
            pendingBatches.remove(b.getName());
            registerBatch(placeOnSearchMap(b, map));
        }
    }

    private SearchMapParameters fullParameters(SearchMapInfo map) {
        return SearchMapParameters.builder()
                .tag(groupTag())
                .xStagePosition(map.getXStagePosition())
                .yStagePosition(map.getYStagePosition())
                .pixelSize(map.getPixelSize())
                .image(map.getImage())
                .binning(map.getBinning())
                .referenceMatrix(map.getReference() == null ? null : map.getReference().toMap())
                .stageCorrection(map.getStageCorrection() == null ? null : map.getStageCorrection().toMap())
                .imageShiftCorrection(map.getImageShiftCorrection() == null ? null : map.getImageShiftCorrection().toMap())
                .width(map.getWidth())
                .height(map.getHeight())
                .xLocation(map.getXLocation())
                .yLocation(map.getYLocation())
                .widthOnAtlas(map.getAtlasWidth())
                .heightOnAtlas(map.getAtlasHeight())
                .build();
    }

    private void registerSearchMap(SearchMapInfo map, SearchMapParameters parameters) {
        client.registerSearchMap(session.getSessionId(), map.getName(), parameters);
    }

    private void registerBatch(BatchPositionInfo batch) {
        client.registerBatchPosition(session.getSessionId(), batch.getName(),
                BatchPositionParameters.builder()
                        .tag(groupTag())
                        .xStagePosition(batch.getXStagePosition())
                        .yStagePosition(batch.getYStagePosition())
                        .xBeamshift(batch.getXBeamshift())
                        .yBeamshift(batch.getYBeamshift())
                        .searchMapName(batch.getSearchMapName())
                        .xLocation(batch.getXLocation())
                        .yLocation(batch.getYLocation())
                        .build());
    }

    Map<String, SearchMapInfo> getSearchMaps() {
        return searchMaps;
    }
}
