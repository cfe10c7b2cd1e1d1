package org.example.cryoingest.metadata;

import lombok.Getter;
import lombok.ToString;
import org.example.cryoingest.model.SampleInfo;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * Atlas location written by EPU and Tomo as a Windows path, for example
 * {@code X:\data\bi12345-1\atlas\Supervisor_atlas\Sample3\Atlas\Atlas.dm}.
 * Only the part after the visit directory is kept.
 */
@Getter
@ToString
public final class AtlasReference {

    private final Path partialPath;
    private final Integer sample;

    private AtlasReference(Path partialPath, Integer sample) {
        this.partialPath = partialPath;
        this.sample = sample;
    }

    public static Optional<AtlasReference> fromWindowsPath(String windowsPath, String visit) {
        if (windowsPath == null || windowsPath.isBlank()) return Optional.empty();
        String[] parts = windowsPath.trim().split("\\\\");
        int visitIndex = Arrays.asList(parts).indexOf(visit);
        if (visitIndex < 0 || visitIndex == parts.length - 1) return Optional.empty();
        String partial = String.join("/", Arrays.copyOfRange(parts, visitIndex + 1, parts.length));

        Integer sample = null;
        for (String p : parts) {
            if (p.startsWith("Sample")) {
                try {
                    sample = Integer.parseInt(p.substring("Sample".length()));
                } catch (NumberFormatException e) {
                    continue;
                }
                break;
            }
        }
        return Optional.of(new AtlasReference(Path.of(partial), sample));
    }

    /**
     * Reads the atlas of the first sample listed in an {@code EpuSession.dm}.
     */
    public static Optional<AtlasReference> fromEpuSession(Path epuSession, String visit) throws MetadataParseException {
        XmlDocument doc = XmlDocument.parse(epuSession);
        return doc.find("EpuSessionXml", "Samples", "_items")
                .flatMap(items -> XmlDocument.children(items, "SampleXml").stream().findFirst())
                .flatMap(sample -> XmlDocument.childText(sample, "AtlasId"))
                .flatMap(path -> fromWindowsPath(path, visit));
    }

    /**
     * Reads the atlas of a Tomo {@code Session.dm}.
     */
    public static Optional<AtlasReference> fromTomographySession(Path sessionDm, String visit) throws MetadataParseException {
        XmlDocument doc = XmlDocument.parse(sessionDm);
        return doc.text("TomographySession", "AtlasId").flatMap(path -> fromWindowsPath(path, visit));
    }

    public Optional<SampleInfo> toSampleInfo() {
        return sample == null ? Optional.empty() : Optional.of(new SampleInfo(partialPath, sample));
    }
}
