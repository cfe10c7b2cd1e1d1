package org.example.cryoingest.analysis;

import org.example.cryoingest.model.AcquisitionSoftware;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Infers the acquisition software from the shape of a file name.
 */
public final class FileClassifier {

    static final Set<String> DATA_SUFFIXES = Set.of(".mrc", ".tiff", ".tif", ".eer");

    private FileClassifier() {
    }

    public static Optional<AcquisitionSoftware> classify(Path file) {
        String name = file.getFileName().toString();
        String[] parts = name.split("_");
        String last = parts[parts.length - 1];

        if (parts[0].startsWith("FoilHole")) {
            return Optional.of(AcquisitionSoftware.EPU);
        }
        if (parts[0].equals("Position") || name.contains("[")
                || last.contains("Fractions") || last.contains("fractions") || last.contains("EER")) {
            return Optional.of(AcquisitionSoftware.TOMO);
        }
        if (!DATA_SUFFIXES.contains(suffix(file))) {
            return Optional.empty();
        }
        for (Path part : file) {
            String p = part.toString();
            if (p.equals("Batch") || p.equals("SearchMaps")) return Optional.empty();
        }
        if (Files.isRegularFile(withSuffix(file, ".jpg"))) {
            return Optional.empty();
        }
        if (hasAveragedDuplicates(file)) {
            return Optional.empty();
        }
        return Optional.of(AcquisitionSoftware.SERIALEM);
    }

    /**
     * Falcon cameras write averaged movies next to the raw one, named after it.
     */
    private static boolean hasAveragedDuplicates(Path file) {
        Path dir = file.getParent();
        if (dir == null || !Files.isDirectory(dir)) return false;
        String name = file.getFileName().toString();
        String suffix = suffix(file);
        int matches = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String n = entry.getFileName().toString();
                if (n.startsWith(name) && n.endsWith(suffix)) matches++;
            }
        } catch (IOException e) {
            return false;
        }
        return matches > 1;
    }

    static String suffix(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }

    static Path withSuffix(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot < 0 ? name : name.substring(0, dot);
        return file.resolveSibling(stem + suffix);
    }
}
