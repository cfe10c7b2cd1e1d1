package org.example.cryoingest.transfer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies files to a directory on a mounted file system.
 */
@Slf4j
public class LocalCopier implements FileCopier {

    private final Path destinationRoot;

    public LocalCopier(Path destinationRoot) {
        this.destinationRoot = destinationRoot;
    }

    @Override
    public String destination() {
        return destinationRoot.toString();
    }

    @Override
    public CopyResult copy(Path basepath, List<Path> relativeFiles, boolean removeSource) {
        Map<Path, Long> copied = new LinkedHashMap<>();
        boolean clean = true;
        for (Path relative : relativeFiles) {
            Path source = basepath.resolve(relative);
            Path target = destinationRoot.resolve(relative.toString());
            try {
                Files.createDirectories(target.getParent());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                copied.put(relative, Files.size(target));
                if (removeSource) {
                    Files.delete(source);
                }
            } catch (IOException e) {
                log.warn("Could not copy {} to {}: {}", source, target, e.getMessage());
                clean = false;
            }
        }
        return new CopyResult(copied, clean);
    }
}
