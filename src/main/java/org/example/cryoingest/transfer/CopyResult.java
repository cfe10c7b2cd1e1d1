package org.example.cryoingest.transfer;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one copy invocation: the files confirmed copied (relative path to
 * bytes) and whether the copy mechanism itself reported success.
 */
@Getter
@ToString
public class CopyResult {

    private final Map<Path, Long> copied;
    private final boolean clean;

    public CopyResult(Map<Path, Long> copied, boolean clean) {
        this.copied = Collections.unmodifiableMap(new LinkedHashMap<>(copied));
        this.clean = clean;
    }

    public static CopyResult empty() {
        return new CopyResult(Map.of(), true);
    }

    /**
     * Combines two invocations over disjoint file sets.
     */
    public CopyResult and(CopyResult other) {
        Map<Path, Long> all = new LinkedHashMap<>(copied);
        all.putAll(other.copied);
        return new CopyResult(all, clean && other.clean);
    }
}
