package org.example.cryoingest.transfer;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the itemised output of {@code rsync -iiv --progress}.
 * <pre>
 * .f          README.md
 * &lt;f+++++++++ tests/server/test_main.py
 *           3,136 100%    1.50MB/s    0:00:00 (xfr#5, to-chk=109/115)
 * </pre>
 * A {@code .f} line is a file that was already up to date. A {@code <f} or
 * {@code >f} line starts a transfer that is confirmed by the next progress line.
 */
@Slf4j
class RsyncOutputParser {

    private static final int ITEMIZE_WIDTH = 12;

    private final Map<Path, Long> confirmed = new LinkedHashMap<>();
    private Path pending;

    void parse(String stdout) {
        for (String line : stdout.split("\n")) {
            parseLine(line);
        }
    }

    void parseLine(String line) {
        if (line.isEmpty()) return;
        if (line.startsWith("building file list") || line.startsWith("created directory")
                || line.startsWith("sending") || line.startsWith("sent ") || line.startsWith("total ")
                || line.startsWith("cd") || line.startsWith(".d")) {
            return;
        }

        if (line.indexOf('\r') >= 0 || line.contains("(xfr")) {
            String[] parts = line.split("\r");
            String progress = parts[parts.length - 1];
            if (progress.endsWith(" file to consider") || progress.endsWith(" files to consider")) return;
            if (!progress.contains("(xfr")) {
                throw new IllegalStateException("Unexpected rsync progress line: " + progress);
            }
            if (pending == null) {
                log.warn("Progress line without a file being transferred: {}", progress);
                return;
            }
            confirmed.put(pending, Long.parseLong(progress.trim().split("\\s+")[0].replace(",", "")));
            pending = null;
            return;
        }

        if (line.startsWith(".f") || line.startsWith(">f") || line.startsWith("<f")) {
            if (pending != null) {
                log.warn("New file {} while {} is still being transferred", line, pending);
                return;
            }
            if (line.length() <= ITEMIZE_WIDTH) return;
            Path file = Path.of(line.substring(ITEMIZE_WIDTH).strip());
            if (line.charAt(0) == '.') {
                confirmed.put(file, 0L);
            } else {
                pending = file;
            }
        }
    }

    Map<Path, Long> getConfirmed() {
        return confirmed;
    }
}
