package org.example.cryoingest.metadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * SerialEM/Tomo {@code .mdoc} companion file: a global header followed by one
 * {@code [ZValue = n]} block per tilt. Values are kept as raw strings; multi-valued
 * entries such as {@code ImageSize = 4096 4096} are split on demand.
 */
public final class MdocFile {

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm:ss", Locale.ENGLISH);

    private final Map<String, String> global;
    private final List<Map<String, String>> blocks;

    private MdocFile(Map<String, String> global, List<Map<String, String>> blocks) {
        this.global = global;
        this.blocks = blocks;
    }

    public static MdocFile read(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static MdocFile parse(List<String> lines) {
        Map<String, String> global = new LinkedHashMap<>();
        int i = 0;
        for (; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.startsWith("[") || line.isBlank()) break;
            putEntry(global, line);
        }

        List<Map<String, String>> blocks = new ArrayList<>();
        Map<String, String> current = null;
        for (; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.startsWith("[ZValue")) {
                current = new LinkedHashMap<>();
                blocks.add(current);
                continue;
            }
            if (current == null) continue;
            if (line.isBlank()) {
                current = null;
                continue;
            }
            putEntry(current, line);
        }
        return new MdocFile(global, blocks);
    }

    /**
     * Counts {@code [ZValue} headers without retaining block contents.
     */
    public static int countBlocks(Path path) throws IOException {
        int n = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (line.startsWith("[ZValue")) n++;
        }
        return n;
    }

    private static void putEntry(Map<String, String> target, String line) {
        int eq = line.indexOf('=');
        if (eq < 0) return;
        target.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
    }

    public Map<String, String> getGlobal() {
        return Collections.unmodifiableMap(global);
    }

    public List<Map<String, String>> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int numBlocks() {
        return blocks.size();
    }

    public Optional<Map<String, String>> firstBlock() {
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.get(0));
    }

    public List<Double> tiltAngles() {
        List<Double> angles = new ArrayList<>();
        for (Map<String, String> b : blocks) {
            String angle = b.get("TiltAngle");
            if (angle != null) angles.add(Double.parseDouble(angle));
        }
        return angles;
    }

    public static String[] values(String raw) {
        return raw == null ? new String[0] : raw.trim().split("\\s+");
    }

    public static Optional<LocalDateTime> dateTime(Map<String, String> block) {
        String raw = block.get("DateTime");
        if (raw == null) return Optional.empty();
        try {
            return Optional.of(LocalDateTime.parse(raw.trim().replaceAll("\\s+", " "), DATE_TIME));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
