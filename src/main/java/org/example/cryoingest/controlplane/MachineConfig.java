package org.example.cryoingest.controlplane;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Instrument configuration served by the control plane. Read-only for the
 * pipeline; unknown keys are ignored.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MachineConfig {

    private boolean superres;
    private Map<String, Map<String, Double>> calibrations = new HashMap<>();
    private List<String> dataDirectories = new ArrayList<>();

    /** software key, then file suffix, then substrings a data file name must contain. */
    private Map<String, Map<String, List<String>>> dataRequiredSubstrings = new HashMap<>();

    private List<String> createDirectories = new ArrayList<>();
    private List<String> analyseCreatedDirectories = new ArrayList<>();
    private String rsyncBasepath = "";
    private String rsyncModule = "data";
    private String rsyncUrl = "";
    private Map<String, String> softwareVersions = new HashMap<>();
    private String camera = "";
    private boolean dataTransferEnabled = true;

    /** Tomography sources only accept acquisition parameters read from an mdoc. */
    private boolean forceMdocMetadata = true;

    /**
     * Pixel size in Angstrom for a nominal magnification, if calibrated.
     */
    public Double magnificationPixelSize(int magnification) {
        Map<String, Double> table = calibrations.get("magnification");
        return table == null ? null : table.get(String.valueOf(magnification));
    }

    /**
     * Required substrings for one software and data suffix, or {@code defaults}
     * when the machine does not configure any.
     */
    public List<String> requiredSubstrings(String software, String suffix, List<String> defaults) {
        Map<String, List<String>> bySuffix = dataRequiredSubstrings.get(software);
        if (bySuffix == null) return defaults;
        List<String> configured = bySuffix.get(suffix);
        return configured == null ? defaults : configured;
    }

    public List<String> allRequiredSubstrings() {
        List<String> all = new ArrayList<>();
        for (Map<String, List<String>> bySuffix : dataRequiredSubstrings.values()) {
            for (List<String> substrings : bySuffix.values()) {
                all.addAll(substrings);
            }
        }
        return all;
    }
}
