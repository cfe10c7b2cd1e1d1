package org.example.cryoingest.model;

import java.util.Locale;

public enum AcquisitionSoftware {
    EPU("epu"),
    TOMO("tomo"),
    SERIALEM("serialem");

    private final String key;

    AcquisitionSoftware(String key) {
        this.key = key;
    }

    /**
     * Name used by the machine configuration and control-plane payloads.
     */
    public String key() {
        return key;
    }

    public static AcquisitionSoftware fromKey(String key) {
        for (AcquisitionSoftware s : values()) {
            if (s.key.equals(key.toLowerCase(Locale.ROOT))) return s;
        }
        throw new IllegalArgumentException("Unknown acquisition software: " + key);
    }
}
