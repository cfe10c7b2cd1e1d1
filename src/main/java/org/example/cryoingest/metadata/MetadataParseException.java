package org.example.cryoingest.metadata;

public class MetadataParseException extends Exception {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
