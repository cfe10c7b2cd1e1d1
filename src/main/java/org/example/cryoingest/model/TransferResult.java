package org.example.cryoingest.model;

public enum TransferResult {
    SUCCESS,
    FAILURE
}
