package com.phonepe.memoria.core.model;

/**
 * Kind of content a resource holds. Drives preprocessing.
 */
public enum Modality {
    CONVERSATION,
    DOCUMENT,
    IMAGE,
    AUDIO,
    VIDEO;

    public boolean isTextual() {
        return this == CONVERSATION || this == DOCUMENT;
    }
}
