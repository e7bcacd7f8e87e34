package com.phonepe.memoria.core.capability;

/**
 * External capabilities a pipeline step may depend on. Step sequences are validated against the set available in
 * a deployment before they are accepted.
 */
public enum Capability {
    /**
     * Extraction, ranking, sufficiency and summarisation calls
     */
    LLM,
    EMBEDDING,
    VECTOR_INDEX,
    METADATA_WRITE,
    BLOB_READ
}
