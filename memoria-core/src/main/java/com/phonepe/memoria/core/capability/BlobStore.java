package com.phonepe.memoria.core.capability;

/**
 * Resolves a resource reference to raw bytes. The engine makes no assumption about the medium behind it.
 */
public interface BlobStore {
    /**
     * @throws com.phonepe.memoria.core.errors.MemoriaException with NOT_FOUND if the reference does not resolve
     */
    byte[] read(String uri);
}
