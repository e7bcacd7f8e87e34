package com.phonepe.memoria.core.capability;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads <code>file:</code> URIs and relative paths below a root directory. References escaping the root are
 * rejected.
 */
@Slf4j
public class LocalFileBlobStore implements BlobStore {
    private final Path root;

    public LocalFileBlobStore(@NonNull Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public byte[] read(String uri) {
        final var path = resolve(uri);
        if (!path.startsWith(root)) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT, "Reference outside blob root: " + uri);
        }
        if (!Files.isRegularFile(path)) {
            throw MemoriaException.of(ErrorType.NOT_FOUND, "Blob " + uri);
        }
        try {
            return Files.readAllBytes(path);
        }
        catch (IOException e) {
            log.error("Error reading blob {}: {}", uri, e.getMessage());
            throw MemoriaException.wrap(ErrorType.TRANSIENT_STORE_ERROR, e);
        }
    }

    private Path resolve(String uri) {
        if (uri.startsWith("file:")) {
            return Path.of(URI.create(uri)).toAbsolutePath().normalize();
        }
        return root.resolve(uri).toAbsolutePath().normalize();
    }
}
