package com.opentext.streaming.repository;

import com.opentext.streaming.model.ChunkRepository;
import com.opentext.streaming.model.Readable;
import com.opentext.streaming.model.Writable;
import com.opentext.streaming.service.StreamFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * File-system based repository of streamed objects.
 * <p>
 * Key properties:
 * - Objects are read in fixed-size chunks; nothing is loaded into memory as a whole.
 * - Writes go to a temporary file that is atomically moved into place on finish.
 * - Concurrent writers of one object each get their own temporary file; the last to finish wins.
 * </p>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FileChunkRepository implements ChunkRepository {

    private static final String DATA_SUFFIX = ".data";
    private static final String TEMP_SUFFIX = ".tmp";

    private final StreamFactory streamFactory;

    @Value("${data.storage.dir:/tmp/chunk-streams}")
    private String baseDirPath = "/tmp/chunk-streams";

    @Value("${repository.chunk.size:8192}")
    private int chunkSize = 8192;

    /** Resolve and ensure the base directory exists. */
    private Path getBaseDir() {
        Path baseDir = Paths.get(baseDirPath);
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize repository", e);
        }
        return baseDir;
    }

    public Path resolve(String objectId) {
        return getBaseDir().resolve(objectId + DATA_SUFFIX);
    }

    @Override
    public boolean exists(String objectId) {
        return Files.exists(resolve(objectId));
    }

    @Override
    public Optional<Readable> openReadable(String objectId) {
        Path dataPath = resolve(objectId);
        if (!Files.exists(dataPath)) {
            return Optional.empty();
        }
        return Optional.of(streamFactory.readable(new FileChunkSource(dataPath, chunkSize)));
    }

    @Override
    public Writable openWritable(String objectId) {
        Path baseDir = getBaseDir();
        try {
            Path tempPath = Files.createTempFile(baseDir, objectId + DATA_SUFFIX + ".", TEMP_SUFFIX);
            return streamFactory.writable(new FileChunkSink(baseDir.resolve(objectId + DATA_SUFFIX), tempPath, chunkSize));
        } catch (IOException e) {
            log.error("Failed to open {} for writing", objectId, e);
            throw new UncheckedIOException("Open failed for " + objectId, e);
        }
    }

    /** Delete the object and any temporary files left by interrupted writes. */
    @Override
    public void delete(String objectId) {
        Path baseDir = getBaseDir();
        try {
            Files.deleteIfExists(baseDir.resolve(objectId + DATA_SUFFIX));
            try (DirectoryStream<Path> temps = Files.newDirectoryStream(baseDir, objectId + DATA_SUFFIX + ".*" + TEMP_SUFFIX)) {
                for (Path temp : temps) {
                    Files.deleteIfExists(temp);
                }
            }
            log.info("Deleted object files for ID: {}", objectId);
        } catch (IOException e) {
            log.warn("Failed to delete files for {}: {}", objectId, e.getMessage());
        }
    }
}
