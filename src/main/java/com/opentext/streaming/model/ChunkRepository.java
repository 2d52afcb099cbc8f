package com.opentext.streaming.model;

import java.util.Optional;

/**
 * Storage of named objects exposed as streams.
 */
public interface ChunkRepository {

    boolean exists(String objectId);

    /** @return a readable over the stored object, or empty when it does not exist */
    Optional<Readable> openReadable(String objectId);

    /**
     * Open a writable replacing the object's content. The new content becomes visible only once the
     * writable finished; an aborted write leaves the previous content untouched.
     */
    Writable openWritable(String objectId);

    void delete(String objectId);
}
