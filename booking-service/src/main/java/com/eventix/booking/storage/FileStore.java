package com.eventix.booking.storage;

/**
 * Stores uploaded payment proofs and returns a reference kept on the booking.
 */
public interface FileStore {

    String store(byte[] content, String originalFilename);

    /**
     * Removes a file previously returned by {@link #store}. Unknown references are ignored.
     */
    void delete(String reference);
}
