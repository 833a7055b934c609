package com.aether.core.persistence;

/**
 * The history backend could not read or write. Never fatal to live processing when
 * raised by compaction; fatal to the single event when raised by the write-ahead append.
 */
public class HistoryStoreException extends RuntimeException {

    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
