package org.profd.api.queue;

import java.nio.channels.FileChannel;

/**
 * The platform telemetry queue used for centralized ingestion of artifacts.
 * <p>
 * The queue offers two entry points: an in-memory submission for small payloads and a file
 * submission for payloads that exceed the in-memory ceiling.
 */
public interface ITelemetryQueue {

    /**
     * Submits a payload held in memory.
     *
     * @param tag  The entry tag.
     * @param data The payload.
     * @throws TelemetryQueueException if the queue rejects the entry.
     */
    void submitBytes(String tag, byte[] data) throws TelemetryQueueException;

    /**
     * Submits a payload through an open file handle. The queue takes ownership of the channel
     * and closes it, whether the submission succeeds or not. Implementations may reject
     * channels that are open for writing.
     *
     * @param tag      The entry tag.
     * @param readOnly A channel opened for reading only, positioned anywhere.
     * @throws TelemetryQueueException if the queue rejects the entry.
     */
    void submitFile(String tag, FileChannel readOnly) throws TelemetryQueueException;
}
