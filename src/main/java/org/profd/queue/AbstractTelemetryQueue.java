package org.profd.queue;

import org.profd.api.queue.ITelemetryQueue;
import org.profd.api.queue.TelemetryQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.NonWritableChannelException;

/**
 * Base class for telemetry queues that enforces the submission policy shared by all of them:
 * in-memory payloads must stay below {@link #MAX_INLINE_BYTES}, and file submissions must come
 * with a channel that cannot be written to.
 */
public abstract class AbstractTelemetryQueue implements ITelemetryQueue {

    /**
     * Hard ceiling for in-memory submissions.
     */
    public static final int MAX_INLINE_BYTES = 1024 * 1024;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());

    @Override
    public final void submitBytes(final String tag, final byte[] data) throws TelemetryQueueException {
        if (data == null) {
            throw new TelemetryQueueException("Payload is missing");
        }
        if (data.length >= MAX_INLINE_BYTES) {
            throw new TelemetryQueueException(
                "In-memory payload of " + data.length + " bytes exceeds the limit of " + MAX_INLINE_BYTES);
        }
        storeBytes(tag, data);
    }

    @Override
    public final void submitFile(final String tag, final FileChannel readOnly) throws TelemetryQueueException {
        if (readOnly == null) {
            throw new TelemetryQueueException("File handle is missing");
        }
        try (FileChannel channel = readOnly) {
            if (isWritable(channel)) {
                throw new TelemetryQueueException("File handle is writable, only read-only handles are accepted");
            }
            storeFile(tag, channel);
        } catch (final IOException e) {
            throw new TelemetryQueueException("Could not read submitted file: " + e.getMessage(), e);
        }
    }

    /**
     * Stores a validated in-memory payload.
     */
    protected abstract void storeBytes(String tag, byte[] data) throws TelemetryQueueException;

    /**
     * Stores a validated read-only file. The channel is closed by the caller afterwards.
     */
    protected abstract void storeFile(String tag, FileChannel channel) throws TelemetryQueueException, IOException;

    /**
     * Probes a channel with an empty write. Read-only channels refuse it before touching the file.
     */
    static boolean isWritable(final FileChannel channel) throws IOException {
        try {
            channel.write(ByteBuffer.allocate(0), 0);
            return true;
        } catch (final NonWritableChannelException e) {
            return false;
        }
    }
}
