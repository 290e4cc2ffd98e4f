package org.profd.queue;

import org.profd.api.queue.TelemetryQueueException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Telemetry queue that keeps every accepted entry in memory. Useful when the node runs without a
 * spool directory and for inspecting submissions in tests.
 */
public class InMemoryTelemetryQueue extends AbstractTelemetryQueue {

    /**
     * An accepted submission.
     *
     * @param tag      The entry tag.
     * @param data     The payload.
     * @param fromFile Whether the payload was submitted through a file handle.
     */
    public record Entry(String tag, byte[] data, boolean fromFile) {
    }

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    @Override
    protected void storeBytes(final String tag, final byte[] data) {
        entries.add(new Entry(tag, data.clone(), false));
        log.debug("Accepted {} bytes in memory with tag '{}'", data.length, tag);
    }

    @Override
    protected void storeFile(final String tag, final FileChannel channel) throws TelemetryQueueException, IOException {
        final long size = channel.size();
        if (size > Integer.MAX_VALUE) {
            throw new TelemetryQueueException("File of " + size + " bytes is too large to keep in memory");
        }
        final ByteBuffer buffer = ByteBuffer.allocate((int) size);
        long position = 0;
        while (buffer.hasRemaining()) {
            final int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }
        entries.add(new Entry(tag, buffer.array(), true));
        log.debug("Accepted {} bytes from file with tag '{}'", size, tag);
    }

    /**
     * Returns the accepted entries in submission order.
     *
     * @return A copy of the entries.
     */
    public List<Entry> entries() {
        return new ArrayList<>(entries);
    }
}
