package org.profd.delivery;

import org.profd.api.engine.IArtifact;
import org.profd.api.errors.DeliveryException;
import org.profd.api.errors.SerializationException;
import org.profd.api.queue.ITelemetryQueue;
import org.profd.api.queue.TelemetryQueueException;
import org.profd.session.SessionConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands produced artifacts to their destination.
 * <p>
 * Routing depends on the session configuration and the serialized size:
 * <ul>
 *   <li>telemetry routing disabled: the artifact is written to
 *       {@code <destinationDirectory>/perf.data.encoded.<sequence>} and the sequence advances on success;</li>
 *   <li>telemetry routing enabled, below {@link #INLINE_SUBMISSION_LIMIT}: serialized into memory
 *       and submitted through {@link ITelemetryQueue#submitBytes(String, byte[])};</li>
 *   <li>telemetry routing enabled, at or above the limit: written to an unlinked private temporary
 *       file whose read-only reopened handle goes to {@link ITelemetryQueue#submitFile(String, FileChannel)}.</li>
 * </ul>
 * The sequence counter lives for the whole process, so artifacts from consecutive sessions never
 * share a file name. Only the single active session thread advances it.
 */
public class DeliverySink {

    /**
     * Serialized size from which artifacts go through the file system instead of memory.
     */
    public static final int INLINE_SUBMISSION_LIMIT = 1024 * 1024;

    /**
     * File name prefix of locally stored artifacts; the sequence number follows it.
     */
    public static final String LOCAL_FILE_PREFIX = "perf.data.encoded.";

    private static final Logger LOG = LoggerFactory.getLogger(DeliverySink.class);

    private final ITelemetryQueue telemetryQueue;
    private final String telemetryTag;
    private final AtomicInteger sequence;

    /**
     * @param telemetryQueue The queue used when telemetry routing is enabled.
     * @param telemetryTag   The tag attached to every telemetry submission.
     */
    public DeliverySink(final ITelemetryQueue telemetryQueue, final String telemetryTag) {
        this(telemetryQueue, telemetryTag, 0);
    }

    /**
     * @param telemetryQueue  The queue used when telemetry routing is enabled.
     * @param telemetryTag    The tag attached to every telemetry submission.
     * @param initialSequence The sequence number of the first locally stored artifact.
     */
    public DeliverySink(final ITelemetryQueue telemetryQueue, final String telemetryTag, final int initialSequence) {
        this.telemetryQueue = Objects.requireNonNull(telemetryQueue, "telemetryQueue cannot be null");
        this.telemetryTag = Objects.requireNonNull(telemetryTag, "telemetryTag cannot be null");
        this.sequence = new AtomicInteger(initialSequence);
    }

    /**
     * Delivers one artifact according to the configuration.
     *
     * @param artifact      The artifact to deliver.
     * @param configuration The active session configuration.
     * @throws SerializationException if the artifact cannot be serialized.
     * @throws DeliveryException      if the serialized artifact cannot be handed off.
     */
    public void deliver(final IArtifact artifact, final SessionConfiguration configuration)
            throws SerializationException, DeliveryException {
        Objects.requireNonNull(artifact, "artifact cannot be null");
        if (!configuration.sendToTelemetryQueue()) {
            storeLocally(artifact, Path.of(configuration.destinationDirectory()));
            return;
        }
        final int size = artifact.serializedSize();
        if (size < INLINE_SUBMISSION_LIMIT) {
            submitInline(artifact, size);
        } else {
            submitThroughFile(artifact, size, Path.of(configuration.destinationDirectory()));
        }
    }

    /**
     * Returns the sequence number the next locally stored artifact will get.
     *
     * @return The next sequence number.
     */
    public int nextSequence() {
        return sequence.get();
    }

    /**
     * Returns the local path for the given sequence number.
     *
     * @param destinationDirectory The configured destination directory.
     * @param sequenceNumber       The sequence number.
     * @return The path of the locally stored artifact.
     */
    public static Path localPath(final Path destinationDirectory, final int sequenceNumber) {
        return destinationDirectory.resolve(LOCAL_FILE_PREFIX + sequenceNumber);
    }

    private void storeLocally(final IArtifact artifact, final Path destinationDirectory)
            throws SerializationException, DeliveryException {
        final byte[] data = serialize(artifact, artifact.serializedSize());
        final int current = sequence.get();
        final Path path = localPath(destinationDirectory, current);
        try {
            Files.createDirectories(destinationDirectory);
            Files.write(path, data);
        } catch (final IOException e) {
            throw new DeliveryException(DeliveryException.Kind.LOCAL_WRITE,
                "Could not write artifact to " + path + ": " + e.getMessage(), e);
        }
        sequence.incrementAndGet();
        LOG.debug("Stored artifact #{} ({} bytes) at {}", current, data.length, path);
    }

    private void submitInline(final IArtifact artifact, final int size)
            throws SerializationException, DeliveryException {
        final byte[] data = serialize(artifact, size);
        try {
            telemetryQueue.submitBytes(telemetryTag, data);
        } catch (final TelemetryQueueException e) {
            throw new DeliveryException(DeliveryException.Kind.INLINE_SUBMIT,
                "Telemetry queue failed in-memory submission: " + e.getMessage(), e);
        }
        LOG.debug("Submitted {} bytes in memory with tag '{}'", size, telemetryTag);
    }

    private void submitThroughFile(final IArtifact artifact, final int size, final Path directory)
            throws SerializationException, DeliveryException {
        FileChannel readOnly = null;
        try (UnlinkedTempFile tempFile = UnlinkedTempFile.create(directory)) {
            writeArtifact(artifact, size, tempFile.channel());
            readOnly = tempFile.reopenReadOnly();
        } catch (final IOException e) {
            closeQuietly(readOnly);
            throw new DeliveryException(DeliveryException.Kind.TEMP_FILE,
                "Could not prepare temporary file in " + directory + ": " + e.getMessage(), e);
        }
        try {
            telemetryQueue.submitFile(telemetryTag, readOnly);
        } catch (final TelemetryQueueException e) {
            throw new DeliveryException(DeliveryException.Kind.QUEUE_REJECT,
                "Telemetry queue rejected file submission: " + e.getMessage(), e);
        }
        LOG.debug("Submitted {} bytes through an unlinked file with tag '{}'", size, telemetryTag);
    }

    private static void closeQuietly(final FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (final IOException e) {
            LOG.debug("Could not close read-only channel: {}", e.getMessage());
        }
    }

    private static byte[] serialize(final IArtifact artifact, final int expectedSize) throws SerializationException {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(expectedSize, 0));
        try {
            artifact.writeTo(buffer);
        } catch (final IOException | RuntimeException e) {
            throw new SerializationException("Failed to serialize artifact: " + e.getMessage(), e);
        }
        if (buffer.size() != expectedSize) {
            throw new SerializationException(
                "Artifact announced " + expectedSize + " bytes but produced " + buffer.size());
        }
        return buffer.toByteArray();
    }

    private static void writeArtifact(final IArtifact artifact, final int expectedSize, final FileChannel channel)
            throws SerializationException, IOException {
        final SinkTrackingStream out = new SinkTrackingStream(Channels.newOutputStream(channel));
        try {
            artifact.writeTo(out);
            out.flush();
        } catch (final IOException e) {
            if (out.sinkFailed) {
                throw e;
            }
            throw new SerializationException("Failed to serialize artifact: " + e.getMessage(), e);
        } catch (final RuntimeException e) {
            throw new SerializationException("Failed to serialize artifact: " + e.getMessage(), e);
        }
        if (out.written != expectedSize) {
            throw new SerializationException(
                "Artifact announced " + expectedSize + " bytes but produced " + out.written);
        }
    }

    /**
     * Remembers whether an I/O failure came from the file rather than from the artifact.
     * Does not close the wrapped channel.
     */
    private static final class SinkTrackingStream extends FilterOutputStream {
        private long written;
        private boolean sinkFailed;

        SinkTrackingStream(final OutputStream out) {
            super(out);
        }

        @Override
        public void write(final int b) throws IOException {
            try {
                out.write(b);
            } catch (final IOException e) {
                sinkFailed = true;
                throw e;
            }
            written++;
        }

        @Override
        public void write(final byte[] b, final int off, final int len) throws IOException {
            try {
                out.write(b, off, len);
            } catch (final IOException e) {
                sinkFailed = true;
                throw e;
            }
            written += len;
        }

        @Override
        public void flush() throws IOException {
            try {
                out.flush();
            } catch (final IOException e) {
                sinkFailed = true;
                throw e;
            }
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
