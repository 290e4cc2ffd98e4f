package org.profd.queue;

import org.profd.api.queue.TelemetryQueueException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Telemetry queue that persists every accepted entry as a file in a spool directory, where an
 * ingestion agent picks it up. Entries are written under a temporary name and moved into place
 * atomically, so the agent never sees a partial file.
 * <p>
 * File names follow {@code <tag>@<epochMillis>-<counter>.dat}.
 */
public class SpoolDirectoryTelemetryQueue extends AbstractTelemetryQueue {

    private final Path spoolDirectory;
    private final AtomicLong counter = new AtomicLong();

    public SpoolDirectoryTelemetryQueue(final Path spoolDirectory) {
        this.spoolDirectory = spoolDirectory;
    }

    @Override
    protected void storeBytes(final String tag, final byte[] data) throws TelemetryQueueException {
        final Path staging = stagingFile(tag);
        try {
            Files.write(staging, data);
            publish(staging, tag);
        } catch (final IOException e) {
            cleanUp(staging);
            throw new TelemetryQueueException("Could not spool entry '" + tag + "': " + e.getMessage(), e);
        }
    }

    @Override
    protected void storeFile(final String tag, final FileChannel channel) throws TelemetryQueueException {
        final Path staging = stagingFile(tag);
        try (FileChannel out = FileChannel.open(staging, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            final long size = channel.size();
            long transferred = 0;
            while (transferred < size) {
                final long count = channel.transferTo(transferred, size - transferred, out);
                if (count <= 0) {
                    break;
                }
                transferred += count;
            }
        } catch (final IOException e) {
            cleanUp(staging);
            throw new TelemetryQueueException("Could not spool file entry '" + tag + "': " + e.getMessage(), e);
        }
        try {
            publish(staging, tag);
        } catch (final IOException e) {
            cleanUp(staging);
            throw new TelemetryQueueException("Could not publish file entry '" + tag + "': " + e.getMessage(), e);
        }
    }

    public Path getSpoolDirectory() {
        return spoolDirectory;
    }

    private Path stagingFile(final String tag) throws TelemetryQueueException {
        try {
            Files.createDirectories(spoolDirectory);
        } catch (final IOException e) {
            throw new TelemetryQueueException("Spool directory " + spoolDirectory + " is not available", e);
        }
        return spoolDirectory.resolve("." + tag + "-" + counter.incrementAndGet() + ".staging");
    }

    private void publish(final Path staging, final String tag) throws IOException {
        final Path target = spoolDirectory.resolve(tag + "@" + System.currentTimeMillis() + "-" + counter.incrementAndGet() + ".dat");
        Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Spooled entry {}", target.getFileName());
    }

    private void cleanUp(final Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (final IOException e) {
            log.debug("Could not remove staging file {}: {}", staging, e.getMessage());
        }
    }
}
