package org.profd.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * A temporary file that is removed from the file system namespace right after creation.
 * <p>
 * The sequence is fixed: create a private file, locate its descriptor under
 * {@code /proc/self/fd}, unlink the path, write through the original channel, then reopen the
 * same file read-only through the descriptor's self reference. Once unlinked, no other principal
 * can open the payload by path, and the read-only reopen yields a handle that cannot be used to
 * modify it.
 */
final class UnlinkedTempFile implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(UnlinkedTempFile.class);
    private static final Path PROC_SELF_FD = Path.of("/proc/self/fd");
    private static final String PREFIX = "profd-";
    private static final String SUFFIX = ".tmp";

    private final FileChannel writeChannel;
    private final Path selfReference;

    private UnlinkedTempFile(final FileChannel writeChannel, final Path selfReference) {
        this.writeChannel = writeChannel;
        this.selfReference = selfReference;
    }

    /**
     * Creates and unlinks a private temporary file in the given directory.
     *
     * @param directory The directory to create the file in.
     * @return The open, unlinked file.
     * @throws IOException if the file cannot be created or its descriptor cannot be located.
     */
    static UnlinkedTempFile create(final Path directory) throws IOException {
        Files.createDirectories(directory);
        final Path path = createPrivateFile(directory);
        FileChannel channel = null;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
            final Path selfReference = locateDescriptor(path.toRealPath());
            unlink(path);
            return new UnlinkedTempFile(channel, selfReference);
        } catch (IOException | RuntimeException e) {
            if (channel != null) {
                channel.close();
            }
            Files.deleteIfExists(path);
            throw e;
        }
    }

    /**
     * Returns the writable channel the payload is written through.
     *
     * @return The channel opened at creation time.
     */
    FileChannel channel() {
        return writeChannel;
    }

    /**
     * Opens a second, read-only channel on the same file through its descriptor self reference.
     * The returned channel is independent of this object and must be closed by its owner.
     *
     * @return A read-only channel positioned at the start of the file.
     * @throws IOException if the self reference cannot be opened.
     */
    FileChannel reopenReadOnly() throws IOException {
        writeChannel.force(false);
        return FileChannel.open(selfReference, StandardOpenOption.READ);
    }

    @Override
    public void close() throws IOException {
        writeChannel.close();
    }

    private static Path createPrivateFile(final Path directory) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile(directory, PREFIX, SUFFIX,
                PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        }
        return Files.createTempFile(directory, PREFIX, SUFFIX);
    }

    private static Path locateDescriptor(final Path realPath) throws IOException {
        if (!Files.isDirectory(PROC_SELF_FD)) {
            throw new IOException("Descriptor self references are not available at " + PROC_SELF_FD);
        }
        try (DirectoryStream<Path> descriptors = Files.newDirectoryStream(PROC_SELF_FD)) {
            for (final Path descriptor : descriptors) {
                try {
                    if (realPath.equals(Files.readSymbolicLink(descriptor))) {
                        return descriptor;
                    }
                } catch (final IOException e) {
                    // Descriptors closed while iterating, including the stream's own.
                    LOG.trace("Skipping descriptor {}: {}", descriptor, e.getMessage());
                }
            }
        }
        throw new IOException("No open descriptor found for " + realPath);
    }

    private static void unlink(final Path path) {
        try {
            Files.delete(path);
        } catch (final IOException e) {
            LOG.warn("Could not unlink temporary file {}: {}", path, e.getMessage());
        }
    }
}
