package org.profd.queue;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SpoolDirectoryTelemetryQueueTest {

    @TempDir
    Path tempDir;

    private List<Path> spooled(final Path spool) throws Exception {
        try (Stream<Path> files = Files.list(spool)) {
            return files.sorted().collect(Collectors.toList());
        }
    }

    @Test
    void publishesBytesUnderTaggedName() throws Exception {
        final Path spool = tempDir.resolve("spool");
        final SpoolDirectoryTelemetryQueue queue = new SpoolDirectoryTelemetryQueue(spool);

        queue.submitBytes("perfprofd", new byte[]{9, 8, 7});

        final List<Path> files = spooled(spool);
        assertThat(files).singleElement().satisfies(path -> {
            assertThat(path.getFileName().toString()).startsWith("perfprofd@").endsWith(".dat");
            assertThat(Files.readAllBytes(path)).containsExactly(9, 8, 7);
        });
    }

    @Test
    void copiesReadOnlyFile() throws Exception {
        final Path spool = tempDir.resolve("spool");
        final SpoolDirectoryTelemetryQueue queue = new SpoolDirectoryTelemetryQueue(spool);
        final byte[] payload = new byte[64 * 1024];
        payload[payload.length - 1] = 42;
        final Path source = Files.write(tempDir.resolve("source"), payload);

        queue.submitFile("perfprofd", FileChannel.open(source, StandardOpenOption.READ));
        queue.submitBytes("perfprofd", new byte[]{1});

        final List<Path> files = spooled(spool);
        assertThat(files).hasSize(2);
        assertThat(files).noneMatch(path -> path.getFileName().toString().endsWith(".staging"));
        assertThat(files).anySatisfy(path -> assertThat(Files.readAllBytes(path)).isEqualTo(payload));
    }
}
