package org.profd.queue;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.profd.api.queue.TelemetryQueueException;

import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class InMemoryTelemetryQueueTest {

    @TempDir
    Path tempDir;

    private final InMemoryTelemetryQueue queue = new InMemoryTelemetryQueue();

    @Test
    void acceptsPayloadJustBelowCeiling() throws TelemetryQueueException {
        queue.submitBytes("tag", new byte[AbstractTelemetryQueue.MAX_INLINE_BYTES - 1]);

        assertThat(queue.entries()).hasSize(1);
    }

    @Test
    void rejectsPayloadAtCeiling() {
        assertThatThrownBy(() -> queue.submitBytes("tag", new byte[AbstractTelemetryQueue.MAX_INLINE_BYTES]))
            .isInstanceOf(TelemetryQueueException.class)
            .hasMessageContaining("exceeds");
        assertThat(queue.entries()).isEmpty();
    }

    @Test
    void acceptsReadOnlyFileAndClosesIt() throws Exception {
        final Path file = Files.write(tempDir.resolve("payload"), new byte[]{1, 2, 3});
        final FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);

        queue.submitFile("tag", channel);

        assertThat(channel.isOpen()).isFalse();
        assertThat(queue.entries()).singleElement().satisfies(entry -> {
            assertThat(entry.fromFile()).isTrue();
            assertThat(entry.data()).containsExactly(1, 2, 3);
        });
    }

    @Test
    void rejectsWritableFileAndClosesIt() throws Exception {
        final Path file = Files.write(tempDir.resolve("payload"), new byte[]{1, 2, 3});
        final FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);

        assertThatThrownBy(() -> queue.submitFile("tag", channel))
            .isInstanceOf(TelemetryQueueException.class)
            .hasMessageContaining("writable");
        assertThat(channel.isOpen()).isFalse();
        assertThat(Files.readAllBytes(file)).containsExactly(1, 2, 3);
        assertThat(queue.entries()).isEmpty();
    }
}
